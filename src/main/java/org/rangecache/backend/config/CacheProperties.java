package org.rangecache.backend.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.rangecache.backend.model.CacheMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

  /** Zone that decides what "today" is. Empty means the system zone. */
  private String zone;

  private int rowWarningThreshold = 50_000;

  private Map<String, TableProperties> tables = new LinkedHashMap<>();

  public String getZone() {
    return zone;
  }

  public void setZone(String zone) {
    this.zone = zone;
  }

  public int getRowWarningThreshold() {
    return rowWarningThreshold;
  }

  public void setRowWarningThreshold(int rowWarningThreshold) {
    this.rowWarningThreshold = rowWarningThreshold;
  }

  public Map<String, TableProperties> getTables() {
    return tables;
  }

  public void setTables(Map<String, TableProperties> tables) {
    this.tables = tables;
  }

  /** Per-table settings; also the body of the reconfiguration endpoint. */
  public static class TableProperties {
    private CacheMode mode = CacheMode.NONE;
    private String dateColumn;
    private String keyColumn;
    private String description;

    public CacheMode getMode() {
      return mode;
    }

    public void setMode(CacheMode mode) {
      this.mode = mode;
    }

    public String getDateColumn() {
      return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
      this.dateColumn = dateColumn;
    }

    public String getKeyColumn() {
      return keyColumn;
    }

    public void setKeyColumn(String keyColumn) {
      this.keyColumn = keyColumn;
    }

    public String getDescription() {
      return description;
    }

    public void setDescription(String description) {
      this.description = description;
    }
  }
}
