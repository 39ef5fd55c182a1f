package org.rangecache.backend.cache;

import java.util.List;
import java.util.Map;
import org.rangecache.backend.model.DateRange;

/** Point-in-time copy of a {@link CacheEntry}, safe to read without the table lock. */
public class CacheSnapshot {

  private final String table;
  private final String dateColumn;
  private final DateRange covered;
  private final List<Map<String, Object>> rows;
  private final List<String> columns;
  private final boolean complete;

  CacheSnapshot(String table, String dateColumn, DateRange covered, List<Map<String, Object>> rows,
      List<String> columns, boolean complete) {
    this.table = table;
    this.dateColumn = dateColumn;
    this.covered = covered;
    this.rows = rows;
    this.columns = columns;
    this.complete = complete;
  }

  public String getTable() {
    return table;
  }

  public String getDateColumn() {
    return dateColumn;
  }

  public DateRange getCovered() {
    return covered;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public List<String> getColumns() {
    return columns;
  }

  public boolean isComplete() {
    return complete;
  }
}
