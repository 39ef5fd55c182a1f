package org.rangecache.backend.model;

import java.util.List;
import java.util.Map;

public class AnalysisResult {

  private final String table;
  private final int records;
  private final int groups;
  private final List<Map<String, Object>> rows;

  public AnalysisResult(String table, int records, int groups, List<Map<String, Object>> rows) {
    this.table = table;
    this.records = records;
    this.groups = groups;
    this.rows = rows;
  }

  public String getTable() {
    return table;
  }

  /** Cached rows that passed the filter and went into the aggregation. */
  public int getRecords() {
    return records;
  }

  /** Result rows before the limit was applied. */
  public int getGroups() {
    return groups;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }
}
