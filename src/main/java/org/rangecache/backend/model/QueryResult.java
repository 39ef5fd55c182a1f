package org.rangecache.backend.model;

import java.util.List;
import java.util.Map;

public class QueryResult {

  private final String table;
  private final List<Map<String, Object>> rows;
  private final Long count;
  private final CacheVerdict verdict;
  private final int fetches;
  private final DateRange covered;

  public QueryResult(String table, List<Map<String, Object>> rows, Long count,
      CacheVerdict verdict, int fetches, DateRange covered) {
    this.table = table;
    this.rows = rows;
    this.count = count;
    this.verdict = verdict;
    this.fetches = fetches;
    this.covered = covered;
  }

  public String getTable() {
    return table;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  /** Matching rows before paging, or null when no count was requested. */
  public Long getCount() {
    return count;
  }

  public CacheVerdict getVerdict() {
    return verdict;
  }

  /** Remote calls made to answer this request (cache fills plus bypass). */
  public int getFetches() {
    return fetches;
  }

  /** Covered window of the cache entry after the request; null for bypassed requests. */
  public DateRange getCovered() {
    return covered;
  }
}
