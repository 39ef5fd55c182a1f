package org.rangecache.backend.model;

import java.util.List;
import java.util.Map;

public class FetchResult {

  private final List<Map<String, Object>> rows;
  private final Long count;

  public FetchResult(List<Map<String, Object>> rows, Long count) {
    this.rows = (rows != null) ? rows : List.of();
    this.count = count;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  /** Total matching rows reported by the remote side, or null when it was not requested. */
  public Long getCount() {
    return count;
  }
}
