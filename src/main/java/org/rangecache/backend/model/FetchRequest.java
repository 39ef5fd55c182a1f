package org.rangecache.backend.model;

/**
 * One call to the remote source. {@code filter} is already in remote syntax; {@code select} and
 * {@code orderby} carry plain field names and are quoted by the fetcher. A null {@code top} means
 * "every matching row".
 */
public class FetchRequest {

  private final String table;
  private final String filter;
  private final String select;
  private final String orderby;
  private final Integer top;
  private final int skip;
  private final boolean count;

  public FetchRequest(String table, String filter, String select, String orderby,
      Integer top, int skip, boolean count) {
    this.table = table;
    this.filter = filter;
    this.select = select;
    this.orderby = orderby;
    this.top = top;
    this.skip = skip;
    this.count = count;
  }

  /** Full-column, unpaged fetch used to fill the cache. */
  public static FetchRequest allRows(String table, String filter) {
    return new FetchRequest(table, filter, null, null, null, 0, false);
  }

  public String getTable() {
    return table;
  }

  public String getFilter() {
    return filter;
  }

  public String getSelect() {
    return select;
  }

  public String getOrderby() {
    return orderby;
  }

  public Integer getTop() {
    return top;
  }

  public int getSkip() {
    return skip;
  }

  public boolean isCount() {
    return count;
  }

  @Override
  public String toString() {
    return "FetchRequest{table=" + table + ", filter=" + filter + ", select=" + select
        + ", orderby=" + orderby + ", top=" + top + ", skip=" + skip + ", count=" + count + "}";
  }
}
