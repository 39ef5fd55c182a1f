package org.rangecache.backend.model;

public class QueryRequest {

  private String table;
  private String filter;
  private String select;
  private Integer top;
  private int skip;
  private String orderby;
  private boolean count;
  private String period;

  public QueryRequest() {}

  public QueryRequest(String table, String filter) {
    this.table = table;
    this.filter = filter;
  }

  public String getTable() {
    return table;
  }

  public void setTable(String table) {
    this.table = table;
  }

  public String getFilter() {
    return filter;
  }

  public void setFilter(String filter) {
    this.filter = filter;
  }

  public String getSelect() {
    return select;
  }

  public void setSelect(String select) {
    this.select = select;
  }

  /** Null means no limit. */
  public Integer getTop() {
    return top;
  }

  public void setTop(Integer top) {
    this.top = top;
  }

  public int getSkip() {
    return skip;
  }

  public void setSkip(int skip) {
    this.skip = skip;
  }

  public String getOrderby() {
    return orderby;
  }

  public void setOrderby(String orderby) {
    this.orderby = orderby;
  }

  public boolean isCount() {
    return count;
  }

  public void setCount(boolean count) {
    this.count = count;
  }

  /** Named report period (mtd, ytd, ...) applied on the table's date column. */
  public String getPeriod() {
    return period;
  }

  public void setPeriod(String period) {
    this.period = period;
  }
}
