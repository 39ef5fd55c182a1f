package org.rangecache.backend.model;

import java.time.Instant;
import java.util.List;

public class CacheEntrySummary {

  private String table;
  private CacheMode mode;
  private int rowCount;
  private DateRange covered;
  private boolean complete;
  private List<String> columns;
  private Instant lastMergedAt;

  public CacheEntrySummary() {}

  public CacheEntrySummary(String table, CacheMode mode, int rowCount, DateRange covered,
      boolean complete, List<String> columns, Instant lastMergedAt) {
    this.table = table;
    this.mode = mode;
    this.rowCount = rowCount;
    this.covered = covered;
    this.complete = complete;
    this.columns = columns;
    this.lastMergedAt = lastMergedAt;
  }

  public String getTable() {
    return table;
  }

  public void setTable(String table) {
    this.table = table;
  }

  public CacheMode getMode() {
    return mode;
  }

  public void setMode(CacheMode mode) {
    this.mode = mode;
  }

  public int getRowCount() {
    return rowCount;
  }

  public void setRowCount(int rowCount) {
    this.rowCount = rowCount;
  }

  public DateRange getCovered() {
    return covered;
  }

  public void setCovered(DateRange covered) {
    this.covered = covered;
  }

  public boolean isComplete() {
    return complete;
  }

  public void setComplete(boolean complete) {
    this.complete = complete;
  }

  public List<String> getColumns() {
    return columns;
  }

  public void setColumns(List<String> columns) {
    this.columns = columns;
  }

  public Instant getLastMergedAt() {
    return lastMergedAt;
  }

  public void setLastMergedAt(Instant lastMergedAt) {
    this.lastMergedAt = lastMergedAt;
  }
}
