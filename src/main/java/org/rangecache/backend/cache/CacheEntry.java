package org.rangecache.backend.cache;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.rangecache.backend.filter.RowValues;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.CacheMode;
import org.rangecache.backend.model.DateRange;

/**
 * Cached state of one table: the covered date window, the rows keyed by identity, and every
 * column seen so far. Only {@link CacheStore} mutates it.
 *
 * <p>A row's identity is its key column value when the table has one and the row carries it.
 * Re-inserting a known identity replaces the old row. Rows without a key are never merged with
 * each other: identical rows are distinct records on the remote side too.
 */
public class CacheEntry {

  private final String table;
  private final CacheMode mode;
  private final String dateColumn;
  private final String keyColumn;

  private final Map<List<Object>, Map<String, Object>> rows = new LinkedHashMap<>();
  private final LinkedHashSet<String> columns = new LinkedHashSet<>();
  private DateRange covered = DateRange.empty();
  private boolean complete;
  private Instant lastMergedAt;
  private long nextSeq;

  CacheEntry(String table, CacheConfig config) {
    this.table = table;
    this.mode = config.getMode();
    this.dateColumn = config.getDateColumn();
    this.keyColumn = config.getKeyColumn();
  }

  public String getTable() {
    return table;
  }

  public CacheMode getMode() {
    return mode;
  }

  public String getDateColumn() {
    return dateColumn;
  }

  public synchronized DateRange getCovered() {
    return covered;
  }

  public synchronized int getRowCount() {
    return rows.size();
  }

  public synchronized List<String> getColumns() {
    return new ArrayList<>(columns);
  }

  /** True once a CACHE_ALL table has been loaded in full. */
  public synchronized boolean isComplete() {
    return complete;
  }

  public synchronized Instant getLastMergedAt() {
    return lastMergedAt;
  }

  public synchronized CacheSnapshot snapshot() {
    return new CacheSnapshot(table, dateColumn, covered, new ArrayList<>(rows.values()),
        new ArrayList<>(columns), complete);
  }

  /** Applies one fetched slice. Rows must already be immutable copies. */
  synchronized void apply(FetchTask task, List<Map<String, Object>> fetched, Instant now) {
    switch (task.getReason()) {
      case TODAY_REFRESH:
        removeRowsOn(task.getRange().getStart());
        break;
      case FULL_LOAD:
        rows.clear();
        break;
      default:
        break;
    }

    for (Map<String, Object> row : fetched) {
      List<Object> key = keyOf(row);
      // remove first so a replaced row moves to the end of the iteration order
      rows.remove(key);
      rows.put(key, row);
      columns.addAll(row.keySet());
    }

    if (task.getReason() == FetchReason.FULL_LOAD) {
      complete = true;
    } else {
      covered = covered.union(task.getRange());
    }
    lastMergedAt = now;
  }

  private int removeRowsOn(LocalDate day) {
    int removed = 0;
    Iterator<Map<String, Object>> it = rows.values().iterator();
    while (it.hasNext()) {
      if (day.equals(RowValues.toLocalDate(it.next().get(dateColumn)))) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  private List<Object> keyOf(Map<String, Object> row) {
    if (keyColumn != null) {
      Object id = row.get(keyColumn);
      if (id != null) return Arrays.asList("id", RowValues.text(id));
    }
    return Arrays.asList("seq", nextSeq++);
  }
}
