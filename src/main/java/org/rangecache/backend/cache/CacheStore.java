package org.rangecache.backend.cache;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.rangecache.backend.model.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table name to {@link CacheEntry} map. Owns every mutation of cached state.
 *
 * <p>Each table has one {@link ReentrantLock}; callers hold it across plan, fetch and merge so
 * only one merge per table is ever in flight. Flushing does not take the lock: it detaches the
 * entry, and a request already holding a reference finishes against the detached state.
 *
 * <p>Entries are never evicted by size or age. Crossing {@code rowWarningThreshold} only logs.
 */
public class CacheStore {

  private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

  private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final Clock clock;
  private final int rowWarningThreshold;

  public CacheStore(Clock clock, int rowWarningThreshold) {
    this.clock = clock;
    this.rowWarningThreshold = rowWarningThreshold;
  }

  public Optional<CacheEntry> get(String table) {
    return Optional.ofNullable(entries.get(table));
  }

  /** Existing entry for {@code table}, created empty on first use. */
  public CacheEntry open(String table, CacheConfig config) {
    return entries.computeIfAbsent(table, t -> {
      log.info("🆕 Created cache entry for table={} ({})", t, config);
      return new CacheEntry(t, config);
    });
  }

  public ReentrantLock lockFor(String table) {
    return locks.computeIfAbsent(table, t -> new ReentrantLock());
  }

  /**
   * Merges one fetched slice into {@code entry}. Gap rows are added and the covered range grows;
   * a today refresh first drops every cached row dated on that day; a full load replaces all rows.
   * The known column set only ever grows.
   */
  public void merge(CacheEntry entry, FetchTask task, List<Map<String, Object>> fetched) {
    List<Map<String, Object>> frozen = new ArrayList<>(fetched.size());
    for (Map<String, Object> row : fetched) {
      frozen.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }

    int before = entry.getRowCount();
    entry.apply(task, frozen, clock.instant());
    int after = entry.getRowCount();

    log.info("✅ Merged {} rows into table={} task={} rows {} -> {}, covered={}",
        frozen.size(), entry.getTable(), task, before, after, entry.getCovered());

    if (after > rowWarningThreshold && before <= rowWarningThreshold) {
      log.warn("⚠️ Cache for table={} holds {} rows (threshold {}). Flush it if memory is a concern.",
          entry.getTable(), after, rowWarningThreshold);
    }
  }

  /** Returns the number of rows dropped, or -1 when the table had no entry. */
  public int flush(String table) {
    CacheEntry removed = entries.remove(table);
    if (removed == null) {
      log.info("🧹 Flush table={}: nothing cached", table);
      return -1;
    }
    int rows = removed.getRowCount();
    log.info("🧹 Flushed table={} ({} rows)", table, rows);
    return rows;
  }

  /** Returns the number of entries dropped. */
  public int flushAll() {
    int count = 0;
    for (String table : new ArrayList<>(entries.keySet())) {
      if (entries.remove(table) != null) count++;
    }
    log.info("🧹 Flushed {} table cache(s)", count);
    return count;
  }

  public List<CacheEntry> entries() {
    List<CacheEntry> out = new ArrayList<>(entries.values());
    out.sort((a, b) -> a.getTable().compareTo(b.getTable()));
    return out;
  }
}
