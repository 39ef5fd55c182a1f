package org.rangecache.backend.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.DateRange;

class CacheStoreTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

  private CacheStore store;

  @BeforeEach
  void setUp() {
    store = new CacheStore(CLOCK, 3);
  }

  private static DateRange r(String start, String end) {
    return DateRange.of(LocalDate.parse(start), LocalDate.parse(end));
  }

  private static Map<String, Object> row(Object pk, String date, Object amount) {
    Map<String, Object> row = new LinkedHashMap<>();
    if (pk != null) row.put("PrimaryKey", pk);
    row.put("Date", date);
    row.put("Amount", amount);
    return row;
  }

  @Test
  @DisplayName("open returns the same entry until flushed")
  void openIsStable() {
    CacheEntry a = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    assertSame(a, store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey")));
    assertTrue(store.get("Invoices").isPresent());
    assertSame(store.lockFor("Invoices"), store.lockFor("Invoices"));
  }

  @Test
  @DisplayName("gap merges grow the covered range and add rows")
  void gapMerge() {
    CacheEntry entry = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    store.merge(entry, new FetchTask(r("2026-01-05", "2026-01-10"), FetchReason.LEADING_GAP),
        List.of(row(1, "2026-01-05", 10), row(2, "2026-01-09", 20)));
    store.merge(entry, new FetchTask(r("2026-01-01", "2026-01-04"), FetchReason.LEADING_GAP),
        List.of(row(3, "2026-01-02", 30)));

    assertEquals(r("2026-01-01", "2026-01-10"), entry.getCovered());
    assertEquals(3, entry.getRowCount());
    assertEquals(Instant.parse("2026-01-15T10:00:00Z"), entry.getLastMergedAt());
  }

  @Test
  @DisplayName("rows with a known key replace the old copy")
  void dedupeByKey() {
    CacheEntry entry = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    store.merge(entry, new FetchTask(r("2026-01-05", "2026-01-10"), FetchReason.LEADING_GAP),
        List.of(row(1, "2026-01-05", 10)));
    // same record, numeric key arriving as text
    store.merge(entry, new FetchTask(r("2026-01-11", "2026-01-12"), FetchReason.TRAILING_GAP),
        List.of(row("1", "2026-01-11", 99)));

    List<Map<String, Object>> rows = entry.snapshot().getRows();
    assertEquals(1, rows.size());
    assertEquals(99, rows.get(0).get("Amount"));
  }

  @Test
  @DisplayName("without a key, identical rows are kept as separate records")
  void keylessDuplicatesKept() {
    CacheEntry entry = store.open("Lines", CacheConfig.dateRange("Date", null));
    store.merge(entry, new FetchTask(r("2026-01-05", "2026-01-05"), FetchReason.LEADING_GAP),
        List.of(row(null, "2026-01-05", 10), row(null, "2026-01-05", 10), row(null, "2026-01-05", 11)));
    assertEquals(3, entry.getRowCount());
  }

  @Test
  @DisplayName("today refresh of a keyless table replaces the day instead of adding to it")
  void keylessTodayRefresh() {
    CacheEntry entry = store.open("Lines", CacheConfig.dateRange("Date", null));
    store.merge(entry, new FetchTask(r("2026-01-14", "2026-01-15"), FetchReason.LEADING_GAP),
        List.of(row(null, "2026-01-14", 10), row(null, "2026-01-15", 20), row(null, "2026-01-15", 20)));
    store.merge(entry, new FetchTask(DateRange.singleDay(LocalDate.of(2026, 1, 15)), FetchReason.TODAY_REFRESH),
        List.of(row(null, "2026-01-15", 20), row(null, "2026-01-15", 20)));
    assertEquals(3, entry.getRowCount());
  }

  @Test
  @DisplayName("today refresh replaces every row dated today")
  void todayRefresh() {
    CacheEntry entry = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    store.merge(entry, new FetchTask(r("2026-01-14", "2026-01-15"), FetchReason.LEADING_GAP),
        List.of(row(1, "2026-01-14", 10), row(2, "2026-01-15", 20), row(3, "2026-01-15T09:00:00", 30)));

    store.merge(entry, new FetchTask(DateRange.singleDay(LocalDate.of(2026, 1, 15)), FetchReason.TODAY_REFRESH),
        List.of(row(2, "2026-01-15", 25), row(4, "2026-01-15", 40)));

    Map<Object, Object> amounts = new LinkedHashMap<>();
    for (Map<String, Object> r : entry.snapshot().getRows()) amounts.put(r.get("PrimaryKey"), r.get("Amount"));
    assertEquals(Map.of(1, 10, 2, 25, 4, 40), amounts);
    assertEquals(r("2026-01-14", "2026-01-15"), entry.getCovered());
  }

  @Test
  @DisplayName("column set only grows")
  void columnsGrow() {
    CacheEntry entry = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    store.merge(entry, new FetchTask(r("2026-01-05", "2026-01-05"), FetchReason.LEADING_GAP),
        List.of(row(1, "2026-01-05", 10)));
    Map<String, Object> wide = row(2, "2026-01-06", 20);
    wide.put("Region", "North");
    store.merge(entry, new FetchTask(r("2026-01-06", "2026-01-06"), FetchReason.TRAILING_GAP), List.of(wide));

    assertEquals(List.of("PrimaryKey", "Date", "Amount", "Region"), entry.getColumns());
  }

  @Test
  @DisplayName("full load replaces all rows and marks the entry complete")
  void fullLoad() {
    CacheEntry entry = store.open("Customers", CacheConfig.cacheAll("PrimaryKey"));
    assertFalse(entry.isComplete());
    store.merge(entry, FetchTask.fullLoad(), List.of(row(1, null, 1), row(2, null, 2)));
    assertTrue(entry.isComplete());
    assertEquals(2, entry.getRowCount());
    assertTrue(entry.getCovered().isEmpty());
  }

  @Test
  @DisplayName("cached rows are immutable copies")
  void rowsAreFrozen() {
    CacheEntry entry = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    Map<String, Object> source = row(1, "2026-01-05", 10);
    store.merge(entry, new FetchTask(r("2026-01-05", "2026-01-05"), FetchReason.LEADING_GAP), List.of(source));
    source.put("Amount", 999);

    Map<String, Object> cached = entry.snapshot().getRows().get(0);
    assertEquals(10, cached.get("Amount"));
    assertThrows(UnsupportedOperationException.class, () -> cached.put("Amount", 1));
  }

  @Test
  @DisplayName("flush detaches the entry; the next open starts empty")
  void flush() {
    CacheEntry entry = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    store.merge(entry, new FetchTask(r("2026-01-05", "2026-01-05"), FetchReason.LEADING_GAP),
        List.of(row(1, "2026-01-05", 10)));

    assertEquals(1, store.flush("Invoices"));
    assertEquals(-1, store.flush("Invoices"));
    assertFalse(store.get("Invoices").isPresent());

    CacheEntry fresh = store.open("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    assertNotSame(entry, fresh);
    assertTrue(fresh.getCovered().isEmpty());
    assertEquals(0, fresh.getRowCount());
  }

  @Test
  void flushAllAndListing() {
    store.open("B", CacheConfig.cacheAll(null));
    store.open("A", CacheConfig.dateRange("Date", null));
    assertEquals("A", store.entries().get(0).getTable());
    assertEquals(2, store.flushAll());
    assertTrue(store.entries().isEmpty());
  }
}
