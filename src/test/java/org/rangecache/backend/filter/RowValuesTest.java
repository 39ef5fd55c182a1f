package org.rangecache.backend.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RowValuesTest {

  @Test
  void conversions() {
    assertEquals(LocalDate.of(2026, 1, 5), RowValues.toLocalDate("2026-01-05T10:00:00Z"));
    assertEquals(LocalDate.of(2026, 1, 5), RowValues.toLocalDate("1/5/2026"));
    assertEquals(null, RowValues.toLocalDate("2026-02-30"));
    assertEquals(new BigDecimal("12.5"), RowValues.toBigDecimal("12.5"));
    assertEquals("3", RowValues.text(3.0));
  }

  @Test
  @DisplayName("values of different kinds order by kind: numbers, dates, booleans, text, then nulls")
  void ordersByKind() {
    List<Object> values = new ArrayList<>(Arrays.asList("abc", null, true, "2026-01-05", 10, "9", 2.5));
    values.sort(RowValues::compare);
    assertEquals(Arrays.asList(2.5, 10, "2026-01-05", true, "9", "abc", null), values);
  }

  @Test
  @DisplayName("ordering stays consistent on a large mixed column")
  void consistentOnMixedColumn() {
    Object[] pool = {5, "10", "9", 7.5, "2026-01-05", "2026-01-05T08:00:00", "x", false, null, "1/2/2026", 100L};
    Random random = new Random(42);
    List<Object> values = new ArrayList<>();
    for (int i = 0; i < 2000; i++) values.add(pool[random.nextInt(pool.length)]);

    Collections.shuffle(values, random);
    values.sort(RowValues::compare);

    for (int i = 1; i < values.size(); i++) {
      assertTrue(RowValues.compare(values.get(i - 1), values.get(i)) <= 0, "out of order at " + i);
    }
    for (Object a : pool) {
      for (Object b : pool) {
        for (Object c : pool) {
          if (RowValues.compare(a, b) <= 0 && RowValues.compare(b, c) <= 0) {
            assertTrue(RowValues.compare(a, c) <= 0, a + " <= " + b + " <= " + c);
          }
        }
      }
    }
  }
}
