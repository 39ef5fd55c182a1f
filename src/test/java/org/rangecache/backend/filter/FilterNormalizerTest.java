package org.rangecache.backend.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FilterNormalizerTest {

  private final FilterNormalizer normalizer = new FilterNormalizer();

  @Test
  @DisplayName("quoted ISO dates lose their quotes")
  void quotedIsoDates() {
    assertEquals("Date ge 2026-01-05 and Date le 2026-01-10",
        normalizer.normalize("Date ge '2026-01-05' and Date le \"2026-01-10\""));
  }

  @Test
  @DisplayName("timestamps are cut to the calendar day")
  void timestamps() {
    assertEquals("Date ge 2026-01-05", normalizer.normalize("Date ge 2026-01-05T00:00:00Z"));
    assertEquals("Date ge 2026-01-05", normalizer.normalize("Date ge '2026-01-05T08:30:00+07:00'"));
  }

  @Test
  @DisplayName("US dates become ISO")
  void usDates() {
    assertEquals("Date eq 2026-01-05", normalizer.normalize("Date eq 1/5/2026"));
    assertEquals("Date eq 2026-12-31", normalizer.normalize("Date eq '12/31/2026 11:59:59 PM'"));
  }

  @Test
  void leavesOtherFiltersAlone() {
    assertEquals("Status eq 'Open' and Amount gt 10", normalizer.normalize("Status eq 'Open' and Amount gt 10"));
    assertNull(normalizer.normalize(null));
    assertEquals("", normalizer.normalize(""));
  }
}
