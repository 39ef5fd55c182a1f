package org.rangecache.backend.service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.model.DateRange;

/** Named report periods relative to a given day. */
public final class ReportPeriods {

  public static final List<String> NAMES =
      List.of("daily", "yesterday", "wtd", "mtd", "full_month", "qtd", "ytd");

  private ReportPeriods() {}

  public static DateRange resolve(String period, LocalDate today) {
    String p = (period == null) ? "" : period.trim().toLowerCase(Locale.ROOT);
    switch (p) {
      case "daily":
        return DateRange.singleDay(today);
      case "yesterday":
        return DateRange.singleDay(today.minusDays(1));
      case "wtd":
        return DateRange.of(today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), today);
      case "mtd":
        return DateRange.of(today.withDayOfMonth(1), today);
      case "full_month":
        return DateRange.of(today.withDayOfMonth(1), today.with(TemporalAdjusters.lastDayOfMonth()));
      case "qtd":
        return DateRange.of(quarterStart(today), today);
      case "ytd":
        return DateRange.of(today.withDayOfYear(1), today);
      default:
        throw new InvalidRequestException("Unknown period '" + period + "'. Supported: " + String.join(", ", NAMES));
    }
  }

  private static LocalDate quarterStart(LocalDate d) {
    int month = ((d.getMonthValue() - 1) / 3) * 3 + 1;
    return LocalDate.of(d.getYear(), month, 1);
  }
}
