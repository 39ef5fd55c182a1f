package org.rangecache.backend.filter;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Conversions for loosely typed row values coming back from the remote JSON. */
public final class RowValues {

  private static final Pattern ISO_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})(?:[T ].*)?$");
  private static final Pattern US_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})(?:\\s.*)?$");

  private RowValues() {}

  /** Calendar date of a row value, or null when it does not look like a date. */
  public static LocalDate toLocalDate(Object v) {
    if (v == null) return null;
    if (v instanceof LocalDate d) return d;
    if (v instanceof LocalDateTime dt) return dt.toLocalDate();
    if (v instanceof OffsetDateTime odt) return odt.toLocalDate();
    if (!(v instanceof CharSequence)) return null;

    String s = v.toString().trim();
    try {
      Matcher iso = ISO_PREFIX.matcher(s);
      if (iso.matches()) return LocalDate.parse(iso.group(1));
      Matcher us = US_DATE.matcher(s);
      if (us.matches()) {
        return LocalDate.of(Integer.parseInt(us.group(3)),
            Integer.parseInt(us.group(1)), Integer.parseInt(us.group(2)));
      }
    } catch (DateTimeException e) {
      return null;
    }
    return null;
  }

  /** Numeric value, or null when the value is not a number or numeric text. */
  public static BigDecimal toBigDecimal(Object v) {
    if (v == null) return null;
    if (v instanceof BigDecimal b) return b;
    if (v instanceof Number n) {
      try {
        return new BigDecimal(n.toString());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    if (v instanceof CharSequence) {
      String s = v.toString().trim();
      if (s.isEmpty()) return null;
      try {
        return new BigDecimal(s);
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  public static Boolean toBoolean(Object v) {
    if (v instanceof Boolean b) return b;
    if (v instanceof CharSequence) {
      String s = v.toString().trim();
      if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
      if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
    }
    return null;
  }

  /** Text form used for string comparisons; whole numbers print without a trailing ".0". */
  public static String text(Object v) {
    if (v == null) return null;
    if (v instanceof Number) {
      BigDecimal b = toBigDecimal(v);
      if (b != null) return b.stripTrailingZeros().toPlainString();
    }
    return v.toString();
  }

  /**
   * Ordering used by {@code $orderby}: nulls last, then numbers, dates, booleans and text, each
   * kind ordered within itself. Values of different kinds never compare by content, which keeps
   * the order consistent on mixed columns.
   */
  public static int compare(Object a, Object b) {
    if (a == null && b == null) return 0;
    if (a == null) return 1;
    if (b == null) return -1;

    int ka = kind(a);
    int kb = kind(b);
    if (ka != kb) return Integer.compare(ka, kb);

    switch (ka) {
      case NUMBER:
        return toBigDecimal(a).compareTo(toBigDecimal(b));
      case DATE: {
        int c = toLocalDate(a).compareTo(toLocalDate(b));
        // same day: full timestamp text still orders correctly for ISO values
        return c != 0 ? c : text(a).compareTo(text(b));
      }
      case BOOLEAN:
        return Boolean.compare((Boolean) a, (Boolean) b);
      default:
        return text(a).compareTo(text(b));
    }
  }

  private static final int NUMBER = 0;
  private static final int DATE = 1;
  private static final int BOOLEAN = 2;
  private static final int TEXT = 3;

  private static int kind(Object v) {
    if (v instanceof Number && toBigDecimal(v) != null) return NUMBER;
    if (v instanceof Boolean) return BOOLEAN;
    if (toLocalDate(v) != null) return DATE;
    return TEXT;
  }
}
