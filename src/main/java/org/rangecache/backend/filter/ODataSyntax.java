package org.rangecache.backend.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.rangecache.backend.model.DateRange;

/** Field quoting and date-bound filters in the remote OData syntax. */
public final class ODataSyntax {

  private ODataSyntax() {}

  /** {@code "Date" eq X} for a single day, otherwise {@code "Date" ge X and "Date" le Y}. */
  public static String dateRangeFilter(String dateColumn, DateRange range) {
    String field = FilterExpression.quoteName(dateColumn);
    if (range.isSingleDay()) {
      return field + " eq " + range.getStart();
    }
    return field + " ge " + range.getStart() + " and " + field + " le " + range.getEnd();
  }

  /** Comma-separated field list with surrounding quotes and blanks removed. */
  public static List<String> splitFields(String list) {
    List<String> out = new ArrayList<>();
    if (list == null) return out;
    for (String part : list.split(",")) {
      String f = stripQuotes(part.trim());
      if (!f.isEmpty()) out.add(f);
    }
    return out;
  }

  /** {@code Customer Name,City} becomes {@code "Customer Name","City"}. */
  public static String quoteSelect(String select) {
    if (select == null || select.isBlank()) return select;
    List<String> quoted = new ArrayList<>();
    for (String f : splitFields(select)) quoted.add(FilterExpression.quoteName(f));
    return String.join(",", quoted);
  }

  /** {@code Customer Name asc,City desc} becomes {@code "Customer Name" asc,"City" desc}. */
  public static String quoteOrderBy(String orderby) {
    if (orderby == null || orderby.isBlank()) return orderby;
    List<String> parts = new ArrayList<>();
    for (String clause : orderby.split(",")) {
      String c = clause.trim();
      if (c.isEmpty()) continue;
      String direction = "";
      String lower = c.toLowerCase(Locale.ROOT);
      if (lower.endsWith(" asc") || lower.endsWith(" desc")) {
        int cut = c.lastIndexOf(' ');
        direction = " " + c.substring(cut + 1);
        c = c.substring(0, cut).trim();
      }
      parts.add(FilterExpression.quoteName(stripQuotes(c)) + direction);
    }
    return String.join(",", parts);
  }

  static String stripQuotes(String s) {
    if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
      return s.substring(1, s.length() - 1).trim();
    }
    return s;
  }
}
