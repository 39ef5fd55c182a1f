package org.rangecache.backend.cache;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.filter.FilterExpression;
import org.rangecache.backend.filter.ODataSyntax;
import org.rangecache.backend.filter.RowFilterEvaluator;
import org.rangecache.backend.filter.RowValues;
import org.rangecache.backend.model.DateRange;
import org.springframework.stereotype.Component;

/** Local filter, order, page and column selection over a {@link CacheSnapshot}. */
@Component
public class RowProjector {

  private final RowFilterEvaluator evaluator;

  public RowProjector(RowFilterEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  /**
   * @param range rows must have a date-column value inside it; null keeps every row
   * @param filter evaluated locally on each row; null keeps every row
   * @param select requested columns; blank, or naming no known column, means every known column
   */
  public Page project(CacheSnapshot snapshot, DateRange range, FilterExpression filter,
      String select, List<OrderClause> order, int skip, Integer top) {

    List<Map<String, Object>> matched = new ArrayList<>();
    for (Map<String, Object> row : snapshot.getRows()) {
      if (range != null && !range.contains(RowValues.toLocalDate(row.get(snapshot.getDateColumn())))) {
        continue;
      }
      if (filter != null && !evaluator.matches(filter, row)) continue;
      matched.add(row);
    }

    if (order != null && !order.isEmpty()) {
      matched.sort(comparator(order));
    }

    long total = matched.size();
    int from = (int) Math.min(skip, total);
    int to = (top == null) ? (int) total : (int) Math.min(total, (long) from + top);

    // unknown columns are dropped; if none is known every column comes back
    List<String> columns = new ArrayList<>(ODataSyntax.splitFields(select));
    columns.retainAll(snapshot.getColumns());
    if (columns.isEmpty()) columns = snapshot.getColumns();

    List<Map<String, Object>> out = new ArrayList<>(to - from);
    for (Map<String, Object> row : matched.subList(from, to)) {
      Map<String, Object> projected = new LinkedHashMap<>();
      for (String col : columns) projected.put(col, row.get(col));
      out.add(projected);
    }
    return new Page(out, total);
  }

  /** Parses {@code Field asc, Other Field desc}; direction defaults to ascending. */
  public static List<OrderClause> parseOrderBy(String orderby) {
    List<OrderClause> clauses = new ArrayList<>();
    if (orderby == null || orderby.isBlank()) return clauses;
    for (String raw : orderby.split(",")) {
      String c = raw.trim();
      if (c.isEmpty()) throw new InvalidRequestException("Malformed orderby: '" + orderby + "'");
      boolean ascending = true;
      String lower = c.toLowerCase(Locale.ROOT);
      if (lower.endsWith(" desc") || lower.endsWith(" asc")) {
        ascending = lower.endsWith(" asc");
        c = c.substring(0, c.lastIndexOf(' ')).trim();
      }
      List<String> field = ODataSyntax.splitFields(c);
      if (field.size() != 1) throw new InvalidRequestException("Malformed orderby: '" + orderby + "'");
      clauses.add(new OrderClause(field.get(0), ascending));
    }
    return clauses;
  }

  /** Row ordering for {@code order}; nulls sort last whatever the direction. */
  public static Comparator<Map<String, Object>> comparator(List<OrderClause> order) {
    Comparator<Map<String, Object>> cmp = null;
    for (OrderClause clause : order) {
      Comparator<Map<String, Object>> next = (a, b) -> {
        Object x = a.get(clause.getField());
        Object y = b.get(clause.getField());
        // nulls stay last in both directions
        if (x == null || y == null) return RowValues.compare(x, y);
        int c = RowValues.compare(x, y);
        return clause.isAscending() ? c : -c;
      };
      cmp = (cmp == null) ? next : cmp.thenComparing(next);
    }
    return cmp;
  }

  public static final class OrderClause {
    private final String field;
    private final boolean ascending;

    public OrderClause(String field, boolean ascending) {
      this.field = field;
      this.ascending = ascending;
    }

    public String getField() {
      return field;
    }

    public boolean isAscending() {
      return ascending;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof OrderClause other && field.equals(other.field) && ascending == other.ascending;
    }

    @Override
    public int hashCode() {
      return Objects.hash(field, ascending);
    }

    @Override
    public String toString() {
      return field + (ascending ? " asc" : " desc");
    }
  }

  public static final class Page {
    private final List<Map<String, Object>> rows;
    private final long total;

    public Page(List<Map<String, Object>> rows, long total) {
      this.rows = rows;
      this.total = total;
    }

    public List<Map<String, Object>> getRows() {
      return rows;
    }

    /** Matching rows before skip/top. */
    public long getTotal() {
      return total;
    }
  }
}
