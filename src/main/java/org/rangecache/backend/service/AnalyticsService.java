package org.rangecache.backend.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.rangecache.backend.cache.CacheEntry;
import org.rangecache.backend.cache.CacheSnapshot;
import org.rangecache.backend.cache.CacheStore;
import org.rangecache.backend.cache.RowProjector;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.filter.FilterExpression;
import org.rangecache.backend.filter.FilterNormalizer;
import org.rangecache.backend.filter.FilterParser;
import org.rangecache.backend.filter.ODataSyntax;
import org.rangecache.backend.filter.RowFilterEvaluator;
import org.rangecache.backend.filter.RowValues;
import org.rangecache.backend.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Group-by and aggregate over rows already in the cache. Never calls the remote source, so the
 * answer only covers what earlier queries loaded.
 */
@Service
public class AnalyticsService {

  private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

  public static final Set<String> FUNCTIONS = new TreeSet<>(
      Arrays.asList("sum", "count", "mean", "min", "max", "median", "nunique", "std"));
  public static final int DEFAULT_LIMIT = 50;

  private static final MathContext MC = MathContext.DECIMAL64;

  private final CacheStore store;
  private final FilterNormalizer normalizer;
  private final FilterParser parser;
  private final RowFilterEvaluator evaluator;

  public AnalyticsService(CacheStore store, FilterNormalizer normalizer, FilterParser parser,
      RowFilterEvaluator evaluator) {
    this.store = store;
    this.normalizer = normalizer;
    this.parser = parser;
    this.evaluator = evaluator;
  }

  /**
   * @param groupby comma-separated columns; blank aggregates over all rows as one group
   * @param aggregate comma-separated {@code function:column} pairs; blank with a groupby counts rows
   * @param sort one result column with an optional {@code asc}/{@code desc}
   * @param limit result rows to return, {@value #DEFAULT_LIMIT} when null
   */
  public AnalysisResult analyze(String table, String groupby, String aggregate, String filter,
      String sort, Integer limit) {

    CacheSnapshot snapshot = store.get(table)
        .map(CacheEntry::snapshot)
        .orElseThrow(() -> new InvalidRequestException(
            "No cached data for '" + table + "'. Query the table first to load it."));

    int max = (limit == null) ? DEFAULT_LIMIT : limit;
    if (max < 1) throw new InvalidRequestException("limit must be at least 1");

    List<String> groupFields = ODataSyntax.splitFields(groupby);
    for (String field : groupFields) requireColumn(snapshot, field);
    List<Aggregate> aggregates = parseAggregates(aggregate, snapshot);
    if (groupFields.isEmpty() && aggregates.isEmpty()) {
      throw new InvalidRequestException("Give a groupby, an aggregate, or both");
    }

    FilterExpression parsed = parser.parse(normalizer.normalize(filter));
    if (parsed != null && !evaluator.canEvaluate(parsed)) {
      throw new InvalidRequestException("Filter cannot be evaluated on cached rows: '" + filter + "'");
    }

    Map<List<String>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    int records = 0;
    for (Map<String, Object> row : snapshot.getRows()) {
      if (parsed != null && !evaluator.matches(parsed, row)) continue;
      records++;
      List<String> key = new ArrayList<>(groupFields.size());
      for (String field : groupFields) key.add(RowValues.text(row.get(field)));
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    }
    if (groupFields.isEmpty() && groups.isEmpty()) {
      // aggregates over no rows still give one result row
      groups.put(List.of(), List.of());
    }

    List<Map<String, Object>> out = new ArrayList<>();
    for (List<Map<String, Object>> members : groups.values()) {
      Map<String, Object> result = new LinkedHashMap<>();
      for (String field : groupFields) result.put(field, members.get(0).get(field));
      if (aggregates.isEmpty()) {
        result.put("count", (long) members.size());
      }
      for (Aggregate agg : aggregates) {
        result.put(agg.getColumn(), apply(agg, members));
      }
      out.add(result);
    }

    if (sort != null && !sort.isBlank()) {
      List<RowProjector.OrderClause> order = RowProjector.parseOrderBy(sort);
      for (RowProjector.OrderClause clause : order) {
        if (!out.isEmpty() && !out.get(0).containsKey(clause.getField())) {
          throw new InvalidRequestException("Cannot sort by '" + clause.getField()
              + "'. Result columns: " + String.join(", ", out.get(0).keySet()));
        }
      }
      out.sort(RowProjector.comparator(order));
    } else if (aggregates.isEmpty()) {
      out.sort(RowProjector.comparator(List.of(new RowProjector.OrderClause("count", false))));
    }

    int total = out.size();
    List<Map<String, Object>> page = new ArrayList<>(out.subList(0, Math.min(total, max)));
    log.info("📊 Analyzed table={} records={} groups={} groupby={} aggregate={}",
        table, records, total, groupFields, aggregate);
    return new AnalysisResult(table, records, total, page);
  }

  static List<Aggregate> parseAggregates(String aggregate, CacheSnapshot snapshot) {
    List<Aggregate> out = new ArrayList<>();
    if (aggregate == null || aggregate.isBlank()) return out;
    for (String raw : aggregate.split(",")) {
      String pair = raw.trim();
      int colon = pair.indexOf(':');
      if (colon < 0) {
        throw new InvalidRequestException("Invalid aggregate '" + pair
            + "'. Expected function:field, e.g. sum:Amount");
      }
      String function = pair.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      List<String> field = ODataSyntax.splitFields(pair.substring(colon + 1));
      if (!FUNCTIONS.contains(function)) {
        throw new InvalidRequestException("Unknown function '" + function
            + "'. Supported: " + String.join(", ", FUNCTIONS));
      }
      if (field.size() != 1) throw new InvalidRequestException("Invalid aggregate '" + pair + "'");
      requireColumn(snapshot, field.get(0));
      out.add(new Aggregate(function, field.get(0)));
    }
    return out;
  }

  private static void requireColumn(CacheSnapshot snapshot, String field) {
    if (!snapshot.getColumns().contains(field)) {
      throw new InvalidRequestException("Field '" + field + "' not in cached data for '"
          + snapshot.getTable() + "'. Available: " + String.join(", ", snapshot.getColumns()));
    }
  }

  private static Object apply(Aggregate agg, List<Map<String, Object>> rows) {
    List<Object> values = new ArrayList<>();
    for (Map<String, Object> row : rows) {
      Object v = row.get(agg.getField());
      if (v != null) values.add(v);
    }

    switch (agg.getFunction()) {
      case "count":
        return (long) values.size();
      case "nunique": {
        Set<String> distinct = new HashSet<>();
        for (Object v : values) distinct.add(RowValues.text(v));
        return (long) distinct.size();
      }
      case "min":
        return values.stream().min(RowValues::compare).orElse(null);
      case "max":
        return values.stream().max(RowValues::compare).orElse(null);
      default:
        return numeric(agg, numbers(agg, values));
    }
  }

  private static Object numeric(Aggregate agg, List<BigDecimal> numbers) {
    BigDecimal sum = BigDecimal.ZERO;
    for (BigDecimal n : numbers) sum = sum.add(n);
    int n = numbers.size();

    switch (agg.getFunction()) {
      case "sum":
        return sum;
      case "mean":
        return (n == 0) ? null : sum.divide(BigDecimal.valueOf(n), MC);
      case "median": {
        if (n == 0) return null;
        List<BigDecimal> sorted = new ArrayList<>(numbers);
        sorted.sort(null);
        if (n % 2 == 1) return sorted.get(n / 2);
        return sorted.get(n / 2 - 1).add(sorted.get(n / 2)).divide(BigDecimal.valueOf(2), MC);
      }
      case "std": {
        // sample standard deviation
        if (n < 2) return null;
        BigDecimal mean = sum.divide(BigDecimal.valueOf(n), MC);
        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal x : numbers) {
          BigDecimal d = x.subtract(mean);
          squares = squares.add(d.multiply(d));
        }
        return squares.divide(BigDecimal.valueOf(n - 1L), MC).sqrt(MC);
      }
      default:
        throw new IllegalStateException("Unhandled aggregate " + agg.getFunction());
    }
  }

  private static List<BigDecimal> numbers(Aggregate agg, List<Object> values) {
    List<BigDecimal> out = new ArrayList<>(values.size());
    for (Object v : values) {
      BigDecimal n = RowValues.toBigDecimal(v);
      if (n == null) {
        throw new InvalidRequestException("Cannot " + agg.getFunction() + " '" + agg.getField()
            + "': value '" + v + "' is not numeric");
      }
      out.add(n);
    }
    return out;
  }

  static final class Aggregate {
    private final String function;
    private final String field;

    Aggregate(String function, String field) {
      this.function = function;
      this.field = field;
    }

    String getFunction() {
      return function;
    }

    String getField() {
      return field;
    }

    /** Result column name, e.g. {@code Amount_sum}. */
    String getColumn() {
      return field + "_" + function;
    }
  }
}
