package org.rangecache.backend.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.rangecache.backend.cache.CacheEntry;
import org.rangecache.backend.cache.CacheSnapshot;
import org.rangecache.backend.cache.CacheStore;
import org.rangecache.backend.cache.FetchTask;
import org.rangecache.backend.cache.GapPlanner;
import org.rangecache.backend.cache.RowProjector;
import org.rangecache.backend.cache.RowProjector.OrderClause;
import org.rangecache.backend.config.CacheProperties;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.filter.FilterClassification;
import org.rangecache.backend.filter.FilterClassifier;
import org.rangecache.backend.filter.FilterExpression;
import org.rangecache.backend.filter.FilterNormalizer;
import org.rangecache.backend.filter.FilterParser;
import org.rangecache.backend.filter.ODataSyntax;
import org.rangecache.backend.filter.RowFilterEvaluator;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.CacheEntrySummary;
import org.rangecache.backend.model.CacheVerdict;
import org.rangecache.backend.model.DateRange;
import org.rangecache.backend.model.FetchRequest;
import org.rangecache.backend.model.FetchResult;
import org.rangecache.backend.model.QueryRequest;
import org.rangecache.backend.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for table queries. Decides whether a request can be served from the cache, fills
 * missing slices through the {@link Fetcher}, and projects the answer locally.
 *
 * <p>Per request: classify, then either bypass (straight to the remote side, no cache state
 * touched) or plan, fetch and merge while holding the table lock, then project outside the lock
 * from a snapshot. A remote failure aborts the request; slices merged before it stay committed.
 */
@Service
public class QueryCoordinator {

  private static final Logger log = LoggerFactory.getLogger(QueryCoordinator.class);

  private final TableConfigRegistry registry;
  private final CacheStore store;
  private final Fetcher fetcher;
  private final FilterNormalizer normalizer;
  private final FilterParser parser;
  private final FilterClassifier classifier;
  private final RowFilterEvaluator evaluator;
  private final GapPlanner planner;
  private final RowProjector projector;
  private final Clock clock;

  public QueryCoordinator(TableConfigRegistry registry, CacheStore store, Fetcher fetcher,
      FilterNormalizer normalizer, FilterParser parser, FilterClassifier classifier,
      RowFilterEvaluator evaluator, GapPlanner planner, RowProjector projector, Clock clock) {
    this.registry = registry;
    this.store = store;
    this.fetcher = fetcher;
    this.normalizer = normalizer;
    this.parser = parser;
    this.classifier = classifier;
    this.evaluator = evaluator;
    this.planner = planner;
    this.projector = projector;
    this.clock = clock;
  }

  public QueryResult query(QueryRequest request) {
    CacheConfig config = registry.require(request.getTable());
    if (request.getSkip() < 0) throw new InvalidRequestException("skip must not be negative");
    if (request.getTop() != null && request.getTop() < 0) throw new InvalidRequestException("top must not be negative");

    FilterExpression filter = parser.parse(effectiveFilter(request, config));
    List<OrderClause> order = RowProjector.parseOrderBy(request.getOrderby());

    switch (config.getMode()) {
      case DATE_RANGE: {
        FilterClassification c = classifier.classify(filter, config.getDateColumn());
        if (!c.isDateScoped()) {
          return bypass(request, filter, "not date-scoped: " + c.getReason());
        }
        return queryDateRange(request, config, c, order);
      }
      case CACHE_ALL:
        if (!evaluator.canEvaluate(filter)) {
          return bypass(request, filter, "filter cannot be evaluated locally");
        }
        return queryCacheAll(request, config, filter, order);
      default:
        return bypass(request, filter, "caching disabled");
    }
  }

  private QueryResult queryDateRange(QueryRequest request, CacheConfig config,
      FilterClassification classification, List<OrderClause> order) {
    String table = request.getTable();
    DateRange requested = classification.getRange();
    LocalDate today = LocalDate.now(clock);

    ReentrantLock lock = store.lockFor(table);
    DateRange coveredBefore;
    List<FetchTask> tasks;
    CacheSnapshot snapshot;

    lock.lock();
    try {
      CacheEntry entry = store.open(table, config);
      coveredBefore = entry.getCovered();
      tasks = planner.plan(coveredBefore, requested, today);
      log.info("🔍 table={} requested={} covered={} today={} tasks={}",
          table, requested, coveredBefore, today, tasks);

      for (FetchTask task : tasks) {
        String filter = ODataSyntax.dateRangeFilter(config.getDateColumn(), task.getRange());
        FetchResult fetched = fetcher.fetch(FetchRequest.allRows(table, filter));
        store.merge(entry, task, fetched.getRows());
      }
      snapshot = entry.snapshot();
    } finally {
      lock.unlock();
    }

    CacheVerdict verdict = tasks.isEmpty()
        ? CacheVerdict.HIT
        : (coveredBefore.isEmpty() ? CacheVerdict.MISS : CacheVerdict.PARTIAL);

    RowProjector.Page page = projector.project(snapshot, requested, classification.getResidual(),
        request.getSelect(), order, request.getSkip(), request.getTop());
    log.info("✅ table={} verdict={} fetches={} matched={} returned={}",
        table, verdict, tasks.size(), page.getTotal(), page.getRows().size());

    return new QueryResult(table, page.getRows(), request.isCount() ? page.getTotal() : null,
        verdict, tasks.size(), snapshot.getCovered());
  }

  private QueryResult queryCacheAll(QueryRequest request, CacheConfig config,
      FilterExpression filter, List<OrderClause> order) {
    String table = request.getTable();
    ReentrantLock lock = store.lockFor(table);
    int fetches = 0;
    CacheSnapshot snapshot;

    lock.lock();
    try {
      CacheEntry entry = store.open(table, config);
      if (!entry.isComplete()) {
        FetchResult fetched = fetcher.fetch(FetchRequest.allRows(table, null));
        store.merge(entry, FetchTask.fullLoad(), fetched.getRows());
        fetches = 1;
      }
      snapshot = entry.snapshot();
    } finally {
      lock.unlock();
    }

    RowProjector.Page page = projector.project(snapshot, null, filter,
        request.getSelect(), order, request.getSkip(), request.getTop());
    CacheVerdict verdict = (fetches == 0) ? CacheVerdict.HIT : CacheVerdict.MISS;
    log.info("✅ table={} (cache all) verdict={} matched={} returned={}",
        table, verdict, page.getTotal(), page.getRows().size());

    return new QueryResult(table, page.getRows(), request.isCount() ? page.getTotal() : null,
        verdict, fetches, snapshot.getCovered());
  }

  private QueryResult bypass(QueryRequest request, FilterExpression filter, String reason) {
    log.info("↪️ Bypassing cache for table={}: {}", request.getTable(), reason);
    FetchRequest fetch = new FetchRequest(request.getTable(),
        (filter != null) ? filter.toOData() : null,
        request.getSelect(), request.getOrderby(), request.getTop(), request.getSkip(), request.isCount());
    FetchResult result = fetcher.fetch(fetch);
    return new QueryResult(request.getTable(), result.getRows(), result.getCount(),
        CacheVerdict.BYPASS, 1, null);
  }

  /** Raw filter after date normalization, with the named period (if any) ANDed in. */
  private String effectiveFilter(QueryRequest request, CacheConfig config) {
    String filter = normalizer.normalize(request.getFilter());
    if (request.getPeriod() == null || request.getPeriod().isBlank()) return filter;

    if (config.getDateColumn() == null) {
      throw new InvalidRequestException("Table '" + request.getTable() + "' has no date column for period filters");
    }
    DateRange range = ReportPeriods.resolve(request.getPeriod(), LocalDate.now(clock));
    String periodFilter = ODataSyntax.dateRangeFilter(config.getDateColumn(), range);
    return (filter == null || filter.isBlank()) ? periodFilter : "(" + filter + ") and " + periodFilter;
  }

  // ================== flush / config ==================

  /** Returns rows dropped, or -1 when nothing was cached. */
  public int flush(String table) {
    return store.flush(table);
  }

  public int flushAll() {
    return store.flushAll();
  }

  /** Replaces one table's cache settings and drops whatever was cached under the old ones. */
  public CacheConfig reconfigure(String table, CacheProperties.TableProperties properties) {
    CacheConfig previous = registry.update(table, properties);
    store.flush(table);
    CacheConfig current = registry.require(table);
    log.info("🔧 Reconfigured table={} {} -> {}", table, previous, current);
    return current;
  }

  public List<CacheEntrySummary> summaries() {
    List<CacheEntrySummary> out = new ArrayList<>();
    for (CacheEntry e : store.entries()) {
      out.add(new CacheEntrySummary(e.getTable(), e.getMode(), e.getRowCount(), e.getCovered(),
          e.isComplete(), e.getColumns(), e.getLastMergedAt()));
    }
    return out;
  }

  public Map<String, CacheConfig> tables() {
    return registry.all();
  }
}
