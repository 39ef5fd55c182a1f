package org.rangecache.backend.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.rangecache.backend.config.CacheProperties;
import org.rangecache.backend.model.AnalysisResult;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.CacheEntrySummary;
import org.rangecache.backend.service.AnalyticsService;
import org.rangecache.backend.service.QueryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

@Controller
public class CacheController {

  private static final Logger log = LoggerFactory.getLogger(CacheController.class);

  private final QueryCoordinator coordinator;
  private final AnalyticsService analytics;

  public CacheController(QueryCoordinator coordinator, AnalyticsService analytics) {
    this.coordinator = coordinator;
    this.analytics = analytics;
  }

  @GetMapping("/api/cache")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> list() {
    List<CacheEntrySummary> entries = coordinator.summaries();
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("total", entries.size());
    response.put("entries", entries);
    return ResponseEntity.ok(response);
  }

  /** Flushes one table, or every table when {@code table} is absent. */
  @PostMapping("/api/cache/flush")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> flush(
      @RequestParam(value = "table", required = false) String table
  ) {
    Map<String, Object> response = new LinkedHashMap<>();
    if (table == null || table.isBlank()) {
      int flushed = coordinator.flushAll();
      response.put("flushedTables", flushed);
      response.put("message", "Flushed " + flushed + " table cache(s).");
      return ResponseEntity.ok(response);
    }

    int rows = coordinator.flush(table);
    response.put("table", table);
    if (rows < 0) {
      response.put("flushedRows", 0);
      response.put("message", "No cached data found for '" + table + "'.");
    } else {
      response.put("flushedRows", rows);
      response.put("message", "Flushed '" + table + "' (" + rows + " rows).");
    }
    return ResponseEntity.ok(response);
  }

  /** Aggregates the cached rows of one table; no remote call is made. */
  @GetMapping("/api/cache/{table}/analyze")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> analyze(
      @PathVariable("table") String table,
      @RequestParam(value = "groupby", required = false) String groupby,
      @RequestParam(value = "aggregate", required = false) String aggregate,
      @RequestParam(value = "filter", required = false) String filter,
      @RequestParam(value = "sort", required = false) String sort,
      @RequestParam(value = "limit", required = false) Integer limit
  ) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("table", table);
    try {
      AnalysisResult result = analytics.analyze(table, groupby, aggregate, filter, sort, limit);
      response.put("records", result.getRecords());
      response.put("groups", result.getGroups());
      response.put("rows", result.getRows());
      return ResponseEntity.ok(response);
    } catch (Exception e) {
      return ApiErrors.toResponse(e, response, log);
    }
  }

  @PutMapping("/api/cache/config/{table}")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> reconfigure(
      @PathVariable("table") String table,
      @RequestBody CacheProperties.TableProperties properties
  ) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("table", table);
    try {
      CacheConfig config = coordinator.reconfigure(table, properties);
      response.put("mode", config.getMode());
      response.put("dateColumn", config.getDateColumn());
      response.put("keyColumn", config.getKeyColumn());
      return ResponseEntity.ok(response);
    } catch (Exception e) {
      return ApiErrors.toResponse(e, response, log);
    }
  }
}
