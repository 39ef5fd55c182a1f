package org.rangecache.backend.controller;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.QueryRequest;
import org.rangecache.backend.model.QueryResult;
import org.rangecache.backend.service.QueryCoordinator;
import org.rangecache.backend.service.RecordLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

@Controller
public class QueryController {

  private static final Logger log = LoggerFactory.getLogger(QueryController.class);

  private final QueryCoordinator coordinator;
  private final RecordLookupService lookupService;

  @Value("${query.default-top:20}")
  private int defaultTop = 20;

  @Value("${query.max-top:10000}")
  private int maxTop = 10_000;

  public QueryController(QueryCoordinator coordinator, RecordLookupService lookupService) {
    this.coordinator = coordinator;
    this.lookupService = lookupService;
  }

  @GetMapping("/api/query/{table}")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> query(
      @PathVariable("table") String table,
      @RequestParam(value = "filter", required = false) String filter,
      @RequestParam(value = "select", required = false) String select,
      @RequestParam(value = "top", required = false) Integer top,
      @RequestParam(value = "skip", required = false, defaultValue = "0") int skip,
      @RequestParam(value = "orderby", required = false) String orderby,
      @RequestParam(value = "count", required = false, defaultValue = "true") boolean count,
      @RequestParam(value = "period", required = false) String period
  ) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("table", table);

    try {
      QueryRequest request = new QueryRequest(table, filter);
      request.setSelect(select);
      request.setTop(Math.min(top != null ? top : defaultTop, maxTop));
      request.setSkip(skip);
      request.setOrderby(orderby);
      request.setCount(count);
      request.setPeriod(period);

      QueryResult result = coordinator.query(request);

      response.put("rows", result.getRows());
      response.put("returned", result.getRows().size());
      if (result.getCount() != null) response.put("count", result.getCount());
      response.put("cache", result.getVerdict());
      response.put("fetches", result.getFetches());
      if (result.getCovered() != null) response.put("covered", result.getCovered());
      return ResponseEntity.ok(response);
    } catch (Exception e) {
      return ApiErrors.toResponse(e, response, log);
    }
  }

  @GetMapping("/api/query/{table}/records/{id}")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> getRecord(
      @PathVariable("table") String table,
      @PathVariable("id") String id,
      @RequestParam(value = "idField", required = false) String idField
  ) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("table", table);
    response.put("id", id);

    try {
      Optional<Map<String, Object>> record = lookupService.getRecord(table, id, idField);
      if (record.isEmpty()) {
        response.put("error", "No record found in " + table + " for id " + id);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
      }
      response.put("record", record.get());
      return ResponseEntity.ok(response);
    } catch (Exception e) {
      return ApiErrors.toResponse(e, response, log);
    }
  }

  @GetMapping("/api/query/{table}/count")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> count(
      @PathVariable("table") String table,
      @RequestParam(value = "filter", required = false) String filter
  ) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("table", table);
    if (filter != null) response.put("filter", filter);

    try {
      response.put("count", lookupService.count(table, filter));
      return ResponseEntity.ok(response);
    } catch (Exception e) {
      return ApiErrors.toResponse(e, response, log);
    }
  }

  @GetMapping("/api/tables")
  @ResponseBody
  public ResponseEntity<Map<String, Object>> tables() {
    List<Map<String, Object>> tables = new ArrayList<>();
    for (Map.Entry<String, CacheConfig> e : coordinator.tables().entrySet()) {
      Map<String, Object> t = new LinkedHashMap<>();
      t.put("name", e.getKey());
      t.put("mode", e.getValue().getMode());
      if (e.getValue().getDateColumn() != null) t.put("dateColumn", e.getValue().getDateColumn());
      if (e.getValue().getKeyColumn() != null) t.put("keyColumn", e.getValue().getKeyColumn());
      if (e.getValue().getDescription() != null) t.put("description", e.getValue().getDescription());
      tables.add(t);
    }
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("total", tables.size());
    response.put("tables", tables);
    return ResponseEntity.ok(response);
  }
}
