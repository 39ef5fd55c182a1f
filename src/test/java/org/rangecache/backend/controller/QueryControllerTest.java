package org.rangecache.backend.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.exception.RemoteFetchException;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.CacheVerdict;
import org.rangecache.backend.model.DateRange;
import org.rangecache.backend.model.QueryRequest;
import org.rangecache.backend.model.QueryResult;
import org.rangecache.backend.service.QueryCoordinator;
import org.rangecache.backend.service.RecordLookupService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class QueryControllerTest {

  @Mock
  private QueryCoordinator coordinator;

  @Mock
  private RecordLookupService lookupService;

  private QueryController controller;

  @BeforeEach
  void setUp() {
    controller = new QueryController(coordinator, lookupService);
  }

  @Test
  @DisplayName("query response carries rows, count, verdict and coverage")
  void query() {
    DateRange covered = DateRange.of(LocalDate.of(2026, 1, 5), LocalDate.of(2026, 1, 15));
    when(coordinator.query(any())).thenReturn(new QueryResult("Invoices",
        List.of(Map.of("PrimaryKey", 1)), 1L, CacheVerdict.PARTIAL, 1, covered));

    ResponseEntity<Map<String, Object>> response = controller.query("Invoices",
        "Date ge 2026-01-05 and Date le 2026-01-12", null, null, 0, null, true, null);

    assertEquals(HttpStatus.OK, response.getStatusCode());
    Map<String, Object> body = response.getBody();
    assertEquals(List.of(Map.of("PrimaryKey", 1)), body.get("rows"));
    assertEquals(1L, body.get("count"));
    assertEquals(CacheVerdict.PARTIAL, body.get("cache"));
    assertEquals(covered, body.get("covered"));

    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(coordinator).query(captor.capture());
    assertEquals(20, captor.getValue().getTop());
  }

  @Test
  @DisplayName("top is capped")
  void topIsCapped() {
    when(coordinator.query(any())).thenReturn(new QueryResult("Invoices", List.of(), null, CacheVerdict.BYPASS, 1, null));

    controller.query("Invoices", null, null, 1_000_000, 0, null, false, null);

    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(coordinator).query(captor.capture());
    assertEquals(10_000, captor.getValue().getTop());
  }

  @Test
  @DisplayName("invalid requests are 400 with no rows")
  void invalidRequest() {
    when(coordinator.query(any())).thenThrow(new InvalidRequestException("Unknown table 'Nope'. Available tables: Invoices"));

    ResponseEntity<Map<String, Object>> response = controller.query("Nope", null, null, null, 0, null, true, null);

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    assertTrue(((String) response.getBody().get("error")).startsWith("Unknown table"));
    assertFalse(response.getBody().containsKey("rows"));
  }

  @Test
  @DisplayName("remote failures are 502 with the remote status")
  void remoteFailure() {
    when(coordinator.query(any())).thenThrow(new RemoteFetchException(401, "Authentication failed"));

    ResponseEntity<Map<String, Object>> response = controller.query("Invoices", null, null, null, 0, null, true, null);

    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
    assertEquals(401, response.getBody().get("remoteStatus"));
    assertFalse(response.getBody().containsKey("rows"));
  }

  @Test
  void recordNotFound() {
    when(lookupService.getRecord("Invoices", "9", null)).thenReturn(Optional.empty());
    assertEquals(HttpStatus.NOT_FOUND, controller.getRecord("Invoices", "9", null).getStatusCode());
  }

  @Test
  void recordFound() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("PrimaryKey", 9);
    when(lookupService.getRecord("Invoices", "9", null)).thenReturn(Optional.of(record));

    ResponseEntity<Map<String, Object>> response = controller.getRecord("Invoices", "9", null);
    assertEquals(HttpStatus.OK, response.getStatusCode());
    assertEquals(record, response.getBody().get("record"));
  }

  @Test
  void count() {
    when(lookupService.count("Invoices", "Status eq 'Open'")).thenReturn(12L);
    assertEquals(12L, controller.count("Invoices", "Status eq 'Open'").getBody().get("count"));
  }

  @Test
  void tables() {
    Map<String, CacheConfig> tables = new LinkedHashMap<>();
    tables.put("Invoices", CacheConfig.dateRange("Date", "PrimaryKey"));
    tables.put("Products", CacheConfig.none());
    when(coordinator.tables()).thenReturn(tables);

    Map<String, Object> body = controller.tables().getBody();
    assertEquals(2, body.get("total"));
    List<?> list = (List<?>) body.get("tables");
    assertEquals("Date", ((Map<?, ?>) list.get(0)).get("dateColumn"));
    assertFalse(((Map<?, ?>) list.get(1)).containsKey("dateColumn"));
  }
}
