package org.rangecache.backend.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.rangecache.backend.config.RemoteSourceProperties;
import org.rangecache.backend.exception.RemoteFetchException;
import org.rangecache.backend.filter.ODataSyntax;
import org.rangecache.backend.model.FetchRequest;
import org.rangecache.backend.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/** {@link Fetcher} over the remote OData v4 API. */
@Service
public class ODataFetcher implements Fetcher {

  private static final Logger log = LoggerFactory.getLogger(ODataFetcher.class);

  private final RestTemplate restTemplate;
  private final RemoteSourceProperties remote;
  private final ObjectMapper objectMapper = new ObjectMapper();

  public ODataFetcher(RestTemplate remoteRestTemplate, RemoteSourceProperties remote) {
    this.restTemplate = remoteRestTemplate;
    this.remote = remote;
  }

  @Override
  public FetchResult fetch(FetchRequest request) {
    if (request.getTop() != null) {
      return fetchPage(request, request.getTop(), request.getSkip());
    }

    // no top: page until a short page comes back
    int pageSize = remote.getPageSize();
    int skip = request.getSkip();
    List<Map<String, Object>> all = new ArrayList<>();
    Long count = null;

    while (true) {
      FetchResult page = fetchPage(request, pageSize, skip);
      all.addAll(page.getRows());
      if (count == null) count = page.getCount();
      if (page.getRows().size() < pageSize) break;
      skip += pageSize;
    }

    log.info("Fetched {} rows from table={} filter={}", all.size(), request.getTable(), request.getFilter());
    return new FetchResult(all, count);
  }

  private FetchResult fetchPage(FetchRequest request, int top, int skip) {
    URI uri = buildUri(request, top, skip);

    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
    HttpEntity<Void> entity = new HttpEntity<>(headers);

    ResponseEntity<ODataResponse> response;
    try {
      response = restTemplate.exchange(uri, HttpMethod.GET, entity, ODataResponse.class);
    } catch (HttpStatusCodeException e) {
      int status = e.getStatusCode().value();
      String message = describeHttpError(request.getTable(), status, e.getResponseBodyAsString());
      log.error("Remote error {} for table={}: {}", status, request.getTable(), message);
      throw new RemoteFetchException(status, message, e);
    } catch (ResourceAccessException e) {
      log.error("Cannot reach remote source at {}: {}", remote.odataBaseUrl(), e.getMessage(), e);
      throw new RemoteFetchException(0, "Cannot connect to remote source at " + remote.odataBaseUrl()
          + ". Verify the server is running and accessible.", e);
    } catch (RestClientException e) {
      log.error("Error calling remote source for table={}: {}", request.getTable(), e.getMessage(), e);
      throw new RemoteFetchException(0, "Failed to call remote source: " + e.getMessage(), e);
    }

    ODataResponse body = response.getBody();
    if (!response.getStatusCode().is2xxSuccessful() || body == null) {
      throw new RemoteFetchException(response.getStatusCode().value(),
          "Remote HTTP error: " + response.getStatusCode() + " (empty body)");
    }

    List<Map<String, Object>> rows = new ArrayList<>();
    if (body.value != null) {
      for (Map<String, Object> raw : body.value) {
        Map<String, Object> row = new LinkedHashMap<>();
        // @id, @editLink, @odata.* are protocol metadata
        raw.forEach((k, v) -> {
          if (!k.startsWith("@")) row.put(k, v);
        });
        rows.add(row);
      }
    }
    Long count = (body.count != null) ? body.count : body.odataCount;
    return new FetchResult(rows, count);
  }

  URI buildUri(FetchRequest request, int top, int skip) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("table", request.getTable());
    UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(remote.odataBaseUrl())
        .pathSegment("{table}")
        .queryParam("$top", top);
    if (skip > 0) b.queryParam("$skip", skip);
    if (request.getFilter() != null && !request.getFilter().isBlank()) {
      b.queryParam("$filter", "{filter}");
      vars.put("filter", request.getFilter());
    }
    if (request.getSelect() != null && !request.getSelect().isBlank()) {
      b.queryParam("$select", "{select}");
      vars.put("select", ODataSyntax.quoteSelect(request.getSelect()));
    }
    if (request.getOrderby() != null && !request.getOrderby().isBlank()) {
      b.queryParam("$orderby", "{orderby}");
      vars.put("orderby", ODataSyntax.quoteOrderBy(request.getOrderby()));
    }
    if (request.isCount()) b.queryParam("$count", "true");
    // values go in as variables so every reserved char is escaped; a raw '+' would decode as a space
    return b.encode().buildAndExpand(vars).toUri();
  }

  private String describeHttpError(String table, int status, String body) {
    if (status == 401) {
      return "Authentication failed for user '" + remote.getUsername() + "'. Check credentials and OData privileges.";
    }
    if (status == 404) {
      return "Resource not found: '" + table + "'. Verify the table name and that it is exposed via OData.";
    }
    String detail = extractErrorMessage(body);
    return "Remote OData error (" + status + "): " + (detail.isBlank() ? "Status " + status : detail);
  }

  private String extractErrorMessage(String body) {
    if (body == null || body.isBlank()) return "";
    try {
      JsonNode message = objectMapper.readTree(body).path("error").path("message");
      if (message.isTextual()) return message.asText();
    } catch (Exception e) {
      log.debug("Remote error body is not JSON: {}", e.getMessage());
    }
    return body.length() > 500 ? body.substring(0, 500) : body;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static class ODataResponse {
    @JsonProperty("value") List<Map<String, Object>> value;
    @JsonProperty("@count") Long count;
    @JsonProperty("@odata.count") Long odataCount;
  }
}
