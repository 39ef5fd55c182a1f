package org.rangecache.backend.service;

import java.util.Map;
import java.util.Optional;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.filter.FilterExpression;
import org.rangecache.backend.filter.FilterNormalizer;
import org.rangecache.backend.filter.FilterParser;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.FetchRequest;
import org.rangecache.backend.model.FetchResult;
import org.springframework.stereotype.Service;

/** Single-record and count lookups. These always go to the remote source. */
@Service
public class RecordLookupService {

  private final TableConfigRegistry registry;
  private final Fetcher fetcher;
  private final FilterNormalizer normalizer;
  private final FilterParser parser;

  public RecordLookupService(TableConfigRegistry registry, Fetcher fetcher,
      FilterNormalizer normalizer, FilterParser parser) {
    this.registry = registry;
    this.fetcher = fetcher;
    this.normalizer = normalizer;
    this.parser = parser;
  }

  /** Looks a record up by {@code idField}, or the table's key column when blank. */
  public Optional<Map<String, Object>> getRecord(String table, String id, String idField) {
    CacheConfig config = registry.require(table);
    if (id == null || id.isBlank()) throw new InvalidRequestException("Record id is required");

    String field = (idField != null && !idField.isBlank()) ? idField.trim() : keyColumn(config);
    String value = id.trim().matches("-?\\d+") ? id.trim() : "'" + id.replace("'", "''") + "'";
    String filter = "\"" + field + "\" eq " + value;

    FetchResult result = fetcher.fetch(new FetchRequest(table, filter, null, null, 1, 0, false));
    return result.getRows().stream().findFirst();
  }

  /** Remote count of rows matching {@code filter} (all rows when blank). */
  public long count(String table, String filter) {
    CacheConfig config = registry.require(table);
    FilterExpression parsed = parser.parse(normalizer.normalize(filter));

    // the remote side reports 0 with $top=0, so ask for one narrow row
    FetchRequest request = new FetchRequest(table, parsed != null ? parsed.toOData() : null,
        keyColumn(config), null, 1, 0, true);
    FetchResult result = fetcher.fetch(request);
    return (result.getCount() != null) ? result.getCount() : result.getRows().size();
  }

  private static String keyColumn(CacheConfig config) {
    return (config.getKeyColumn() != null) ? config.getKeyColumn() : CacheConfig.DEFAULT_KEY_COLUMN;
  }
}
