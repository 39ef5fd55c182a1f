package org.rangecache.backend.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.rangecache.backend.config.CacheProperties;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.model.CacheConfig;
import org.rangecache.backend.model.CacheMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Known tables and their cache settings. */
@Service
public class TableConfigRegistry {

  private static final Logger log = LoggerFactory.getLogger(TableConfigRegistry.class);

  private final Map<String, CacheConfig> configs = new LinkedHashMap<>();

  public TableConfigRegistry(CacheProperties properties) {
    properties.getTables().forEach((table, p) -> configs.put(table, toConfig(table, p)));
    log.info("✅ Loaded cache config for {} table(s): {}", configs.size(), configs.keySet());
  }

  public synchronized CacheConfig require(String table) {
    CacheConfig config = (table != null) ? configs.get(table) : null;
    if (config == null) {
      throw new InvalidRequestException("Unknown table '" + table + "'. Available tables: "
          + String.join(", ", configs.keySet()));
    }
    return config;
  }

  public synchronized Map<String, CacheConfig> all() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(configs));
  }

  /** Returns the previous config, or null for a new table. */
  public synchronized CacheConfig update(String table, CacheProperties.TableProperties p) {
    return configs.put(table, toConfig(table, p));
  }

  static CacheConfig toConfig(String table, CacheProperties.TableProperties p) {
    CacheMode mode = (p.getMode() != null) ? p.getMode() : CacheMode.NONE;
    if (mode == CacheMode.DATE_RANGE && (p.getDateColumn() == null || p.getDateColumn().isBlank())) {
      log.warn("⚠️ Table {} is DATE_RANGE but has no date-column, caching disabled", table);
      mode = CacheMode.NONE;
    }
    return new CacheConfig(mode, p.getDateColumn(), p.getKeyColumn(), p.getDescription());
  }
}
