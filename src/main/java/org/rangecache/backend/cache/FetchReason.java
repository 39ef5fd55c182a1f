package org.rangecache.backend.cache;

public enum FetchReason {
  LEADING_GAP,
  TRAILING_GAP,
  TODAY_REFRESH,
  /** Whole-table load of a CACHE_ALL table. */
  FULL_LOAD
}
