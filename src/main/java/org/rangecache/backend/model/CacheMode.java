package org.rangecache.backend.model;

public enum CacheMode {
  /** Every request goes straight to the remote source. */
  NONE,
  /** Whole table is loaded once and served from memory. */
  CACHE_ALL,
  /** Rows are cached by a date column and the covered window grows on demand. */
  DATE_RANGE
}
