package org.rangecache.backend.model;

import java.util.Objects;

public final class CacheConfig {

  public static final String DEFAULT_KEY_COLUMN = "PrimaryKey";

  private final CacheMode mode;
  private final String dateColumn;
  private final String keyColumn;
  private final String description;

  public CacheConfig(CacheMode mode, String dateColumn, String keyColumn, String description) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.dateColumn = blankToNull(dateColumn);
    this.keyColumn = blankToNull(keyColumn);
    this.description = description;
  }

  public static CacheConfig none() {
    return new CacheConfig(CacheMode.NONE, null, null, null);
  }

  public static CacheConfig dateRange(String dateColumn, String keyColumn) {
    return new CacheConfig(CacheMode.DATE_RANGE, dateColumn, keyColumn, null);
  }

  public static CacheConfig cacheAll(String keyColumn) {
    return new CacheConfig(CacheMode.CACHE_ALL, null, keyColumn, null);
  }

  public CacheMode getMode() {
    return mode;
  }

  public String getDateColumn() {
    return dateColumn;
  }

  /** May be null, in which case rows are identified by their content. */
  public String getKeyColumn() {
    return keyColumn;
  }

  public String getDescription() {
    return description;
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CacheConfig other)) return false;
    return mode == other.mode
        && Objects.equals(dateColumn, other.dateColumn)
        && Objects.equals(keyColumn, other.keyColumn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(mode, dateColumn, keyColumn);
  }

  @Override
  public String toString() {
    return "CacheConfig{mode=" + mode + ", dateColumn=" + dateColumn + ", keyColumn=" + keyColumn + "}";
  }
}
