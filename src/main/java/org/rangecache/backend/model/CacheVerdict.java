package org.rangecache.backend.model;

public enum CacheVerdict {
  HIT,
  PARTIAL,
  MISS,
  BYPASS
}
