package org.rangecache.backend.filter;

import java.util.Locale;

public enum ComparisonOperator {
  EQ, NE, GT, GE, LT, LE;

  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Null when {@code word} is not a comparison keyword. */
  public static ComparisonOperator fromKeyword(String word) {
    for (ComparisonOperator op : values()) {
      if (op.keyword().equals(word)) return op;
    }
    return null;
  }
}
