package org.rangecache.backend.filter;

import org.rangecache.backend.model.DateRange;

/**
 * Outcome of {@link FilterClassifier#classify}: either a date-scoped request with its requested
 * range and residual filter, or not date-scoped with the reason the cache must be bypassed.
 */
public final class FilterClassification {

  private final boolean dateScoped;
  private final DateRange range;
  private final FilterExpression residual;
  private final String reason;

  private FilterClassification(boolean dateScoped, DateRange range, FilterExpression residual, String reason) {
    this.dateScoped = dateScoped;
    this.range = range;
    this.residual = residual;
    this.reason = reason;
  }

  public static FilterClassification dateScoped(DateRange range, FilterExpression residual) {
    return new FilterClassification(true, range, residual, null);
  }

  public static FilterClassification notDateScoped(String reason) {
    return new FilterClassification(false, DateRange.empty(), null, reason);
  }

  public boolean isDateScoped() {
    return dateScoped;
  }

  public DateRange getRange() {
    return range;
  }

  /** Predicates on other columns, or null when there are none. */
  public FilterExpression getResidual() {
    return residual;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return dateScoped
        ? "DateScoped{range=" + range + ", residual=" + residual + "}"
        : "NotDateScoped{" + reason + "}";
  }
}
