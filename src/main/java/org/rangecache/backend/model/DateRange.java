package org.rangecache.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive closed interval of calendar dates.
 *
 * <p>{@link #empty()} is a distinguished value meaning "nothing covered". A non-empty range always
 * has {@code start <= end}.
 */
public final class DateRange {

  private static final DateRange EMPTY = new DateRange(null, null);

  private final LocalDate start;
  private final LocalDate end;

  private DateRange(LocalDate start, LocalDate end) {
    this.start = start;
    this.end = end;
  }

  public static DateRange of(LocalDate start, LocalDate end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("Range start " + start + " is after end " + end);
    }
    return new DateRange(start, end);
  }

  public static DateRange singleDay(LocalDate day) {
    return of(day, day);
  }

  public static DateRange empty() {
    return EMPTY;
  }

  public LocalDate getStart() {
    return start;
  }

  public LocalDate getEnd() {
    return end;
  }

  public boolean isEmpty() {
    return start == null;
  }

  public boolean contains(LocalDate day) {
    if (isEmpty() || day == null) return false;
    return !day.isBefore(start) && !day.isAfter(end);
  }

  public boolean intersects(DateRange other) {
    if (isEmpty() || other.isEmpty()) return false;
    return !other.end.isBefore(start) && !other.start.isAfter(end);
  }

  /** The empty range is adjacent to everything, so it can always be unioned. */
  public boolean overlapsOrAdjacent(DateRange other) {
    if (isEmpty() || other.isEmpty()) return true;
    return !other.end.plusDays(1).isBefore(start) && !other.start.minusDays(1).isAfter(end);
  }

  public DateRange union(DateRange other) {
    if (other.isEmpty()) return this;
    if (isEmpty()) return other;
    if (!overlapsOrAdjacent(other)) {
      throw new IllegalArgumentException("Cannot union disjoint ranges " + this + " and " + other);
    }
    LocalDate s = start.isBefore(other.start) ? start : other.start;
    LocalDate e = end.isAfter(other.end) ? end : other.end;
    return new DateRange(s, e);
  }

  public DateRange intersection(DateRange other) {
    if (!intersects(other)) return EMPTY;
    LocalDate s = start.isAfter(other.start) ? start : other.start;
    LocalDate e = end.isBefore(other.end) ? end : other.end;
    return new DateRange(s, e);
  }

  /** Part of this range strictly before {@code covered.start}. */
  public DateRange leadingGap(DateRange covered) {
    if (isEmpty()) return EMPTY;
    if (covered.isEmpty()) return this;
    if (!start.isBefore(covered.start)) return EMPTY;
    LocalDate dayBefore = covered.start.minusDays(1);
    return new DateRange(start, end.isBefore(dayBefore) ? end : dayBefore);
  }

  /** Part of this range strictly after {@code covered.end}. */
  public DateRange trailingGap(DateRange covered) {
    if (isEmpty()) return EMPTY;
    if (covered.isEmpty()) return this;
    if (!end.isAfter(covered.end)) return EMPTY;
    LocalDate dayAfter = covered.end.plusDays(1);
    return new DateRange(start.isAfter(dayAfter) ? start : dayAfter, end);
  }

  @JsonIgnore
  public boolean isSingleDay() {
    return !isEmpty() && start.equals(end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DateRange other)) return false;
    return Objects.equals(start, other.start) && Objects.equals(end, other.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return isEmpty() ? "[]" : "[" + start + ", " + end + "]";
  }
}
