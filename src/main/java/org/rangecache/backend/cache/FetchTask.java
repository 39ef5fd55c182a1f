package org.rangecache.backend.cache;

import java.util.Objects;
import org.rangecache.backend.model.DateRange;

public final class FetchTask {

  private final DateRange range;
  private final FetchReason reason;

  public FetchTask(DateRange range, FetchReason reason) {
    this.range = Objects.requireNonNull(range);
    this.reason = Objects.requireNonNull(reason);
  }

  public static FetchTask fullLoad() {
    return new FetchTask(DateRange.empty(), FetchReason.FULL_LOAD);
  }

  public DateRange getRange() {
    return range;
  }

  public FetchReason getReason() {
    return reason;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FetchTask other)) return false;
    return range.equals(other.range) && reason == other.reason;
  }

  @Override
  public int hashCode() {
    return Objects.hash(range, reason);
  }

  @Override
  public String toString() {
    return reason + " " + range;
  }
}
