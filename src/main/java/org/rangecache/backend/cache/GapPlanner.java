package org.rangecache.backend.cache;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.rangecache.backend.model.DateRange;
import org.springframework.stereotype.Component;

/**
 * Works out which slices of a requested range must come from the remote side.
 *
 * <p>Tasks are ordered leading gap, trailing gap, today refresh. The today slice is refetched
 * whenever it is requested and already covered, since rows for the current day keep changing.
 *
 * <p>The covered window must stay one interval, so a request lying wholly outside it is widened
 * to reach the covered edge: the bridging days are fetched along with the gap.
 */
@Component
public class GapPlanner {

  public List<FetchTask> plan(DateRange covered, DateRange requested, LocalDate today) {
    List<FetchTask> tasks = new ArrayList<>(3);
    if (requested.isEmpty()) return tasks;

    if (covered.isEmpty()) {
      tasks.add(new FetchTask(requested, FetchReason.LEADING_GAP));
      return tasks;
    }

    DateRange leading = requested.leadingGap(covered);
    if (!leading.isEmpty()) {
      tasks.add(new FetchTask(DateRange.of(leading.getStart(), covered.getStart().minusDays(1)),
          FetchReason.LEADING_GAP));
    }

    DateRange trailing = requested.trailingGap(covered);
    if (!trailing.isEmpty()) {
      tasks.add(new FetchTask(DateRange.of(covered.getEnd().plusDays(1), trailing.getEnd()),
          FetchReason.TRAILING_GAP));
    }

    // gap tasks never touch covered days, so a covered today is not scheduled yet
    if (requested.contains(today) && covered.contains(today)) {
      tasks.add(new FetchTask(DateRange.singleDay(today), FetchReason.TODAY_REFRESH));
    }
    return tasks;
  }
}
