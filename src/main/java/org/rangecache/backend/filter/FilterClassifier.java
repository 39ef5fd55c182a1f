package org.rangecache.backend.filter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.rangecache.backend.filter.FilterExpression.Comparison;
import org.rangecache.backend.model.DateRange;
import org.springframework.stereotype.Component;

/**
 * Decides whether a filter reduces to one closed interval on the configured date column.
 *
 * <p>Only top-level AND conjuncts of the form {@code dateColumn (eq|ge|gt|le|lt) <date>} bound the
 * range; {@code gt}/{@code lt} are turned into inclusive bounds. Any other use of the date column
 * (inside or/not, a function, {@code ne}, a non-date value) is ambiguous and classifies as not
 * date-scoped. Both bounds are required. The remaining conjuncts become the residual filter, which
 * must be locally evaluable.
 */
@Component
public class FilterClassifier {

  private final RowFilterEvaluator evaluator;

  public FilterClassifier(RowFilterEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  public FilterClassification classify(FilterExpression filter, String dateColumn) {
    if (dateColumn == null || dateColumn.isBlank()) {
      return FilterClassification.notDateScoped("table has no date column");
    }
    if (filter == null) {
      return FilterClassification.notDateScoped("no filter on " + dateColumn);
    }

    LocalDate lower = null;
    LocalDate upper = null;
    boolean sawDateBound = false;
    List<FilterExpression> residual = new ArrayList<>();

    for (FilterExpression part : FilterExpression.conjuncts(filter)) {
      if (part instanceof Comparison cmp && cmp.getField().equals(dateColumn)) {
        if (cmp.getValue().getType() != Literal.Type.DATE) {
          return FilterClassification.notDateScoped("ambiguous: " + dateColumn + " compared with a non-date value");
        }
        LocalDate d = cmp.getValue().asDate();
        switch (cmp.getOperator()) {
          case EQ:
            lower = max(lower, d);
            upper = min(upper, d);
            break;
          case GE:
            lower = max(lower, d);
            break;
          case GT:
            lower = max(lower, d.plusDays(1));
            break;
          case LE:
            upper = min(upper, d);
            break;
          case LT:
            upper = min(upper, d.minusDays(1));
            break;
          default:
            return FilterClassification.notDateScoped("ambiguous: '" + cmp.getOperator().keyword() + "' on " + dateColumn);
        }
        sawDateBound = true;
      } else if (part.referencesField(dateColumn)) {
        return FilterClassification.notDateScoped("ambiguous: " + dateColumn + " used in " + part.toOData());
      } else {
        residual.add(part);
      }
    }

    if (!sawDateBound) {
      return FilterClassification.notDateScoped("no predicate on " + dateColumn);
    }
    if (lower == null || upper == null) {
      return FilterClassification.notDateScoped("open-ended range on " + dateColumn);
    }
    if (lower.isAfter(upper)) {
      return FilterClassification.notDateScoped("empty range on " + dateColumn);
    }

    FilterExpression rest = residual.isEmpty() ? null : FilterExpression.and(residual);
    if (!evaluator.canEvaluate(rest)) {
      return FilterClassification.notDateScoped("residual filter cannot be evaluated locally: " + rest.toOData());
    }
    return FilterClassification.dateScoped(DateRange.of(lower, upper), rest);
  }

  private static LocalDate max(LocalDate a, LocalDate b) {
    return (a == null || b.isAfter(a)) ? b : a;
  }

  private static LocalDate min(LocalDate a, LocalDate b) {
    return (a == null || b.isBefore(a)) ? b : a;
  }
}
