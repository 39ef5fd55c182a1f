package org.rangecache.backend.filter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;
import org.rangecache.backend.filter.FilterExpression.And;
import org.rangecache.backend.filter.FilterExpression.Comparison;
import org.rangecache.backend.filter.FilterExpression.FunctionCall;
import org.rangecache.backend.filter.FilterExpression.Not;
import org.rangecache.backend.filter.FilterExpression.Or;
import org.springframework.stereotype.Component;

/**
 * Evaluates a filter against a cached row. Only comparisons, and/or/not, and the string functions
 * contains/startswith/endswith are supported; {@link #canEvaluate} tells callers whether a filter
 * stays inside that subset.
 *
 * <p>Comparison rules: number literals compare numerically, date literals compare against the
 * row value read as a date, string literals compare against the value's text. A missing value only
 * satisfies {@code eq null} and {@code ne <literal>}.
 */
@Component
public class RowFilterEvaluator {

  private static final Set<String> STRING_FUNCTIONS = Set.of("contains", "startswith", "endswith");

  public boolean canEvaluate(FilterExpression expr) {
    if (expr == null) return true;
    if (expr instanceof Comparison) return true;
    if (expr instanceof And and) return and.getOperands().stream().allMatch(this::canEvaluate);
    if (expr instanceof Or or) return or.getOperands().stream().allMatch(this::canEvaluate);
    if (expr instanceof Not not) return canEvaluate(not.getOperand());
    if (expr instanceof FunctionCall fn) {
      return STRING_FUNCTIONS.contains(fn.getName())
          && fn.getArguments().size() == 1
          && fn.getArguments().get(0).getType() == Literal.Type.STRING;
    }
    return false;
  }

  public boolean matches(FilterExpression expr, Map<String, Object> row) {
    if (expr == null) return true;
    if (expr instanceof Comparison cmp) return compare(cmp, row.get(cmp.getField()));
    if (expr instanceof And and) {
      for (FilterExpression op : and.getOperands()) {
        if (!matches(op, row)) return false;
      }
      return true;
    }
    if (expr instanceof Or or) {
      for (FilterExpression op : or.getOperands()) {
        if (matches(op, row)) return true;
      }
      return false;
    }
    if (expr instanceof Not not) return !matches(not.getOperand(), row);
    if (expr instanceof FunctionCall fn && canEvaluate(fn)) {
      String text = RowValues.text(row.get(fn.getField()));
      if (text == null) return false;
      String arg = (String) fn.getArguments().get(0).getValue();
      switch (fn.getName()) {
        case "contains":
          return text.contains(arg);
        case "startswith":
          return text.startsWith(arg);
        default:
          return text.endsWith(arg);
      }
    }
    throw new IllegalArgumentException("Filter cannot be evaluated locally: " + expr.toOData());
  }

  private boolean compare(Comparison cmp, Object value) {
    ComparisonOperator op = cmp.getOperator();
    Literal lit = cmp.getValue();

    if (lit.getType() == Literal.Type.NULL) {
      if (op == ComparisonOperator.EQ) return value == null;
      if (op == ComparisonOperator.NE) return value != null;
      return false;
    }
    if (value == null) {
      return op == ComparisonOperator.NE;
    }

    Integer c = compareToLiteral(value, lit);
    if (c == null) {
      // values of a different kind are never equal and never ordered
      return op == ComparisonOperator.NE;
    }
    switch (op) {
      case EQ:
        return c == 0;
      case NE:
        return c != 0;
      case GT:
        return c > 0;
      case GE:
        return c >= 0;
      case LT:
        return c < 0;
      default:
        return c <= 0;
    }
  }

  private Integer compareToLiteral(Object value, Literal lit) {
    switch (lit.getType()) {
      case NUMBER: {
        BigDecimal v = RowValues.toBigDecimal(value);
        return v == null ? null : v.compareTo((BigDecimal) lit.getValue());
      }
      case DATE: {
        LocalDate d = RowValues.toLocalDate(value);
        return d == null ? null : d.compareTo(lit.asDate());
      }
      case BOOLEAN: {
        Boolean b = RowValues.toBoolean(value);
        return b == null ? null : Boolean.compare(b, (Boolean) lit.getValue());
      }
      default:
        return RowValues.text(value).compareTo((String) lit.getValue());
    }
  }
}
