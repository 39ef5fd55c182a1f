package org.rangecache.backend.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Parsed {@code $filter} expression tree. */
public abstract class FilterExpression {

  FilterExpression() {}

  public abstract boolean referencesField(String field);

  /** Remote syntax with every field name double-quoted. */
  public abstract String toOData();

  /** AND of the given parts; a single part is returned as is. */
  public static FilterExpression and(List<FilterExpression> parts) {
    if (parts.isEmpty()) throw new IllegalArgumentException("Empty conjunction");
    if (parts.size() == 1) return parts.get(0);
    return new And(parts);
  }

  /** Top-level conjuncts of {@code expr}, flattening nested ANDs. */
  public static List<FilterExpression> conjuncts(FilterExpression expr) {
    List<FilterExpression> out = new ArrayList<>();
    collectConjuncts(expr, out);
    return out;
  }

  private static void collectConjuncts(FilterExpression expr, List<FilterExpression> out) {
    if (expr instanceof And and) {
      for (FilterExpression op : and.getOperands()) collectConjuncts(op, out);
    } else {
      out.add(expr);
    }
  }

  @Override
  public String toString() {
    return toOData();
  }

  static String quoteName(String name) {
    return "\"" + name + "\"";
  }

  public static final class Comparison extends FilterExpression {
    private final String field;
    private final ComparisonOperator operator;
    private final Literal value;

    public Comparison(String field, ComparisonOperator operator, Literal value) {
      this.field = Objects.requireNonNull(field);
      this.operator = Objects.requireNonNull(operator);
      this.value = Objects.requireNonNull(value);
    }

    public String getField() {
      return field;
    }

    public ComparisonOperator getOperator() {
      return operator;
    }

    public Literal getValue() {
      return value;
    }

    @Override
    public boolean referencesField(String f) {
      return field.equals(f);
    }

    @Override
    public String toOData() {
      return quoteName(field) + " " + operator.keyword() + " " + value.toOData();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Comparison other)) return false;
      return field.equals(other.field) && operator == other.operator && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(field, operator, value);
    }
  }

  public static final class And extends FilterExpression {
    private final List<FilterExpression> operands;

    public And(List<FilterExpression> operands) {
      this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public List<FilterExpression> getOperands() {
      return operands;
    }

    @Override
    public boolean referencesField(String f) {
      return operands.stream().anyMatch(op -> op.referencesField(f));
    }

    @Override
    public String toOData() {
      StringBuilder sb = new StringBuilder();
      for (FilterExpression op : operands) {
        if (sb.length() > 0) sb.append(" and ");
        sb.append(op instanceof Or ? "(" + op.toOData() + ")" : op.toOData());
      }
      return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof And other && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
      return operands.hashCode();
    }
  }

  public static final class Or extends FilterExpression {
    private final List<FilterExpression> operands;

    public Or(List<FilterExpression> operands) {
      this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public List<FilterExpression> getOperands() {
      return operands;
    }

    @Override
    public boolean referencesField(String f) {
      return operands.stream().anyMatch(op -> op.referencesField(f));
    }

    @Override
    public String toOData() {
      StringBuilder sb = new StringBuilder();
      for (FilterExpression op : operands) {
        if (sb.length() > 0) sb.append(" or ");
        sb.append(op.toOData());
      }
      return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Or other && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
      return 31 * operands.hashCode() + 1;
    }
  }

  public static final class Not extends FilterExpression {
    private final FilterExpression operand;

    public Not(FilterExpression operand) {
      this.operand = Objects.requireNonNull(operand);
    }

    public FilterExpression getOperand() {
      return operand;
    }

    @Override
    public boolean referencesField(String f) {
      return operand.referencesField(f);
    }

    @Override
    public String toOData() {
      return "not (" + operand.toOData() + ")";
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Not other && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
      return 31 * operand.hashCode() + 2;
    }
  }

  /** Boolean function over one field, e.g. {@code contains(Name,'abc')}. */
  public static final class FunctionCall extends FilterExpression {
    private final String name;
    private final String field;
    private final List<Literal> arguments;

    public FunctionCall(String name, String field, List<Literal> arguments) {
      this.name = Objects.requireNonNull(name);
      this.field = Objects.requireNonNull(field);
      this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getName() {
      return name;
    }

    public String getField() {
      return field;
    }

    public List<Literal> getArguments() {
      return arguments;
    }

    @Override
    public boolean referencesField(String f) {
      return field.equals(f);
    }

    @Override
    public String toOData() {
      StringBuilder sb = new StringBuilder(name).append('(').append(quoteName(field));
      for (Literal arg : arguments) sb.append(',').append(arg.toOData());
      return sb.append(')').toString();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof FunctionCall other)) return false;
      return name.equals(other.name) && field.equals(other.field) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, field, arguments);
    }
  }
}
