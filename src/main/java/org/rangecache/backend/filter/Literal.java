package org.rangecache.backend.filter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

public final class Literal {

  public enum Type { STRING, NUMBER, DATE, BOOLEAN, NULL }

  private static final Literal NULL = new Literal(Type.NULL, null);

  private final Type type;
  private final Object value;

  private Literal(Type type, Object value) {
    this.type = type;
    this.value = value;
  }

  public static Literal ofString(String s) {
    return new Literal(Type.STRING, Objects.requireNonNull(s));
  }

  public static Literal ofNumber(BigDecimal n) {
    return new Literal(Type.NUMBER, Objects.requireNonNull(n));
  }

  public static Literal ofDate(LocalDate d) {
    return new Literal(Type.DATE, Objects.requireNonNull(d));
  }

  public static Literal ofBoolean(boolean b) {
    return new Literal(Type.BOOLEAN, b);
  }

  public static Literal nullValue() {
    return NULL;
  }

  public Type getType() {
    return type;
  }

  public Object getValue() {
    return value;
  }

  public LocalDate asDate() {
    return (LocalDate) value;
  }

  public String toOData() {
    switch (type) {
      case STRING:
        return "'" + ((String) value).replace("'", "''") + "'";
      case NUMBER:
        return ((BigDecimal) value).toPlainString();
      case NULL:
        return "null";
      default:
        return String.valueOf(value);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Literal other)) return false;
    return type == other.type && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return toOData();
  }
}
