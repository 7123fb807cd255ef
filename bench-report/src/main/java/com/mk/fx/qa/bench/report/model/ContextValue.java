package com.mk.fx.qa.bench.report.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A single context parameter value. Values are one of three kinds: integer, float or string.
 *
 * <p>Equality includes the kind, so {@code 4}, {@code 4.0} and {@code "4"} are distinct values and
 * put records into different series.
 */
public final class ContextValue {

  public enum Kind {
    INTEGER,
    FLOAT,
    STRING
  }

  private final Kind kind;
  private final Object value;

  private ContextValue(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static ContextValue ofInteger(long value) {
    return new ContextValue(Kind.INTEGER, value);
  }

  public static ContextValue ofFloat(double value) {
    return new ContextValue(Kind.FLOAT, value);
  }

  public static ContextValue ofString(String value) {
    return new ContextValue(Kind.STRING, Objects.requireNonNull(value, "value"));
  }

  /**
   * Converts a raw value produced by a YAML/JSON parser.
   *
   * @throws IllegalArgumentException for nulls, collections and other unsupported types
   */
  public static ContextValue from(Object raw) {
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
      return ofInteger(((Number) raw).longValue());
    }
    if (raw instanceof BigInteger big) {
      return ofInteger(big.longValueExact());
    }
    if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
      return ofFloat(((Number) raw).doubleValue());
    }
    if (raw instanceof String s) {
      return ofString(s);
    }
    if (raw instanceof Boolean b) {
      return ofString(b.toString());
    }
    String type = raw == null ? "null" : raw.getClass().getSimpleName();
    throw new IllegalArgumentException("Unsupported context value type: " + type);
  }

  public Kind kind() {
    return kind;
  }

  /** Raw value: {@link Long}, {@link Double} or {@link String}. */
  @JsonValue
  public Object raw() {
    return value;
  }

  /**
   * Interprets the value as an integer axis coordinate.
   *
   * @throws NumberFormatException if the value has no exact integer reading
   */
  public long asLong() {
    return switch (kind) {
      case INTEGER -> (Long) value;
      case FLOAT -> {
        double d = (Double) value;
        if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
          throw new NumberFormatException("Not an integral value: " + d);
        }
        yield (long) d;
      }
      case STRING -> Long.parseLong(((String) value).trim());
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ContextValue other)) {
      return false;
    }
    return kind == other.kind && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
