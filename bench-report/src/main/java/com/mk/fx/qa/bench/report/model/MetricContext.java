package com.mk.fx.qa.bench.report.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered mapping of context parameter names to values under which a sample
 * was recorded (block size, queue depth, ...).
 */
public final class MetricContext {

  public static final String FNAME = "fname";
  public static final String TIMESTAMP = "timestamp";

  /** Keys that differ between every sample and never take part in grouping. */
  public static final Set<String> VOLATILE_KEYS = Set.of(FNAME, TIMESTAMP);

  private final Map<String, ContextValue> values;

  private MetricContext(Map<String, ContextValue> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static MetricContext of(Map<String, ContextValue> values) {
    return new MetricContext(new LinkedHashMap<>(values));
  }

  /**
   * Builds a context from parser output, converting every value.
   *
   * @throws IllegalArgumentException if a value has an unsupported type
   */
  public static MetricContext fromRaw(Map<String, ?> raw) {
    Map<String, ContextValue> converted = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      try {
        converted.put(entry.getKey(), ContextValue.from(entry.getValue()));
      } catch (IllegalArgumentException | ArithmeticException e) {
        throw new IllegalArgumentException(
            "Context key '" + entry.getKey() + "': " + e.getMessage(), e);
      }
    }
    return new MetricContext(converted);
  }

  public Optional<ContextValue> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /**
   * Checks that every required key is present.
   *
   * @throws IllegalArgumentException naming the first missing key
   */
  public MetricContext requireKeys(Collection<String> keys) {
    for (String key : keys) {
      if (!values.containsKey(key)) {
        throw new IllegalArgumentException("Context is missing required key '" + key + "'");
      }
    }
    return this;
  }

  /** Returns a copy without the given keys, preserving the order of the remaining entries. */
  public MetricContext without(Collection<String> keys) {
    Map<String, ContextValue> copy = new LinkedHashMap<>(values);
    copy.keySet().removeAll(keys);
    return new MetricContext(copy);
  }

  @JsonValue
  public Map<String, ContextValue> asMap() {
    return values;
  }

  /** Raw view used for template rendering. */
  public Map<String, Object> toRawMap() {
    Map<String, Object> raw = new LinkedHashMap<>();
    values.forEach((k, v) -> raw.put(k, v.raw()));
    return raw;
  }

  public int size() {
    return values.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof MetricContext other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
