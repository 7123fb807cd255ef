package com.mk.fx.qa.bench.report.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One performance sample written by the test execution engine.
 *
 * @param metrics numeric fields keyed by metric name (throughput, bandwidth, latency, ...)
 * @param context parameters the sample was recorded under; always carries {@code fname} and
 *     {@code timestamp}
 */
public record MetricRecord(Map<String, Double> metrics, MetricContext context) {

  public MetricRecord {
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(context, "context");
    metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    context.requireKeys(MetricContext.VOLATILE_KEYS);
  }

  public OptionalDouble metric(String key) {
    Double value = metrics.get(key);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  /** Name of the file the sample came from, for diagnostics. */
  public String fname() {
    return context.get(MetricContext.FNAME).map(ContextValue::toString).orElse("?");
  }
}
