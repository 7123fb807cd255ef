package com.mk.fx.qa.bench.report.plot;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Metrics that can be plotted, with their display unit. Samples are stored in raw units and only
 * the tick labels are divided by {@link #unitDivisor()}.
 */
public enum Metric {
  THROUGHPUT("throughput", "Throughput", "kops/s", 1_000d),
  BANDWIDTH("bandwidth", "Bandwidth", "MiB/s", 1024d * 1024d),
  LATENCY("latency", "Latency", "us", 1_000d),
  IOPS("iops", "IOPS", "kIOPS", 1_000d);

  private final String key;
  private final String title;
  private final String unit;
  private final double unitDivisor;

  Metric(String key, String title, String unit, double unitDivisor) {
    this.key = key;
    this.title = title;
    this.unit = unit;
    this.unitDivisor = unitDivisor;
  }

  /** Field name in the result artifact. */
  public String key() {
    return key;
  }

  public String title() {
    return title;
  }

  public String unit() {
    return unit;
  }

  public double unitDivisor() {
    return unitDivisor;
  }

  public String axisLabel() {
    return title + " [" + unit + "]";
  }

  public static Metric fromValue(String value) {
    return Arrays.stream(values())
        .filter(m -> m.key.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported metric: " + value));
  }

  public static Set<String> keys() {
    return Arrays.stream(values()).map(Metric::key).collect(Collectors.toUnmodifiableSet());
  }
}
