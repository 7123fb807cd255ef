package com.mk.fx.qa.bench.report.plot;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/** Context keys that can be used as the x axis. Their values must read as integers. */
public enum XAxisKey {
  IODEPTH("iodepth", "I/O depth"),
  NUMJOBS("numjobs", "Number of jobs"),
  THREADS("threads", "Threads"),
  CLIENTS("clients", "Clients");

  private final String key;
  private final String axisLabel;

  XAxisKey(String key, String axisLabel) {
    this.key = key;
    this.axisLabel = axisLabel;
  }

  public String key() {
    return key;
  }

  public String axisLabel() {
    return axisLabel;
  }

  public static XAxisKey fromValue(String value) {
    return Arrays.stream(values())
        .filter(k -> k.key.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported x-axis key: " + value));
  }

  public static Set<String> keys() {
    return Arrays.stream(values()).map(XAxisKey::key).collect(Collectors.toUnmodifiableSet());
  }
}
