package com.mk.fx.qa.bench.report.plot;

import java.util.Arrays;

/** Chart styles. */
public enum PlotKind {
  /** Markers joined by lines. */
  LINE,
  /** Markers only. */
  SCATTER;

  public static PlotKind fromValue(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported plot kind: " + value));
  }
}
