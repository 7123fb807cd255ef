package com.mk.fx.qa.bench.report.plot;

import java.util.Arrays;

/** Image formats a chart can be written as. */
public enum SaveFormat {
  PNG("png"),
  PDF("pdf");

  private final String extension;

  SaveFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  public static SaveFormat fromValue(String value) {
    return Arrays.stream(values())
        .filter(format -> format.extension.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported save format: " + value));
  }
}
