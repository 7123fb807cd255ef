package com.mk.fx.qa.bench.run;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** A validated {@link RunRequest}: every path exists and the output directory is resolved. */
public record RunConfiguration(
    Path environment,
    List<Path> testplans,
    Path outputDir,
    Optional<String> filter,
    int verbosity) {

  public RunConfiguration {
    testplans = List.copyOf(testplans);
  }
}
