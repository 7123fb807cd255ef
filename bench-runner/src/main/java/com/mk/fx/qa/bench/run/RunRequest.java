package com.mk.fx.qa.bench.run;

import java.nio.file.Path;
import java.util.List;

/**
 * Raw launch parameters as given on the command line.
 *
 * @param testplans testplan files, at least one
 * @param environment environment description file; its name keys the session lock
 * @param output output directory, or null for a fresh one under the configured output root
 * @param filter testcase filter passed to the engine, or null
 * @param verbosity number of {@code -v} flags
 */
public record RunRequest(
    List<Path> testplans, Path environment, Path output, String filter, int verbosity) {

  public RunRequest {
    testplans = testplans == null ? List.of() : List.copyOf(testplans);
  }
}
