package com.mk.fx.qa.bench.report.plot;

import java.nio.file.Path;

/**
 * An output file that could not be written. Failures are collected per file so that one broken
 * format does not prevent the others from being written.
 *
 * @param path target file
 * @param cause underlying error
 */
public record ArtifactWriteFailure(Path path, Exception cause) {

  public String message() {
    return path + ": " + cause.getMessage();
  }
}
