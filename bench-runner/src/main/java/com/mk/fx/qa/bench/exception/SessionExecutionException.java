package com.mk.fx.qa.bench.exception;

import java.nio.file.Path;
import lombok.Getter;

/** The test execution step failed or was interrupted while the session held its lock. */
@Getter
public class SessionExecutionException extends HarnessException {

  private final Path retainedLock;

  public SessionExecutionException(String message, Path retainedLock, Throwable cause) {
    super(message, cause);
    this.retainedLock = retainedLock;
  }
}
