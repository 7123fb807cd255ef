package com.mk.fx.qa.bench.exception;

/** Base type for failures of the session runner and the command line. */
public abstract class HarnessException extends RuntimeException {

  protected HarnessException(String message) {
    super(message);
  }

  protected HarnessException(String message, Throwable cause) {
    super(message, cause);
  }
}
