package com.mk.fx.qa.bench.report.exception;

/** Base type for data and rendering defects raised by the reporting pipeline. */
public abstract class BenchReportException extends RuntimeException {

  protected BenchReportException(String message) {
    super(message);
  }

  protected BenchReportException(String message, Throwable cause) {
    super(message, cause);
  }
}
