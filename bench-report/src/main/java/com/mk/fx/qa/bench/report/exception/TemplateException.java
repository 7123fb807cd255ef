package com.mk.fx.qa.bench.report.exception;

/** A label template is malformed or references a key missing from the context. */
public class TemplateException extends BenchReportException {

  public TemplateException(String message, Throwable cause) {
    super(message, cause);
  }
}
