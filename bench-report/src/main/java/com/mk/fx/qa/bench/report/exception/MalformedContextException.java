package com.mk.fx.qa.bench.report.exception;

import lombok.Getter;

/** A record's context lacks the x-axis key or holds a value with no integer reading. */
@Getter
public class MalformedContextException extends BenchReportException {

  private final String key;
  private final String fname;

  public MalformedContextException(String key, String fname, String detail) {
    super("Record from '" + fname + "' has unusable context key '" + key + "': " + detail);
    this.key = key;
    this.fname = fname;
  }

  public MalformedContextException(String key, String fname, String detail, Throwable cause) {
    super("Record from '" + fname + "' has unusable context key '" + key + "': " + detail, cause);
    this.key = key;
    this.fname = fname;
  }
}
