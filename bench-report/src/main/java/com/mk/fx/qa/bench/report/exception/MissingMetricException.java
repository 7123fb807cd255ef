package com.mk.fx.qa.bench.report.exception;

import lombok.Getter;

/** A record does not carry the metric being aggregated. */
@Getter
public class MissingMetricException extends BenchReportException {

  private final String metric;
  private final String fname;

  public MissingMetricException(String metric, String fname) {
    super("Record from '" + fname + "' has no metric '" + metric + "'");
    this.metric = metric;
    this.fname = fname;
  }
}
