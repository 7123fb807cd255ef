package com.mk.fx.qa.bench.plot;

import com.mk.fx.qa.bench.report.collect.CollectionWarning;
import com.mk.fx.qa.bench.report.plot.ArtifactWriteFailure;
import com.mk.fx.qa.bench.report.plot.ChartHandle;
import java.util.List;

/** What a reporting pass produced and what it could not write. */
public record PlotOutcome(
    ChartHandle chart,
    int recordCount,
    List<CollectionWarning> warnings,
    List<ArtifactWriteFailure> failures) {

  public PlotOutcome {
    warnings = List.copyOf(warnings);
    failures = List.copyOf(failures);
  }

  public boolean successful() {
    return failures.isEmpty();
  }
}
