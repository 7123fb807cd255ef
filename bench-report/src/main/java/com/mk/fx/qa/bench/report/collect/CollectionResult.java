package com.mk.fx.qa.bench.report.collect;

import com.mk.fx.qa.bench.report.model.MetricRecord;
import java.util.List;

/**
 * Records gathered from a result tree plus everything that had to be skipped.
 *
 * @param records samples in artifact visit order
 * @param warnings unreadable or malformed artifacts
 * @param artifactCount number of artifacts that were read successfully
 */
public record CollectionResult(
    List<MetricRecord> records, List<CollectionWarning> warnings, int artifactCount) {

  public CollectionResult {
    records = List.copyOf(records);
    warnings = List.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
