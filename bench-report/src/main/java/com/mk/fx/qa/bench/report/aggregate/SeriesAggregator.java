package com.mk.fx.qa.bench.report.aggregate;

import com.mk.fx.qa.bench.report.exception.MalformedContextException;
import com.mk.fx.qa.bench.report.exception.MissingMetricException;
import com.mk.fx.qa.bench.report.fingerprint.ContextFingerprint;
import com.mk.fx.qa.bench.report.label.LabelRenderer;
import com.mk.fx.qa.bench.report.model.ContextValue;
import com.mk.fx.qa.bench.report.model.MetricContext;
import com.mk.fx.qa.bench.report.model.MetricRecord;
import com.mk.fx.qa.bench.report.model.Series;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups samples into plottable series.
 *
 * <p>Each record contributes the point {@code (context[xKey], metrics[metric])} to the series of
 * its {@link ContextFingerprint}. The first record of a group fixes the series label and retained
 * context. After grouping, every series is sorted by x with ties kept in record order.
 *
 * <p>Data defects abort the whole pass: the first record without the metric raises {@link
 * MissingMetricException} and the first record whose x value is missing or not an integer raises
 * {@link MalformedContextException}. No partial result is returned.
 *
 * <p>The result is ordered by first appearance of each fingerprint, so the same input list always
 * yields the same map in the same order.
 */
@Slf4j
public class SeriesAggregator {

  public Map<String, Series> aggregate(List<MetricRecord> records, String metric, String xKey) {
    return aggregate(records, metric, xKey, null);
  }

  /**
   * @param labels renders the label from the retained context of the first record; when {@code
   *     null} the fingerprint is used as label
   */
  public Map<String, Series> aggregate(
      List<MetricRecord> records, String metric, String xKey, LabelRenderer labels) {
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(xKey, "xKey");

    Map<String, Series> seriesByFingerprint = new LinkedHashMap<>();
    for (MetricRecord record : records) {
      double y = metricValue(record, metric);
      long x = xValue(record, xKey);
      MetricContext reduced = ContextFingerprint.reduce(record.context(), xKey);
      String fingerprint = ContextFingerprint.ofReduced(reduced);

      Series series =
          seriesByFingerprint.computeIfAbsent(
              fingerprint,
              fp -> new Series(fp, labels == null ? fp : labels.render(reduced), reduced));
      series.add(x, y);
    }

    seriesByFingerprint.values().forEach(Series::sortByX);
    log.debug(
        "Aggregated {} records into {} series (metric={}, x={})",
        records.size(),
        seriesByFingerprint.size(),
        metric,
        xKey);
    return Collections.unmodifiableMap(seriesByFingerprint);
  }

  private static double metricValue(MetricRecord record, String metric) {
    OptionalDouble value = record.metric(metric);
    if (value.isEmpty()) {
      throw new MissingMetricException(metric, record.fname());
    }
    return value.getAsDouble();
  }

  private static long xValue(MetricRecord record, String xKey) {
    ContextValue raw =
        record
            .context()
            .get(xKey)
            .orElseThrow(
                () -> new MalformedContextException(xKey, record.fname(), "key is absent"));
    try {
      return raw.asLong();
    } catch (NumberFormatException e) {
      throw new MalformedContextException(
          xKey, record.fname(), "'" + raw + "' is not an integer", e);
    }
  }
}
