package com.mk.fx.qa.bench.plot;

import com.mk.fx.qa.bench.exception.ConfigException;
import com.mk.fx.qa.bench.report.aggregate.SeriesAggregator;
import com.mk.fx.qa.bench.report.collect.CollectionResult;
import com.mk.fx.qa.bench.report.collect.MetricsCollector;
import com.mk.fx.qa.bench.report.label.LabelRenderer;
import com.mk.fx.qa.bench.report.model.Series;
import com.mk.fx.qa.bench.report.plot.ArtifactWriteFailure;
import com.mk.fx.qa.bench.report.plot.ChartHandle;
import com.mk.fx.qa.bench.report.plot.PlotRenderer;
import com.mk.fx.qa.bench.report.plot.PlotSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Collect, aggregate, render and write, in that order. The tree must no longer be written to by
 * a running session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlotService {

  private final MetricsCollector collector;
  private final SeriesAggregator aggregator;
  private final PlotRenderer renderer;

  /**
   * @throws ConfigException if the root is not a directory or the tree holds no records
   * @throws com.mk.fx.qa.bench.report.exception.TemplateException if the label template does not
   *     compile, or references a key missing from a series context
   * @throws com.mk.fx.qa.bench.report.exception.BenchReportException on the first defective
   *     record; nothing is written in that case
   */
  public PlotOutcome plot(PlotRequest request) {
    Path root = request.outputRoot();
    if (root == null || !Files.isDirectory(root)) {
      throw new ConfigException("Output root is not a directory", root);
    }
    LabelRenderer labels =
        request.labelTemplate() == null ? null : new LabelRenderer(request.labelTemplate());

    CollectionResult collected;
    try {
      collected = collector.collect(root);
    } catch (IOException e) {
      throw new ConfigException("Cannot read output root", root, e);
    }
    if (collected.records().isEmpty()) {
      throw new ConfigException("No metric records found under", root);
    }
    if (collected.hasWarnings()) {
      log.warn("{} artifact(s) skipped while collecting {}", collected.warnings().size(), root);
    }

    PlotSettings settings = request.settings();
    Map<String, Series> series =
        aggregator.aggregate(
            collected.records(), settings.getMetric().key(), settings.getXAxis().key(), labels);
    ChartHandle chart = renderer.render(series, settings);
    log.info(
        "Plotted {} records from {} artifacts as {} series",
        collected.records().size(),
        collected.artifactCount(),
        series.size());

    List<ArtifactWriteFailure> failures = new ArrayList<>();
    if (request.writeData()) {
      renderer.writeData(series, root, chart.plotName()).ifPresent(failures::add);
    }
    if (request.save()) {
      failures.addAll(renderer.save(chart, root, request.formats()));
    }
    if (request.show()) {
      renderer.show(chart);
    }
    return new PlotOutcome(chart, collected.records().size(), collected.warnings(), failures);
  }
}
