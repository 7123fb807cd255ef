package com.mk.fx.qa.bench.cli;

import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.annotations.restrictions.Required;
import com.mk.fx.qa.bench.cfg.HarnessCfg;
import com.mk.fx.qa.bench.plot.PlotOutcome;
import com.mk.fx.qa.bench.plot.PlotRequest;
import com.mk.fx.qa.bench.plot.PlotService;
import com.mk.fx.qa.bench.report.plot.ArtifactWriteFailure;
import com.mk.fx.qa.bench.report.plot.AxisScale;
import com.mk.fx.qa.bench.report.plot.Metric;
import com.mk.fx.qa.bench.report.plot.PlotKind;
import com.mk.fx.qa.bench.report.plot.PlotSettings;
import com.mk.fx.qa.bench.report.plot.SaveFormat;
import com.mk.fx.qa.bench.report.plot.XAxisKey;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationContext;

@Slf4j
@Command(name = "plot", description = "Aggregate collected metrics into series and plot them")
public class PlotCommand implements HarnessCommand {

  @Option(
      name = {"-r", "--output-root"},
      title = "dir",
      description = "Result tree of a finished run")
  @Required
  String outputRoot;

  @Option(name = "--kind", title = "kind", description = "line or scatter")
  String kind = "line";

  @Option(
      name = {"-m", "--metric"},
      title = "metric",
      description = "throughput, bandwidth, latency or iops (default iops)")
  String metric = "iops";

  @Option(
      name = {"-x", "--x-key"},
      title = "key",
      description = "iodepth, numjobs, threads or clients (default iodepth)")
  String xKey = "iodepth";

  @Option(name = "--x-scale", title = "scale", description = "linear, log, symlog or logit")
  String xScale = "linear";

  @Option(name = "--y-scale", title = "scale", description = "linear, log, symlog or logit")
  String yScale = "linear";

  @Option(name = "--title", title = "text", description = "Chart title")
  String title;

  @Option(name = "--x-label", title = "text", description = "X axis label")
  String xLabel;

  @Option(name = "--y-label", title = "text", description = "Y axis label")
  String yLabel;

  @Option(
      name = {"-l", "--label"},
      title = "template",
      description = "Mustache template for series labels, e.g. '{{bs}} {{rw}}'")
  String label;

  @Option(name = "--show", description = "Open the chart in a window")
  boolean show;

  @Option(name = "--save", description = "Write chart images next to the results")
  boolean save;

  @Option(name = "--save-format", title = "format", description = "png or pdf; repeatable")
  List<String> saveFormats = new ArrayList<>();

  @Option(name = "--no-data", description = "Skip writing the aggregated series JSON")
  boolean noData;

  @Override
  public boolean needsDisplay() {
    return show;
  }

  /**
   * @throws IllegalArgumentException on an unknown kind, metric, key, scale or format
   */
  PlotRequest toRequest(HarnessCfg cfg) {
    PlotSettings settings =
        PlotSettings.builder()
            .kind(PlotKind.fromValue(kind))
            .metric(Metric.fromValue(metric))
            .xAxis(XAxisKey.fromValue(xKey))
            .xScale(AxisScale.fromValue(xScale))
            .yScale(AxisScale.fromValue(yScale))
            .title(title)
            .xLabel(xLabel)
            .yLabel(yLabel)
            .width(cfg.getPlot().getWidth())
            .height(cfg.getPlot().getHeight())
            .build();
    List<SaveFormat> formats = saveFormats.stream().map(SaveFormat::fromValue).toList();
    return new PlotRequest(Path.of(outputRoot), settings, label, !noData, save, formats, show);
  }

  @Override
  public int execute(ApplicationContext context) {
    PlotRequest request = toRequest(context.getBean(HarnessCfg.class));
    PlotOutcome outcome = context.getBean(PlotService.class).plot(request);
    if (!outcome.successful()) {
      for (ArtifactWriteFailure failure : outcome.failures()) {
        log.error(failure.message());
      }
      return 1;
    }
    return 0;
  }
}
