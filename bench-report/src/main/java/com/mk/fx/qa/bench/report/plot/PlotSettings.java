package com.mk.fx.qa.bench.report.plot;

import java.util.Locale;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** What to draw and how. Title and axis labels fall back to the metric and x-axis defaults. */
@Value
@Builder
public class PlotSettings {

  @Builder.Default @NonNull PlotKind kind = PlotKind.LINE;
  @NonNull Metric metric;
  @NonNull XAxisKey xAxis;
  @Builder.Default @NonNull AxisScale xScale = AxisScale.LINEAR;
  @Builder.Default @NonNull AxisScale yScale = AxisScale.LINEAR;
  String title;
  String xLabel;
  String yLabel;
  @Builder.Default int width = 1024;
  @Builder.Default int height = 640;

  public String effectiveTitle() {
    return isBlank(title) ? metric.title() + " vs " + xAxis.axisLabel() : title;
  }

  public String effectiveXLabel() {
    return isBlank(xLabel) ? xAxis.axisLabel() : xLabel;
  }

  public String effectiveYLabel() {
    return isBlank(yLabel) ? metric.axisLabel() : yLabel;
  }

  /** Base name shared by the data file and the images, e.g. {@code line_iops_vs_iodepth}. */
  public String plotName() {
    return (kind.name() + "_" + metric.key() + "_vs_" + xAxis.key()).toLowerCase(Locale.ROOT);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
