package com.mk.fx.qa.bench.report.plot;

import org.knowm.xchart.XYChart;

/**
 * A rendered chart. Every save and show call takes the handle explicitly; the renderer keeps no
 * current-chart state of its own.
 *
 * @param chart the drawn chart
 * @param settings settings it was drawn with; {@link PlotSettings#plotName()} names the output
 */
public record ChartHandle(XYChart chart, PlotSettings settings) {

  public String plotName() {
    return settings.plotName();
  }

  public int seriesCount() {
    return chart.getSeriesMap().size();
  }
}
