package com.mk.fx.qa.bench.plot;

import com.mk.fx.qa.bench.report.plot.PlotSettings;
import com.mk.fx.qa.bench.report.plot.SaveFormat;
import java.nio.file.Path;
import java.util.List;

/**
 * One reporting pass over a finished result tree.
 *
 * @param outputRoot result tree to collect from; aggregate data and images are written here too
 * @param settings chart settings
 * @param labelTemplate Mustache template for series labels, or null to label by fingerprint
 * @param writeData whether to write {@code <plot-name>.json}
 * @param save whether to write images
 * @param formats image formats written when {@code save} is set
 * @param show whether to open the chart in a window
 */
public record PlotRequest(
    Path outputRoot,
    PlotSettings settings,
    String labelTemplate,
    boolean writeData,
    boolean save,
    List<SaveFormat> formats,
    boolean show) {

  public PlotRequest {
    formats =
        formats == null || formats.isEmpty() ? List.of(SaveFormat.PNG) : List.copyOf(formats);
  }
}
