package com.mk.fx.qa.bench.report.plot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.bench.report.model.Series;
import com.mk.fx.qa.bench.report.utils.ReportMappers;
import java.awt.GraphicsEnvironment;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.IOException;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.swing.JFrame;
import lombok.extern.slf4j.Slf4j;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.SwingWrapper;
import org.knowm.xchart.VectorGraphicsEncoder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.Styler;
import org.knowm.xchart.style.XYStyler;
import org.knowm.xchart.style.markers.Marker;
import org.knowm.xchart.style.markers.SeriesMarkers;

/**
 * Draws aggregated series as an XY chart and writes the chart and its data to disk.
 *
 * <p>One chart series per aggregated series, in map order. Markers cycle through {@link #MARKERS};
 * with more series than markers the palette starts over, so markers repeat.
 */
@Slf4j
public class PlotRenderer {

  static final List<Marker> MARKERS =
      List.of(
          SeriesMarkers.CIRCLE,
          SeriesMarkers.SQUARE,
          SeriesMarkers.DIAMOND,
          SeriesMarkers.TRIANGLE_UP,
          SeriesMarkers.TRIANGLE_DOWN,
          SeriesMarkers.CROSS,
          SeriesMarkers.PLUS);

  private final ObjectMapper dataMapper;

  public PlotRenderer() {
    this(ReportMappers.dataMapper());
  }

  public PlotRenderer(ObjectMapper dataMapper) {
    this.dataMapper = dataMapper;
  }

  static Marker markerFor(int seriesIndex) {
    return MARKERS.get(seriesIndex % MARKERS.size());
  }

  /**
   * Builds the chart.
   *
   * @throws IllegalArgumentException if there is nothing to draw
   */
  public ChartHandle render(Map<String, Series> series, PlotSettings settings) {
    if (series.isEmpty()) {
      throw new IllegalArgumentException("No series to plot");
    }
    XYChart chart =
        new XYChartBuilder()
            .width(settings.getWidth())
            .height(settings.getHeight())
            .title(settings.effectiveTitle())
            .xAxisTitle(settings.effectiveXLabel())
            .yAxisTitle(settings.effectiveYLabel())
            .build();

    XYStyler styler = chart.getStyler();
    styler.setLegendPosition(Styler.LegendPosition.OutsideE);
    styler.setDefaultSeriesRenderStyle(
        settings.getKind() == PlotKind.SCATTER
            ? XYSeries.XYSeriesRenderStyle.Scatter
            : XYSeries.XYSeriesRenderStyle.Line);
    styler.setMarkerSize(8);
    styler.setxAxisTickLabelsFormattingFunction(tickFormatter(settings.getXScale(), 1d));
    styler.setyAxisTickLabelsFormattingFunction(
        tickFormatter(settings.getYScale(), settings.getMetric().unitDivisor()));

    Set<String> usedNames = new HashSet<>();
    int index = 0;
    for (Series s : series.values()) {
      double[] x = settings.getXScale().forward(toDoubles(s.xValues()));
      double[] y = settings.getYScale().forward(s.yValues());
      XYSeries drawn = chart.addSeries(uniqueName(s, usedNames), x, y);
      drawn.setMarker(markerFor(index++));
    }
    log.debug("Rendered {} series for {}", series.size(), settings.plotName());
    return new ChartHandle(chart, settings);
  }

  /**
   * Writes the chart once per format as {@code <dir>/<plot-name>.<ext>}. A format that fails is
   * logged and reported; the remaining formats are still written.
   *
   * @return the failed files, empty when everything was written
   */
  public List<ArtifactWriteFailure> save(
      ChartHandle handle, Path dir, Collection<SaveFormat> formats) {
    List<ArtifactWriteFailure> failures = new ArrayList<>();
    for (SaveFormat format : formats) {
      Path target = dir.resolve(handle.plotName() + "." + format.extension());
      try {
        String base = dir.resolve(handle.plotName()).toString();
        switch (format) {
          case PNG -> BitmapEncoder.saveBitmap(
              handle.chart(), base, BitmapEncoder.BitmapFormat.PNG);
          case PDF -> VectorGraphicsEncoder.saveVectorGraphic(
              handle.chart(), base, VectorGraphicsEncoder.VectorGraphicsFormat.PDF);
        }
        log.info("Wrote {}", target);
      } catch (IOException | RuntimeException e) {
        log.error("Failed to write {}: {}", target, e.getMessage(), e);
        failures.add(new ArtifactWriteFailure(target, e));
      }
    }
    return failures;
  }

  /**
   * Writes {@code <dir>/<name>.json} mapping each fingerprint to its {@code xvals}, {@code
   * yvals}, {@code ctx} and {@code label}.
   *
   * @return the failure, if the file could not be written
   */
  public Optional<ArtifactWriteFailure> writeData(
      Map<String, Series> series, Path dir, String name) {
    Path target = dir.resolve(name + ".json");
    Map<String, Map<String, Object>> document = new LinkedHashMap<>();
    series.forEach(
        (fingerprint, s) -> {
          Map<String, Object> entry = new LinkedHashMap<>();
          entry.put("xvals", s.xValues());
          entry.put("yvals", s.yValues());
          entry.put("ctx", s.context());
          entry.put("label", s.label());
          document.put(fingerprint, entry);
        });
    try {
      dataMapper.writeValue(target.toFile(), document);
      log.info("Wrote {}", target);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to write {}: {}", target, e.getMessage(), e);
      return Optional.of(new ArtifactWriteFailure(target, e));
    }
  }

  /**
   * Opens the chart in a window and blocks until the window is closed. Skipped on headless JVMs.
   */
  public void show(ChartHandle handle) {
    if (GraphicsEnvironment.isHeadless()) {
      log.warn("Cannot show {}: no display available", handle.plotName());
      return;
    }
    JFrame frame = new SwingWrapper<>(handle.chart()).displayChart();
    log.info("Showing {}; close the window to continue", handle.plotName());
    awaitClosed(
        onClose -> {
          frame.addWindowListener(
              new WindowAdapter() {
                @Override
                public void windowClosed(WindowEvent e) {
                  onClose.run();
                }
              });
          if (!frame.isDisplayable()) {
            onClose.run();
          }
        });
  }

  /**
   * Hands a close callback to {@code registration} and waits until it is called.
   *
   * @return false if the wait was interrupted; the interrupt flag is then set again
   */
  static boolean awaitClosed(Consumer<Runnable> registration) {
    CountDownLatch closed = new CountDownLatch(1);
    registration.accept(closed::countDown);
    try {
      closed.await();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the chart window to close");
      return false;
    }
  }

  /** Maps a transformed tick value back to raw units and then to display units. */
  static Function<Double, String> tickFormatter(AxisScale scale, double divisor) {
    DecimalFormat format =
        new DecimalFormat("#,##0.###", DecimalFormatSymbols.getInstance(Locale.ROOT));
    return value -> format.format(scale.inverse(value) / divisor);
  }

  private static String uniqueName(Series s, Set<String> usedNames) {
    String base = s.label() == null || s.label().isBlank() ? s.fingerprint() : s.label();
    String name = base;
    int suffix = 2;
    while (!usedNames.add(name)) {
      name = base + " #" + suffix++;
    }
    return name;
  }

  private static double[] toDoubles(long[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = values[i];
    }
    return out;
  }
}
