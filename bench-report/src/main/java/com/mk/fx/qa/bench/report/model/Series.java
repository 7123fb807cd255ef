package com.mk.fx.qa.bench.report.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Points of one fingerprint group, in the order they were added until {@link #sortByX()} is
 * called. Sorting seals the series: no points can be added afterwards, so x stays
 * non-decreasing.
 */
public final class Series {

  /** One (x, y) sample. */
  public record Point(long x, double y) {}

  private final String fingerprint;
  private final String label;
  private final MetricContext context;
  private final List<Point> points = new ArrayList<>();
  private boolean sealed;

  public Series(String fingerprint, String label, MetricContext context) {
    this.fingerprint = fingerprint;
    this.label = label;
    this.context = context;
  }

  /**
   * @throws IllegalStateException if the series was already sorted
   */
  public void add(long x, double y) {
    if (sealed) {
      throw new IllegalStateException("Series " + fingerprint + " is sorted and sealed");
    }
    points.add(new Point(x, y));
  }

  /** Stable sort: points with equal x keep the order they were added in. */
  public void sortByX() {
    points.sort(Comparator.comparingLong(Point::x));
    sealed = true;
  }

  public boolean isSealed() {
    return sealed;
  }

  public String fingerprint() {
    return fingerprint;
  }

  public String label() {
    return label;
  }

  /** Context shared by every point, without the x-key and volatile keys. */
  public MetricContext context() {
    return context;
  }

  public List<Point> points() {
    return Collections.unmodifiableList(points);
  }

  public long[] xValues() {
    return points.stream().mapToLong(Point::x).toArray();
  }

  public double[] yValues() {
    return points.stream().mapToDouble(Point::y).toArray();
  }

  public int size() {
    return points.size();
  }
}
