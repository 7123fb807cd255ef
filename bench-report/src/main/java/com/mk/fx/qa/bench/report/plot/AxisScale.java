package com.mk.fx.qa.bench.report.plot;

import java.util.Arrays;

/**
 * Axis scales. Values are plotted in transformed space and tick labels are mapped back through
 * {@link #inverse(double)}, so the charting library only ever sees a linear axis.
 *
 * <p>Values outside a scale's domain (non-positive for {@link #LOG}, outside {@code (0, 1)} for
 * {@link #LOGIT}) become {@code NaN} and are left out of the drawing.
 */
public enum AxisScale {
  LINEAR {
    @Override
    public double forward(double value) {
      return value;
    }

    @Override
    public double inverse(double value) {
      return value;
    }
  },
  LOG {
    @Override
    public double forward(double value) {
      return value > 0 ? Math.log10(value) : Double.NaN;
    }

    @Override
    public double inverse(double value) {
      return Math.pow(10, value);
    }
  },
  /** Logarithmic away from zero, linear near it, defined for negative values too. */
  SYMLOG {
    @Override
    public double forward(double value) {
      return Math.signum(value) * Math.log10(1 + Math.abs(value));
    }

    @Override
    public double inverse(double value) {
      return Math.signum(value) * (Math.pow(10, Math.abs(value)) - 1);
    }
  },
  /** For fractions in {@code (0, 1)}. */
  LOGIT {
    @Override
    public double forward(double value) {
      return value > 0 && value < 1 ? Math.log10(value / (1 - value)) : Double.NaN;
    }

    @Override
    public double inverse(double value) {
      return 1 / (1 + Math.pow(10, -value));
    }
  };

  public abstract double forward(double value);

  public abstract double inverse(double value);

  public double[] forward(double[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = forward(values[i]);
    }
    return out;
  }

  public static AxisScale fromValue(String value) {
    return Arrays.stream(values())
        .filter(scale -> scale.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported axis scale: " + value));
  }
}
