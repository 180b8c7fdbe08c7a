package com.hydrowatch.detection.stats;

import java.util.Arrays;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Descriptive statistics over chronological series. Standard deviations are population
 * deviations (divide by n).
 */
public final class SeriesStats {

  private SeriesStats() {}

  public static double mean(double[] values) {
    if (values.length == 0) return 0.0;
    return StatUtils.mean(values);
  }

  public static double populationStd(double[] values) {
    if (values.length == 0) return 0.0;
    return Math.sqrt(StatUtils.populationVariance(values));
  }

  /**
   * Pointwise gradient: one-sided differences at the ends, central differences inside.
   */
  public static double[] gradient(double[] values) {
    int n = values.length;
    if (n < 2) return new double[n];
    double[] out = new double[n];
    out[0] = values[1] - values[0];
    out[n - 1] = values[n - 1] - values[n - 2];
    for (int i = 1; i < n - 1; i++) {
      out[i] = (values[i + 1] - values[i - 1]) / 2.0;
    }
    return out;
  }

  /** Index of the first minimum. */
  public static int argMin(double[] values) {
    int idx = 0;
    for (int i = 1; i < values.length; i++) {
      if (values[i] < values[idx]) idx = i;
    }
    return idx;
  }

  /**
   * Pearson correlation, or NaN when either series is constant and the coefficient is
   * undefined.
   */
  public static double pearson(double[] x, double[] y) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("series lengths differ: " + x.length + " vs " + y.length);
    }
    if (x.length < 2 || isConstant(x) || isConstant(y)) return Double.NaN;
    return new PearsonsCorrelation().correlation(x, y);
  }

  /** Least-squares slope of the values against their index 0..n-1. */
  public static double slopeAgainstIndex(double[] values) {
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < values.length; i++) {
      regression.addData(i, values[i]);
    }
    return regression.getSlope();
  }

  public static boolean isConstant(double[] values) {
    for (int i = 1; i < values.length; i++) {
      if (values[i] != values[0]) return false;
    }
    return true;
  }

  public static double[] tail(double[] values, int count) {
    int from = Math.max(0, values.length - count);
    return Arrays.copyOfRange(values, from, values.length);
  }

  public static double[] allButLast(double[] values) {
    return Arrays.copyOf(values, Math.max(0, values.length - 1));
  }
}
