package com.hydrowatch.detection.outlier;

import java.util.Arrays;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Per-feature standardisation. Features with zero spread keep a scale of 1 so they pass through
 * centred but unscaled.
 */
public final class StandardScaler {

  private final double[] mean;
  private final double[] scale;

  public StandardScaler(double[] mean, double[] scale) {
    if (mean.length != scale.length) {
      throw new IllegalArgumentException("mean and scale widths differ");
    }
    this.mean = mean.clone();
    this.scale = scale.clone();
  }

  public static StandardScaler fit(double[][] rows) {
    int width = rows[0].length;
    double[] mean = new double[width];
    double[] scale = new double[width];
    double[] column = new double[rows.length];
    for (int j = 0; j < width; j++) {
      for (int i = 0; i < rows.length; i++) column[i] = rows[i][j];
      mean[j] = StatUtils.mean(column);
      double std = Math.sqrt(StatUtils.populationVariance(column, mean[j]));
      scale[j] = std > 0 ? std : 1.0;
    }
    return new StandardScaler(mean, scale);
  }

  public double[] transform(double[] row) {
    if (row.length != mean.length) {
      throw new IllegalArgumentException("expected " + mean.length + " features, got " + row.length);
    }
    double[] out = new double[row.length];
    for (int j = 0; j < row.length; j++) {
      out[j] = (row[j] - mean[j]) / scale[j];
    }
    return out;
  }

  public double[][] transform(double[][] rows) {
    double[][] out = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) out[i] = transform(rows[i]);
    return out;
  }

  public double[] mean() {
    return mean.clone();
  }

  public double[] scale() {
    return scale.clone();
  }

  @Override
  public String toString() {
    return "StandardScaler{mean=" + Arrays.toString(mean) + ", scale=" + Arrays.toString(scale) + "}";
  }
}
