package com.hydrowatch.detection.outlier;

import java.util.Random;

/**
 * Built-in readings of a network under normal operation, used to fit the outlier model on a
 * cold start. Generated from a fixed seed so every cold start yields the same model.
 */
public final class ReferenceSamples {

  static final int SIZE = 200;
  private static final long SEED = 7L;

  private ReferenceSamples() {}

  /** Rows of flow_rate (L/min), pressure (bar), turbidity (NTU), temperature (C). */
  public static double[][] normalOperation() {
    Random rng = new Random(SEED);
    double[][] rows = new double[SIZE][];
    for (int i = 0; i < SIZE; i++) {
      double pressure = 4.5 + 0.6 * rng.nextGaussian();
      double flow = pressure * 5.0 + 2.0 * rng.nextGaussian();
      double turbidity = Math.abs(1.5 + 0.6 * rng.nextGaussian());
      double temperature = 23.0 + 2.5 * rng.nextGaussian();
      rows[i] = new double[] {flow, pressure, turbidity, temperature};
    }
    return rows;
  }
}
