package com.hydrowatch.detection.maintenance;

import java.util.Random;

/**
 * Synthetic feature/target pairs used to fit the maintenance forest on a cold start. Wear is
 * driven by flow and pressure instability, sediment load, heavy pump duty and low pressure.
 */
final class MaintenanceReferenceData {

  static final int SIZE = 400;
  private static final long SEED = 11L;
  static final double MAX_DAYS = 30.0;

  final double[][] features;
  final double[] days;

  private MaintenanceReferenceData(double[][] features, double[] days) {
    this.features = features;
    this.days = days;
  }

  static MaintenanceReferenceData generate() {
    Random rng = new Random(SEED);
    double[][] x = new double[SIZE][];
    double[] y = new double[SIZE];
    for (int i = 0; i < SIZE; i++) {
      double meanFlow = 5 + 35 * rng.nextDouble();
      double flowStd = 8 * rng.nextDouble();
      double meanPressure = 1.5 + 5.5 * rng.nextDouble();
      double pressureStd = 1.5 * rng.nextDouble();
      double meanTurbidity = 10 * rng.nextDouble();
      double pumpRatio = rng.nextDouble();
      x[i] = new double[] {meanFlow, flowStd, meanPressure, pressureStd, meanTurbidity, pumpRatio};

      double wear = 1.2 * flowStd
          + 8.0 * pressureStd
          + 1.5 * meanTurbidity
          + 10.0 * pumpRatio * pumpRatio
          + 2.0 * Math.max(0.0, 3.0 - meanPressure);
      double days = MAX_DAYS - wear + rng.nextGaussian();
      y[i] = Math.max(0.0, Math.min(MAX_DAYS, days));
    }
    return new MaintenanceReferenceData(x, y);
  }
}
