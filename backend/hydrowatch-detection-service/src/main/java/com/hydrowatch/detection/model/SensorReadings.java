package com.hydrowatch.detection.model;

/**
 * The four readings the outlier model is trained on, in feature order.
 */
public record SensorReadings(double flowRate, double pressure, double turbidity, double temperature) {

  public static final int FEATURE_COUNT = 4;

  public double[] toFeatures() {
    return new double[] {flowRate, pressure, turbidity, temperature};
  }
}
