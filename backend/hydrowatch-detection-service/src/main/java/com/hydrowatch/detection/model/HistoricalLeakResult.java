package com.hydrowatch.detection.model;

/**
 * Leak verdict fused from pressure and flow series. Signal fields are null when the series
 * were too short to analyse.
 */
public record HistoricalLeakResult(
    boolean detected,
    double confidence,
    String message,
    LeakLocationEstimate leakLocationEstimate,
    Double pressureDrop,
    Double correlation,
    PressureStats pressureStats
) {

  public static final String INSUFFICIENT_DATA = "insufficient data";

  public record LeakLocationEstimate(int index, double pressureDrop, String method) {}

  public record PressureStats(double mean, double std, double recent) {}

  public static HistoricalLeakResult insufficientData() {
    return new HistoricalLeakResult(false, 0.0, INSUFFICIENT_DATA, null, null, null, null);
  }
}
