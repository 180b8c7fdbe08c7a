package com.hydrowatch.detection.model;

/** Spike/trend analysis over a turbidity series. */
public record ContaminationPatternResult(
    boolean detected,
    boolean spikeDetected,
    boolean increasingTrend,
    Double currentTurbidity,
    Double baselineTurbidity,
    Double trendSlope,
    double confidence,
    String message
) {

  public static final String INSUFFICIENT_DATA = "insufficient data";

  public static ContaminationPatternResult insufficientData() {
    return new ContaminationPatternResult(false, false, false, null, null, null, 0.0, INSUFFICIENT_DATA);
  }
}
