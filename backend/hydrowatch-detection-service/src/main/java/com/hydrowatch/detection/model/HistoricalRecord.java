package com.hydrowatch.detection.model;

/** One point of a device's operating history used for maintenance estimation. */
public record HistoricalRecord(
    double flowRate,
    double pressure,
    double turbidity,
    double temperature,
    String pumpStatus
) {

  public boolean pumpOn() {
    return pumpStatus != null && pumpStatus.equalsIgnoreCase("on");
  }
}
