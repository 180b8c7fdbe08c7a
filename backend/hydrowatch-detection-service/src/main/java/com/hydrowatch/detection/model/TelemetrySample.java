package com.hydrowatch.detection.model;

import java.time.Instant;

/**
 * One telemetry reading from a network sensor. Optional channels are null when the
 * device does not report them.
 */
public record TelemetrySample(
    String deviceId,
    double flowRate,
    double pressure,
    double turbidity,
    double temperature,
    Double ph,
    Double conductivity,
    Double gpsLat,
    Double gpsLon,
    Instant timestamp
) {

  public SensorReadings readings() {
    return new SensorReadings(flowRate, pressure, turbidity, temperature);
  }

  public GpsPoint gps() {
    return GpsPoint.ofNullable(gpsLat, gpsLon);
  }
}
