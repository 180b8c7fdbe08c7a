package com.hydrowatch.detection.model;

import java.time.Instant;

/**
 * A detection worth recording, whether it came from a live sample or a history sweep.
 * {@code confidence} is a fraction in [0, 1] whatever detector produced it.
 */
public record DetectedIssue(
    String deviceId,
    String type,
    Severity severity,
    double confidence,
    String description,
    String source,
    Double gpsLat,
    Double gpsLon,
    Instant detectedAt
) {

  public static final String SOURCE_REALTIME = "realtime";
  public static final String SOURCE_HISTORY = "history";

  public static DetectedIssue fromSample(OrchestratedResult result, TelemetrySample sample, Instant now) {
    Double lat = result.gpsEstimate() != null ? Double.valueOf(result.gpsEstimate().lat()) : sample.gpsLat();
    Double lon = result.gpsEstimate() != null ? Double.valueOf(result.gpsEstimate().lon()) : sample.gpsLon();
    return new DetectedIssue(
        sample.deviceId(),
        result.type() == null ? "unknown" : result.type().code(),
        result.severity(),
        result.confidence() / 100.0,
        result.description(),
        SOURCE_REALTIME,
        lat,
        lon,
        sample.timestamp() != null ? sample.timestamp() : now);
  }
}
