package com.hydrowatch.detection.controller.dto;

import com.hydrowatch.detection.model.AnomalyEvent;
import java.time.Instant;

public record AnomalyEventView(
    String id,
    String deviceId,
    String anomalyType,
    String severity,
    double confidence,
    String description,
    String source,
    Double gpsLat,
    Double gpsLon,
    Instant detectedAt
) {

  public static AnomalyEventView from(AnomalyEvent row) {
    return new AnomalyEventView(
        String.valueOf(row.getId()),
        row.getDeviceId(),
        row.getAnomalyType(),
        row.getSeverity(),
        row.getConfidence(),
        row.getDescription(),
        row.getSource(),
        row.getGpsLat(),
        row.getGpsLon(),
        row.getDetectedAt());
  }
}
