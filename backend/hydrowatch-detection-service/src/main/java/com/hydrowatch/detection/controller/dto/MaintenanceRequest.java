package com.hydrowatch.detection.controller.dto;

import java.util.List;

public record MaintenanceRequest(String deviceId, List<HistoricalPoint> historicalData) {

  /** Missing readings count as zero. */
  public record HistoricalPoint(
      String timestamp,
      Double flowRate,
      Double pressure,
      Double turbidity,
      Double temperature,
      String pumpStatus
  ) {}
}
