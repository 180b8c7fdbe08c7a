package com.hydrowatch.detection.model;

import java.util.List;

public record MaintenanceResult(
    boolean maintenanceNeeded,
    Double daysUntilMaintenance,
    Severity urgency,
    double confidence,
    List<String> recommendedActions,
    String message
) {

  public static final String INSUFFICIENT_DATA = "insufficient data";

  public static MaintenanceResult insufficientData() {
    return new MaintenanceResult(false, null, null, 0.0, List.of(), INSUFFICIENT_DATA);
  }
}
