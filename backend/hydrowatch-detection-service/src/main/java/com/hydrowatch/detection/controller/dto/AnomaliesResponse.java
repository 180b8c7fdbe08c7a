package com.hydrowatch.detection.controller.dto;

import java.util.List;

public record AnomaliesResponse(List<AnomalyEventView> anomalies, Meta meta) {
  public record Meta(long anomaliesToday, int page, int limit) {}
}
