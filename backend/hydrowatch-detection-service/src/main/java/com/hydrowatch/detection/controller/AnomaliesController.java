package com.hydrowatch.detection.controller;

import com.hydrowatch.detection.controller.dto.AnomaliesResponse;
import com.hydrowatch.detection.exception.InvalidInputException;
import com.hydrowatch.detection.service.AnomalyQueryService;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnomaliesController {
  private final AnomalyQueryService anomalies;

  public AnomaliesController(AnomalyQueryService anomalies) {
    this.anomalies = anomalies;
  }

  @GetMapping("/api/anomalies")
  public AnomaliesResponse getAnomalies(
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "limit", defaultValue = "20") int limit,
      @RequestParam(name = "device_id", required = false) String deviceId,
      @RequestParam(name = "type", required = false) String type,
      @RequestParam(name = "since", required = false) String sinceStr
  ) {
    Instant since = null;
    if (sinceStr != null && !sinceStr.isBlank()) {
      try {
        since = Instant.parse(sinceStr);
      } catch (DateTimeParseException e) {
        throw new InvalidInputException("since must be ISO-8601, got '" + sinceStr + "'");
      }
    }
    return anomalies.latest(page, limit, deviceId, type, since);
  }
}
