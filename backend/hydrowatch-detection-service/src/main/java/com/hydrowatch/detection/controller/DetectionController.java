package com.hydrowatch.detection.controller;

import com.hydrowatch.detection.controller.dto.AnalyzeRequest;
import com.hydrowatch.detection.controller.dto.ContaminationPatternRequest;
import com.hydrowatch.detection.controller.dto.HealthResponse;
import com.hydrowatch.detection.controller.dto.LeakHistoryRequest;
import com.hydrowatch.detection.controller.dto.LocalizeLeakRequest;
import com.hydrowatch.detection.controller.dto.MaintenanceRequest;
import com.hydrowatch.detection.controller.dto.RetrainRequest;
import com.hydrowatch.detection.controller.dto.RetrainResponse;
import com.hydrowatch.detection.exception.InvalidInputException;
import com.hydrowatch.detection.model.ContaminationPatternResult;
import com.hydrowatch.detection.model.HistoricalLeakResult;
import com.hydrowatch.detection.model.LeakLocalization;
import com.hydrowatch.detection.model.MaintenanceResult;
import com.hydrowatch.detection.model.OrchestratedResult;
import com.hydrowatch.detection.model.SensorReading;
import com.hydrowatch.detection.outlier.OutlierModel;
import com.hydrowatch.detection.service.DetectionService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class DetectionController {

  private final DetectionService detection;
  private final TelemetryRequestValidator validator;
  private final OutlierModel outlierModel;

  public DetectionController(DetectionService detection,
                             TelemetryRequestValidator validator,
                             OutlierModel outlierModel) {
    this.detection = detection;
    this.validator = validator;
    this.outlierModel = outlierModel;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("ok", "hydrowatch-detection", outlierModel.isFitted());
  }

  @PostMapping("/analyze")
  public OrchestratedResult analyze(@RequestBody AnalyzeRequest request) {
    return detection.analyze(validator.toSample(request));
  }

  @PostMapping("/detect-leak")
  public HistoricalLeakResult detectLeak(@RequestBody LeakHistoryRequest request) {
    return detection.detectLeak(
        validator.toSeries("pressure_data", request.pressureData()),
        validator.toSeries("flow_data", request.flowData()));
  }

  @PostMapping("/localize-leak")
  public ResponseEntity<LeakLocalization> localizeLeak(@RequestBody LocalizeLeakRequest request) {
    List<SensorReading> readings = request.readings() == null ? List.of() : request.readings();
    if (readings.stream().anyMatch(r -> r == null)) {
      throw new InvalidInputException("readings must not contain null entries");
    }
    return detection.localizeLeak(readings, request.topology())
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/contamination-pattern")
  public ContaminationPatternResult contaminationPattern(@RequestBody ContaminationPatternRequest request) {
    return detection.contaminationPattern(
        validator.toSeries("turbidity_data", request.turbidityData()),
        validator.toSeries("temperature_data", request.temperatureData()));
  }

  @PostMapping("/predict-maintenance")
  public MaintenanceResult predictMaintenance(@RequestBody MaintenanceRequest request) {
    return detection.predictMaintenance(validator.toHistory(request));
  }

  @PostMapping("/retrain")
  public RetrainResponse retrain(@RequestBody RetrainRequest request) {
    List<double[]> rows = validator.toRows(request.rows());
    boolean ok = detection.retrain(rows);
    return new RetrainResponse(ok, ok
        ? "outlier model retrained on " + rows.size() + " rows"
        : "retrain rejected, previous model kept");
  }
}
