package com.hydrowatch.detection.service;

import com.hydrowatch.detection.engine.DetectionOrchestrator;
import com.hydrowatch.detection.model.ContaminationPatternResult;
import com.hydrowatch.detection.model.DetectedIssue;
import com.hydrowatch.detection.model.HistoricalLeakResult;
import com.hydrowatch.detection.model.HistoricalRecord;
import com.hydrowatch.detection.model.LeakLocalization;
import com.hydrowatch.detection.model.MaintenanceResult;
import com.hydrowatch.detection.model.OrchestratedResult;
import com.hydrowatch.detection.model.PipelineTopology;
import com.hydrowatch.detection.model.SensorReading;
import com.hydrowatch.detection.model.TelemetrySample;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application facade over the detection core. Live samples are also written to the device
 * history and, when something is detected, published as anomaly events.
 */
@Service
public class DetectionService {

  private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

  private final DetectionOrchestrator orchestrator;
  private final TelemetryHistoryService history;
  private final AnomalyEventPublisher publisher;
  private final MeterRegistry metrics;
  private final Counter samplesEvaluated;
  private final Counter retrainsFailed;
  private final Timer evaluationDuration;

  public DetectionService(DetectionOrchestrator orchestrator,
                          TelemetryHistoryService history,
                          AnomalyEventPublisher publisher,
                          MeterRegistry metrics) {
    this.orchestrator = orchestrator;
    this.history = history;
    this.publisher = publisher;
    this.metrics = metrics;
    this.samplesEvaluated = metrics.counter("hydrowatch_samples_evaluated_total");
    this.retrainsFailed = metrics.counter("hydrowatch_model_retrains_total", "outcome", "failure");
    this.evaluationDuration = metrics.timer("hydrowatch_sample_evaluation_duration_seconds");
  }

  public OrchestratedResult analyze(TelemetrySample sample) {
    OrchestratedResult result = evaluationDuration.record(() -> orchestrator.evaluateSample(sample));
    samplesEvaluated.increment();
    history.record(sample);

    if (result.detected()) {
      String type = result.type() == null ? "unknown" : result.type().code();
      metrics.counter("hydrowatch_anomalies_detected_total", "type", type).increment();
      log.info("Anomaly detected: device='{}' type={} severity={} confidence={}",
          sample.deviceId(), type, result.severity().code(), result.confidence());
      try {
        publisher.publish(DetectedIssue.fromSample(result, sample, Instant.now()));
      } catch (RuntimeException e) {
        log.warn("Anomaly publish failed for device '{}': {}", sample.deviceId(), e.getMessage());
      }
    }
    return result;
  }

  public HistoricalLeakResult detectLeak(double[] pressure, double[] flow) {
    return orchestrator.evaluateLeakHistory(pressure, flow);
  }

  public Optional<LeakLocalization> localizeLeak(List<SensorReading> readings, PipelineTopology topology) {
    return orchestrator.localizeLeak(readings, topology);
  }

  public ContaminationPatternResult contaminationPattern(double[] turbidity, double[] temperature) {
    return orchestrator.evaluateContaminationPattern(turbidity, temperature);
  }

  public MaintenanceResult predictMaintenance(List<HistoricalRecord> records) {
    return orchestrator.evaluateMaintenance(records);
  }

  public boolean retrain(List<double[]> rows) {
    boolean ok = orchestrator.retrainOutlierModel(rows);
    if (ok) {
      metrics.counter("hydrowatch_model_retrains_total", "outcome", "success").increment();
    } else {
      retrainsFailed.increment();
    }
    return ok;
  }
}
