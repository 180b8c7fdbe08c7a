package com.hydrowatch.detection.engine;

import com.hydrowatch.detection.classify.AnomalyClassifier;
import com.hydrowatch.detection.contamination.ContaminationAnalyzer;
import com.hydrowatch.detection.exception.DetectionException;
import com.hydrowatch.detection.leak.LeakAnalyzer;
import com.hydrowatch.detection.maintenance.MaintenanceEstimator;
import com.hydrowatch.detection.model.AnomalyResult;
import com.hydrowatch.detection.model.ContaminationPatternResult;
import com.hydrowatch.detection.model.ContaminationResult;
import com.hydrowatch.detection.model.GpsPoint;
import com.hydrowatch.detection.model.HistoricalLeakResult;
import com.hydrowatch.detection.model.HistoricalRecord;
import com.hydrowatch.detection.model.LeakLocalization;
import com.hydrowatch.detection.model.LeakResult;
import com.hydrowatch.detection.model.MaintenanceResult;
import com.hydrowatch.detection.model.OrchestratedResult;
import com.hydrowatch.detection.model.PipelineTopology;
import com.hydrowatch.detection.model.SensorReading;
import com.hydrowatch.detection.model.TelemetrySample;
import com.hydrowatch.detection.model.WaterQualityResult;
import com.hydrowatch.detection.outlier.OutlierModel;
import com.hydrowatch.detection.quality.WaterQualityScorer;
import com.hydrowatch.detection.util.InputChecks;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point of the detection core. A sample is classified first; leak-relevant types are
 * passed to the leak analyzer, turbidity-relevant ones to the contamination analyzer, and the
 * water quality index is always computed.
 *
 * <p>Invalid numbers surface as {@link com.hydrowatch.detection.exception.InvalidInputException};
 * any other failure is wrapped in {@link DetectionException}.
 */
public class DetectionOrchestrator {

  private final OutlierModel outlierModel;
  private final AnomalyClassifier classifier;
  private final LeakAnalyzer leakAnalyzer;
  private final ContaminationAnalyzer contaminationAnalyzer;
  private final MaintenanceEstimator maintenanceEstimator;
  private final WaterQualityScorer waterQualityScorer;

  public DetectionOrchestrator(OutlierModel outlierModel,
                               AnomalyClassifier classifier,
                               LeakAnalyzer leakAnalyzer,
                               ContaminationAnalyzer contaminationAnalyzer,
                               MaintenanceEstimator maintenanceEstimator,
                               WaterQualityScorer waterQualityScorer) {
    this.outlierModel = outlierModel;
    this.classifier = classifier;
    this.leakAnalyzer = leakAnalyzer;
    this.contaminationAnalyzer = contaminationAnalyzer;
    this.maintenanceEstimator = maintenanceEstimator;
    this.waterQualityScorer = waterQualityScorer;
  }

  public OrchestratedResult evaluateSample(TelemetrySample sample) {
    if (sample == null) {
      throw new DetectionException("sample is required");
    }
    InputChecks.optionalFinite("ph", sample.ph());
    InputChecks.optionalFinite("conductivity", sample.conductivity());
    InputChecks.optionalFinite("gps_lat", sample.gpsLat());
    InputChecks.optionalFinite("gps_lon", sample.gpsLon());

    return guarded("sample evaluation", () -> {
      AnomalyResult anomaly = classifier.classify(
          sample.flowRate(), sample.pressure(), sample.turbidity(), sample.temperature());
      GpsPoint gps = sample.gps();

      LeakResult leak = null;
      ContaminationResult contamination = null;
      if (anomaly.detected() && anomaly.type() != null) {
        if (anomaly.type().isLeakRelevant()) {
          leak = leakAnalyzer.detect(sample.pressure(), sample.flowRate(), gps);
        } else if (anomaly.type().isTurbidityRelevant()) {
          contamination = contaminationAnalyzer.detect(sample.turbidity(), sample.temperature(), gps);
        }
      }

      WaterQualityResult quality = waterQualityScorer.calculate(
          sample.turbidity(), sample.ph(), sample.temperature(), sample.conductivity());

      return new OrchestratedResult(
          sample.deviceId(),
          sample.timestamp(),
          anomaly.detected(),
          anomaly.type(),
          anomaly.severity(),
          anomaly.confidence(),
          anomaly.description(),
          anomaly.recommendedAction(),
          leak == null ? null : leak.gpsEstimate(),
          leak,
          contamination,
          quality);
    });
  }

  public HistoricalLeakResult evaluateLeakHistory(double[] pressureSeries, double[] flowSeries) {
    return guarded("leak history evaluation", () -> leakAnalyzer.detectWithHistory(pressureSeries, flowSeries));
  }

  public Optional<LeakLocalization> localizeLeak(List<SensorReading> readings, PipelineTopology topology) {
    return guarded("leak localisation", () -> leakAnalyzer.localizeLeak(readings, topology));
  }

  public ContaminationPatternResult evaluateContaminationPattern(double[] turbiditySeries,
                                                                 double[] temperatureSeries) {
    return guarded("contamination pattern evaluation",
        () -> contaminationAnalyzer.detectPattern(turbiditySeries, temperatureSeries));
  }

  public MaintenanceResult evaluateMaintenance(List<HistoricalRecord> history) {
    return guarded("maintenance evaluation", () -> maintenanceEstimator.predict(history));
  }

  /** Refits the shared outlier model; false leaves the previous model in place. */
  public boolean retrainOutlierModel(List<double[]> rows) {
    return outlierModel.update(rows);
  }

  private static <T> T guarded(String operation, Supplier<T> body) {
    try {
      return body.get();
    } catch (DetectionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DetectionException(operation + " failed: " + e.getMessage(), e);
    }
  }
}
