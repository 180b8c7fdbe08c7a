package com.hydrowatch.detection.maintenance;

import com.hydrowatch.detection.model.HistoricalRecord;
import com.hydrowatch.detection.model.MaintenanceResult;
import com.hydrowatch.detection.model.Severity;
import com.hydrowatch.detection.persistence.ModelStore;
import com.hydrowatch.detection.rules.RuleCascade;
import com.hydrowatch.detection.util.InputChecks;
import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates days until a device needs maintenance from its operating history.
 *
 * <p>Confidence is {@code min(n / 100, 1)} for {@code n} records: it reflects how much history
 * was supplied, not how good the prediction is.
 */
public class MaintenanceEstimator {

  private static final Logger log = LoggerFactory.getLogger(MaintenanceEstimator.class);

  public static final int MIN_RECORDS = 30;
  public static final double MAINTENANCE_HORIZON_DAYS = 7.0;

  private static final RuleCascade<Double, Severity> URGENCY = RuleCascade.<Double, Severity>builder()
      .when("under one day", days -> days < 1.0, Severity.CRITICAL)
      .when("under three days", days -> days < 3.0, Severity.HIGH)
      .when("under one week", days -> days < MAINTENANCE_HORIZON_DAYS, Severity.MEDIUM)
      .otherwise(Severity.LOW)
      .build();

  private static final Map<Severity, List<String>> ACTIONS = new EnumMap<>(Severity.class);

  static {
    ACTIONS.put(Severity.CRITICAL, List.of(
        "Schedule immediate maintenance",
        "Check pump motor and bearings",
        "Inspect pipeline for leaks",
        "Review sensor calibrations"));
    ACTIONS.put(Severity.HIGH, List.of(
        "Schedule maintenance within 3 days",
        "Monitor pump performance closely",
        "Check for unusual vibrations or sounds",
        "Review recent sensor readings"));
    ACTIONS.put(Severity.MEDIUM, List.of(
        "Schedule maintenance within 1 week",
        "Continue regular monitoring",
        "Prepare maintenance checklist"));
    ACTIONS.put(Severity.LOW, List.of(
        "Continue regular monitoring",
        "Schedule routine maintenance as per schedule"));
  }

  private final RegressionForest forest;

  public MaintenanceEstimator(RegressionForest forest) {
    if (forest.featureCount() != MaintenanceFeatures.COUNT) {
      throw new IllegalArgumentException("maintenance forest expects " + forest.featureCount()
          + " features, estimator produces " + MaintenanceFeatures.COUNT);
    }
    this.forest = forest;
  }

  /** Restores the persisted forest or fits and persists one on the synthetic reference data. */
  public static MaintenanceEstimator loadOrBootstrap(RegressionForest.Settings settings, ModelStore store) {
    Optional<RegressionForest.Snapshot> persisted = store.loadMaintenanceModel();
    if (persisted.isPresent()) {
      String problem = problemWith(persisted.get());
      if (problem == null) {
        log.info("Maintenance model restored from store ({} trees)", persisted.get().trees().size());
        return new MaintenanceEstimator(RegressionForest.fromSnapshot(persisted.get()));
      }
      log.warn("Ignoring persisted maintenance model: {}", problem);
    }
    MaintenanceReferenceData data = MaintenanceReferenceData.generate();
    RegressionForest forest = RegressionForest.fit(data.features, data.days, settings);
    log.info("Maintenance model bootstrapped on {} synthetic samples", MaintenanceReferenceData.SIZE);
    try {
      store.saveMaintenanceModel(forest.snapshot());
    } catch (IOException e) {
      log.warn("Failed to persist maintenance model: {}", e.getMessage());
    }
    return new MaintenanceEstimator(forest);
  }

  static String problemWith(RegressionForest.Snapshot snapshot) {
    if (snapshot.featureCount() != MaintenanceFeatures.COUNT) {
      return "expected " + MaintenanceFeatures.COUNT + " features, found " + snapshot.featureCount();
    }
    if (snapshot.trees() == null || snapshot.trees().isEmpty()) return "forest has no trees";
    for (RegressionNode tree : snapshot.trees()) {
      if (tree == null || !tree.wellFormed(MaintenanceFeatures.COUNT)) return "forest contains a malformed tree";
    }
    return null;
  }

  public MaintenanceResult predict(List<HistoricalRecord> history) {
    if (history == null || history.size() < MIN_RECORDS) {
      return MaintenanceResult.insufficientData();
    }
    double[] features = MaintenanceFeatures.extract(history);
    for (int i = 0; i < features.length; i++) {
      InputChecks.finite(MaintenanceFeatures.NAMES.get(i), features[i]);
    }

    double days = Math.max(0.0, forest.predict(features));
    Severity urgency = URGENCY.evaluate(days);
    double confidence = confidenceFor(history.size());
    log.debug("Maintenance estimate: records={} days={} urgency={}", history.size(), days, urgency);

    return new MaintenanceResult(
        days < MAINTENANCE_HORIZON_DAYS,
        days,
        urgency,
        confidence,
        ACTIONS.getOrDefault(urgency, List.of()),
        null);
  }

  public static double confidenceFor(int recordCount) {
    return Math.min(recordCount / 100.0, 1.0);
  }

  static List<String> actionsFor(Severity urgency) {
    return ACTIONS.getOrDefault(urgency, List.of());
  }
}
