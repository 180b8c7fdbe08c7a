package com.hydrowatch.detection.classify;

import static com.hydrowatch.detection.classify.NormalRanges.*;

import com.hydrowatch.detection.model.AnomalyResult;
import com.hydrowatch.detection.model.AnomalyType;
import com.hydrowatch.detection.model.SensorReadings;
import com.hydrowatch.detection.model.Severity;
import com.hydrowatch.detection.outlier.OutlierModel;
import com.hydrowatch.detection.outlier.OutlierVerdict;
import com.hydrowatch.detection.rules.RuleCascade;
import com.hydrowatch.detection.util.InputChecks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the outlier model's verdict into a typed, graded anomaly. Type assignment is an ordered
 * cascade; the first rule that matches decides, so pressure problems win over flow, flow over
 * turbidity, and turbidity over the flow/pressure mismatch.
 */
public class AnomalyClassifier {

  private static final Logger log = LoggerFactory.getLogger(AnomalyClassifier.class);

  static final RuleCascade<SensorReadings, Severity> PRESSURE_SEVERITY =
      RuleCascade.<SensorReadings, Severity>builder()
          .when("pressure below 1 bar", r -> r.pressure() < 1.0, Severity.CRITICAL)
          .when("pressure below 1.5 bar", r -> r.pressure() < 1.5, Severity.HIGH)
          .otherwise(Severity.MEDIUM)
          .build();

  static final RuleCascade<SensorReadings, Severity> FLOW_SEVERITY =
      RuleCascade.<SensorReadings, Severity>builder()
          .when("flow below 1 L/min", r -> r.flowRate() < 1.0, Severity.HIGH)
          .otherwise(Severity.MEDIUM)
          .build();

  static final RuleCascade<SensorReadings, Severity> TURBIDITY_SEVERITY =
      RuleCascade.<SensorReadings, Severity>builder()
          .when("turbidity above 10 NTU", r -> r.turbidity() > 10.0, Severity.CRITICAL)
          .when("turbidity above 7 NTU", r -> r.turbidity() > 7.0, Severity.HIGH)
          .otherwise(Severity.MEDIUM)
          .build();

  static final RuleCascade<SensorReadings, Classification> TYPE_RULES =
      RuleCascade.<SensorReadings, Classification>builder()
          .when("pressure outside operating range",
              r -> r.pressure() < PRESSURE_MIN || r.pressure() > PRESSURE_MAX,
              r -> new Classification(AnomalyType.PRESSURE_ANOMALY, PRESSURE_SEVERITY.evaluate(r)))
          .when("flow below half the minimum",
              r -> r.flowRate() < FLOW_MIN * 0.5,
              r -> new Classification(AnomalyType.LOW_FLOW, FLOW_SEVERITY.evaluate(r)))
          .when("turbidity above safe limit",
              r -> r.turbidity() > TURBIDITY_MAX,
              r -> new Classification(AnomalyType.CONTAMINATION, TURBIDITY_SEVERITY.evaluate(r)))
          .when("flow does not follow pressure",
              r -> Math.abs(r.flowRate() - r.pressure() * FLOW_PER_BAR) > FLOW_MISMATCH_TOLERANCE,
              new Classification(AnomalyType.LEAK, Severity.HIGH))
          .otherwise(new Classification(AnomalyType.GENERAL_ANOMALY, Severity.MEDIUM))
          .build();

  private final OutlierModel outlierModel;

  public AnomalyClassifier(OutlierModel outlierModel) {
    this.outlierModel = outlierModel;
  }

  public AnomalyResult classify(double flowRate, double pressure, double turbidity, double temperature) {
    SensorReadings readings = new SensorReadings(
        InputChecks.finite("flow_rate", flowRate),
        InputChecks.finite("pressure", pressure),
        InputChecks.finite("turbidity", turbidity),
        InputChecks.finite("temperature", temperature));
    return classify(readings);
  }

  public AnomalyResult classify(SensorReadings readings) {
    OutlierVerdict verdict = outlierModel.score(readings);
    double confidence = Math.min(100.0, Math.abs(verdict.anomalyScore()) * 100.0);

    if (!verdict.outlier()) {
      return new AnomalyResult(false, null, Severity.LOW, confidence, verdict.anomalyScore(),
          AnomalyTemplates.NORMAL_DESCRIPTION, AnomalyTemplates.NORMAL_ACTION);
    }

    Classification c = TYPE_RULES.evaluate(readings);
    log.debug("Outlier classified as {} ({}), score={}", c.type(), c.severity(), verdict.anomalyScore());
    return new AnomalyResult(true, c.type(), c.severity(), confidence, verdict.anomalyScore(),
        AnomalyTemplates.describe(c.type(), readings), AnomalyTemplates.recommend(c.type()));
  }
}
