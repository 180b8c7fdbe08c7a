package com.hydrowatch.detection.classify;

import static com.hydrowatch.detection.classify.NormalRanges.*;

import com.hydrowatch.detection.model.AnomalyType;
import com.hydrowatch.detection.model.SensorReadings;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Description and recommended-action text per anomaly type. Every description quotes the
 * offending reading and the range it was expected in.
 */
public final class AnomalyTemplates {

  public static final String NORMAL_DESCRIPTION = "all parameters within normal range";
  public static final String NORMAL_ACTION = "continue monitoring";
  static final String FALLBACK_DESCRIPTION = "Anomaly detected";
  static final String FALLBACK_ACTION = "Investigate anomaly";

  private static final Map<AnomalyType, Function<SensorReadings, String>> DESCRIPTIONS =
      new EnumMap<>(AnomalyType.class);
  private static final Map<AnomalyType, String> ACTIONS = new EnumMap<>(AnomalyType.class);

  static {
    DESCRIPTIONS.put(AnomalyType.PRESSURE_ANOMALY, r -> format(
        "Pressure anomaly detected: %.2f bar (expected: %.0f-%.0f bar)", r.pressure(), PRESSURE_MIN, PRESSURE_MAX));
    DESCRIPTIONS.put(AnomalyType.LOW_FLOW, r -> format(
        "Low flow rate detected: %.2f L/min (expected: %.0f-%.0f L/min)", r.flowRate(), FLOW_MIN, FLOW_MAX));
    DESCRIPTIONS.put(AnomalyType.CONTAMINATION, r -> format(
        "Water quality issue: turbidity %.2f NTU (expected: <%.0f NTU)", r.turbidity(), TURBIDITY_MAX));
    DESCRIPTIONS.put(AnomalyType.LEAK, r -> format(
        "Possible leak detected: flow-pressure mismatch (flow %.2f L/min at %.2f bar, expected: %.2f +/- %.0f L/min)",
        r.flowRate(), r.pressure(), r.pressure() * FLOW_PER_BAR, FLOW_MISMATCH_TOLERANCE));
    DESCRIPTIONS.put(AnomalyType.GENERAL_ANOMALY, r -> format(
        "Anomaly detected in sensor readings: flow %.2f L/min (expected: %.0f-%.0f), pressure %.2f bar "
            + "(expected: %.0f-%.0f), turbidity %.2f NTU (expected: <%.0f), temperature %.2f C (expected: %.0f-%.0f)",
        r.flowRate(), FLOW_MIN, FLOW_MAX, r.pressure(), PRESSURE_MIN, PRESSURE_MAX,
        r.turbidity(), TURBIDITY_MAX, r.temperature(), TEMPERATURE_MIN, TEMPERATURE_MAX));

    ACTIONS.put(AnomalyType.PRESSURE_ANOMALY, "Check pump operation and pipeline integrity");
    ACTIONS.put(AnomalyType.LOW_FLOW, "Inspect for blockages or valve issues");
    ACTIONS.put(AnomalyType.CONTAMINATION, "Immediate water quality test required. Notify health authorities.");
    ACTIONS.put(AnomalyType.LEAK, "Dispatch field team to investigate leak. Use GPS coordinates for location.");
    ACTIONS.put(AnomalyType.GENERAL_ANOMALY, "Review sensor readings and perform diagnostic check");
  }

  private AnomalyTemplates() {}

  public static String describe(AnomalyType type, SensorReadings readings) {
    Function<SensorReadings, String> template = type == null ? null : DESCRIPTIONS.get(type);
    return template == null ? FALLBACK_DESCRIPTION : template.apply(readings);
  }

  public static String recommend(AnomalyType type) {
    String action = type == null ? null : ACTIONS.get(type);
    return action == null ? FALLBACK_ACTION : action;
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
