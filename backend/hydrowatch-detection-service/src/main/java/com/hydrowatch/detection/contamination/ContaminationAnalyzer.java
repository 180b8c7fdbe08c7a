package com.hydrowatch.detection.contamination;

import com.hydrowatch.detection.model.ContaminationPatternResult;
import com.hydrowatch.detection.model.ContaminationResult;
import com.hydrowatch.detection.model.GpsEstimate;
import com.hydrowatch.detection.model.GpsPoint;
import com.hydrowatch.detection.model.Severity;
import com.hydrowatch.detection.rules.RuleCascade;
import com.hydrowatch.detection.stats.SeriesStats;
import com.hydrowatch.detection.util.InputChecks;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contamination checks on turbidity and temperature. {@link #detect} grades a single reading
 * against fixed bands; {@link #detectPattern} looks for spikes and rising trends in a series.
 * The two are separate signals and are not fused.
 */
public class ContaminationAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(ContaminationAnalyzer.class);

  public static final double TURBIDITY_SAFE = 5.0;
  public static final double TURBIDITY_WARNING = 7.0;
  public static final double TURBIDITY_CRITICAL = 10.0;
  public static final double TEMPERATURE_MIN = 15.0;
  public static final double TEMPERATURE_MAX = 35.0;

  public static final int MIN_PATTERN_POINTS = 5;
  static final int TREND_WINDOW = 10;
  static final double TREND_SLOPE_THRESHOLD = 0.1;
  static final double SPIKE_SIGMAS = 3.0;

  record Band(Severity severity, double confidence, String template) {}

  static final RuleCascade<Double, Band> TURBIDITY_BANDS = RuleCascade.<Double, Band>builder()
      .when("critical turbidity", t -> t >= TURBIDITY_CRITICAL, new Band(Severity.CRITICAL, 0.95,
          "Critical contamination detected: turbidity %.2f NTU exceeds safe limit (5 NTU)"))
      .when("high turbidity", t -> t >= TURBIDITY_WARNING, new Band(Severity.HIGH, 0.8,
          "High contamination risk: turbidity %.2f NTU above warning threshold (7 NTU; safe limit 5 NTU)"))
      .when("elevated turbidity", t -> t >= TURBIDITY_SAFE, new Band(Severity.MEDIUM, 0.6,
          "Moderate contamination: turbidity %.2f NTU above safe limit (5 NTU)"))
      .build();

  private static final Map<Severity, String> ACTIONS = new EnumMap<>(Severity.class);

  static {
    ACTIONS.put(Severity.CRITICAL,
        "IMMEDIATE: Stop water supply. Notify health authorities. Conduct emergency water quality test.");
    ACTIONS.put(Severity.HIGH,
        "URGENT: Issue public advisory. Increase monitoring frequency. Investigate contamination source.");
    ACTIONS.put(Severity.MEDIUM, "Monitor closely. Increase sampling frequency. Check upstream sources.");
    ACTIONS.put(Severity.LOW, "Continue monitoring. Review sensor calibration.");
  }

  public ContaminationResult detect(double turbidity, double temperature, GpsPoint gps) {
    InputChecks.finite("turbidity", turbidity);
    InputChecks.finite("temperature", temperature);

    boolean detected = false;
    Severity severity = Severity.LOW;
    double confidence = 0.0;
    String description = "Turbidity and temperature within safe limits";

    Optional<Band> band = TURBIDITY_BANDS.match(turbidity);
    if (band.isPresent()) {
      detected = true;
      severity = band.get().severity();
      confidence = band.get().confidence();
      description = format(band.get().template(), turbidity);
    }

    if (temperature < TEMPERATURE_MIN || temperature > TEMPERATURE_MAX) {
      if (detected) {
        confidence = Math.min(confidence + 0.1, 1.0);
        description += format(". Temperature anomaly: %.2f C", temperature);
      } else {
        detected = true;
        severity = Severity.LOW;
        confidence = 0.5;
        description = format("Temperature anomaly detected: %.2f C (expected: 15-35 C)", temperature);
      }
    }

    GpsEstimate estimate = detected && gps != null ? GpsEstimate.atSensor(gps, confidence) : null;
    return new ContaminationResult(detected, severity, confidence, description, turbidity, temperature,
        estimate, ACTIONS.get(severity));
  }

  /**
   * Spike: the latest reading exceeds the mean of the earlier readings by more than three of
   * their standard deviations. Trend (ten or more points): least-squares slope of the last ten
   * readings above 0.1 NTU per reading. A trend only counts once the latest reading is above the
   * safe limit. The temperature series is accepted but not analysed.
   */
  public ContaminationPatternResult detectPattern(double[] turbiditySeries, double[] temperatureSeries) {
    if (turbiditySeries == null || turbiditySeries.length < MIN_PATTERN_POINTS) {
      return ContaminationPatternResult.insufficientData();
    }
    InputChecks.finiteSeries("turbidity_data", turbiditySeries);

    double[] baseline = SeriesStats.allButLast(turbiditySeries);
    double baselineMean = SeriesStats.mean(baseline);
    double baselineStd = SeriesStats.populationStd(baseline);
    double current = turbiditySeries[turbiditySeries.length - 1];

    boolean spike = current > baselineMean + SPIKE_SIGMAS * baselineStd;

    Double slope = null;
    boolean increasingTrend = false;
    if (turbiditySeries.length >= TREND_WINDOW) {
      slope = SeriesStats.slopeAgainstIndex(SeriesStats.tail(turbiditySeries, TREND_WINDOW));
      increasingTrend = slope > TREND_SLOPE_THRESHOLD;
    }

    boolean detected = spike || (increasingTrend && current > TURBIDITY_SAFE);
    log.debug("Turbidity pattern: n={} current={} baseline={} spike={} slope={}",
        turbiditySeries.length, current, baselineMean, spike, slope);
    return new ContaminationPatternResult(detected, spike, increasingTrend, current, baselineMean, slope,
        spike ? 0.7 : 0.5, null);
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
