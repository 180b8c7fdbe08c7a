package com.hydrowatch.detection.leak;

import com.hydrowatch.detection.exception.InvalidInputException;
import com.hydrowatch.detection.model.GpsEstimate;
import com.hydrowatch.detection.model.GpsPoint;
import com.hydrowatch.detection.model.HistoricalLeakResult;
import com.hydrowatch.detection.model.HistoricalLeakResult.LeakLocationEstimate;
import com.hydrowatch.detection.model.HistoricalLeakResult.PressureStats;
import com.hydrowatch.detection.model.LeakLocalization;
import com.hydrowatch.detection.model.LeakResult;
import com.hydrowatch.detection.model.PipelineTopology;
import com.hydrowatch.detection.model.SensorReading;
import com.hydrowatch.detection.rules.RuleCascade;
import com.hydrowatch.detection.stats.SeriesStats;
import com.hydrowatch.detection.util.InputChecks;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless leak detection: rules on a single reading, signal fusion over a pressure/flow
 * history, and minimum-pressure localisation across sensors.
 */
public class LeakAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(LeakAnalyzer.class);

  public static final int MIN_HISTORY = 10;
  static final int RECENT_WINDOW = 5;

  static final double GRADIENT_THRESHOLD = -0.3;
  static final double CORRELATION_THRESHOLD = -0.5;
  static final double GRADIENT_WEIGHT = 0.4;
  static final double CORRELATION_WEIGHT = 0.3;
  static final double RECENT_DROP_WEIGHT = 0.3;

  static final double LOCALIZATION_CONFIDENCE = 0.7;
  static final String GRADIENT_METHOD = "pressure_gradient_analysis";
  static final String MINIMUM_PRESSURE_METHOD = "pressure_minimum";

  private record Reading(double pressure, double flowRate) {}

  static final RuleCascade<Reading, Double> INSTANT_RULES = RuleCascade.<Reading, Double>builder()
      .when("pressure below 1.5 bar", r -> r.pressure() < 1.5, 0.9)
      .when("pressure below 2 bar with flow", r -> r.pressure() < 2.0 && r.flowRate() > 0, 0.7)
      .when("high flow at low pressure", r -> r.flowRate() > 50 && r.pressure() < 3.0, 0.8)
      .build();

  public LeakResult detect(double pressure, double flowRate, GpsPoint gps) {
    InputChecks.finite("pressure", pressure);
    InputChecks.finite("flow_rate", flowRate);

    Optional<Double> confidence = INSTANT_RULES.match(new Reading(pressure, flowRate));
    if (confidence.isEmpty()) {
      return new LeakResult(false, 0.0, null, pressure, flowRate);
    }
    GpsEstimate estimate = gps == null ? null : GpsEstimate.atSensor(gps, confidence.get());
    return new LeakResult(true, confidence.get(), estimate, pressure, flowRate);
  }

  /**
   * Fuses three signals over chronological series (last element most recent): steepest
   * pressure gradient, pressure/flow correlation, and the recent pressure mean against the whole
   * series. Each signal that fires adds its weight to the confidence, capped at 1.
   */
  public HistoricalLeakResult detectWithHistory(double[] pressureSeries, double[] flowSeries) {
    if (pressureSeries == null || flowSeries == null
        || pressureSeries.length < MIN_HISTORY || flowSeries.length < MIN_HISTORY) {
      return HistoricalLeakResult.insufficientData();
    }
    InputChecks.finiteSeries("pressure_data", pressureSeries);
    InputChecks.finiteSeries("flow_data", flowSeries);
    if (pressureSeries.length != flowSeries.length) {
      throw new InvalidInputException("pressure_data and flow_data must have the same length");
    }

    double[] gradient = SeriesStats.gradient(pressureSeries);
    int steepestIdx = SeriesStats.argMin(gradient);
    double pressureDrop = gradient[steepestIdx];

    double correlation = SeriesStats.pearson(pressureSeries, flowSeries);

    double mean = SeriesStats.mean(pressureSeries);
    double std = SeriesStats.populationStd(pressureSeries);
    double recent = SeriesStats.mean(SeriesStats.tail(pressureSeries, RECENT_WINDOW));

    boolean detected = false;
    double confidence = 0.0;
    if (pressureDrop < GRADIENT_THRESHOLD) {
      detected = true;
      confidence += GRADIENT_WEIGHT;
    }
    if (flowDecoupled(correlation, pressureSeries, flowSeries)) {
      detected = true;
      confidence += CORRELATION_WEIGHT;
    }
    if (recent < mean - 2 * std) {
      detected = true;
      confidence += RECENT_DROP_WEIGHT;
    }
    confidence = Math.min(confidence, 1.0);

    LeakLocationEstimate location = detected
        ? new LeakLocationEstimate(steepestIdx, pressureDrop, GRADIENT_METHOD)
        : null;
    log.debug("Leak history: n={} drop={} corr={} recent={} mean={} std={} -> {}",
        pressureSeries.length, pressureDrop, correlation, recent, mean, std, confidence);

    return new HistoricalLeakResult(
        detected,
        confidence,
        detected ? "leak suspected" : "no leak pattern",
        location,
        pressureDrop,
        Double.isNaN(correlation) ? null : correlation,
        new PressureStats(mean, std, recent));
  }

  /**
   * Flow not tracking pressure: a strong negative correlation, or flow held perfectly steady
   * while pressure fell (correlation undefined).
   */
  private static boolean flowDecoupled(double correlation, double[] pressure, double[] flow) {
    if (!Double.isNaN(correlation)) {
      return correlation < CORRELATION_THRESHOLD;
    }
    return SeriesStats.isConstant(flow)
        && !SeriesStats.isConstant(pressure)
        && pressure[pressure.length - 1] < pressure[0];
  }

  /**
   * Attributes a leak to the sensor reporting the lowest pressure. The topology is accepted for
   * interface stability but does not influence the choice.
   */
  public Optional<LeakLocalization> localizeLeak(List<SensorReading> readings, PipelineTopology topology) {
    if (readings == null || readings.isEmpty()) return Optional.empty();
    SensorReading lowest = readings.get(0);
    for (SensorReading r : readings) {
      InputChecks.finite("pressure", r.pressure());
      if (r.pressure() < lowest.pressure()) lowest = r;
    }
    if (topology != null && topology.segments() != null && !topology.segments().isEmpty()) {
      log.debug("Localising over {} readings; {} topology segments ignored",
          readings.size(), topology.segments().size());
    }
    return Optional.of(new LeakLocalization(lowest.deviceId(), lowest.gpsLat(), lowest.gpsLon(),
        LOCALIZATION_CONFIDENCE, MINIMUM_PRESSURE_METHOD));
  }
}
