package com.hydrowatch.detection.quality;

import com.hydrowatch.detection.model.WaterQualityResult;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Weighted water quality index (WQI, 0-100) from turbidity, pH, temperature and conductivity.
 * Each parameter maps to a 0-100 sub-score through a fixed piecewise-linear curve; a missing
 * parameter contributes a fixed neutral sub-score.
 */
public class WaterQualityScorer {

  static final double DEFAULT_TURBIDITY_SCORE = 60;
  static final double DEFAULT_CONDUCTIVITY_SCORE = 65;
  static final double DEFAULT_TEMPERATURE_SCORE = 70;
  static final double DEFAULT_PH_SCORE = 70;

  static final double TURBIDITY_WEIGHT = 0.3;
  static final double PH_WEIGHT = 0.3;
  static final double TEMPERATURE_WEIGHT = 0.2;
  static final double CONDUCTIVITY_WEIGHT = 0.2;

  public enum Band {
    GOOD("good", "green", "🟢", "Water quality is good and safe for supply."),
    AVERAGE("average", "yellow", "🟡", "Water quality is acceptable but should be monitored."),
    BAD("bad", "red", "🔴", "Water quality is poor. Immediate action required.");

    private final String status;
    private final String color;
    private final String indicator;
    private final String message;

    Band(String status, String color, String indicator, String message) {
      this.status = status;
      this.color = color;
      this.indicator = indicator;
      this.message = message;
    }

    public String status() { return status; }
    public String color() { return color; }
    public String indicator() { return indicator; }
    public String message() { return message; }
  }

  /** 0 NTU scores 100, 50 NTU or more scores 0. */
  public double scoreTurbidity(Double turbidity) {
    if (turbidity == null) return DEFAULT_TURBIDITY_SCORE;
    return clamp(100 - (clamp(turbidity, 0, 50) / 50) * 100, 0, 100);
  }

  /** 250 uS/cm or less scores 100, falling linearly to 0 at 1500 uS/cm. */
  public double scoreConductivity(Double conductivity) {
    if (conductivity == null) return DEFAULT_CONDUCTIVITY_SCORE;
    return clamp(100 - ((clamp(conductivity, 0, 1500) - 250) / 1250) * 100, 0, 100);
  }

  /** 100 within 15-30 C; outside it decays with distance from 22.5 C, reaching 0 at 15 C off. */
  public double scoreTemperature(Double temperature) {
    if (temperature == null) return DEFAULT_TEMPERATURE_SCORE;
    if (temperature >= 15 && temperature <= 30) return 100;
    double deviation = Math.min(Math.abs(temperature - 22.5), 15);
    return clamp(100 - (deviation / 15) * 100, 0, 100);
  }

  /** 100 at pH 7.4, 0 at a deviation of 3 or more. */
  public double scorePh(Double ph) {
    if (ph == null) return DEFAULT_PH_SCORE;
    double deviation = Math.abs(ph - 7.4);
    if (deviation >= 3) return 0;
    return clamp(100 - (deviation / 3) * 100, 0, 100);
  }

  public Band classify(double wqi) {
    if (wqi >= 80) return Band.GOOD;
    if (wqi >= 60) return Band.AVERAGE;
    return Band.BAD;
  }

  public WaterQualityResult calculate(Double turbidity, Double ph, Double temperature, Double conductivity) {
    double turbidityScore = scoreTurbidity(turbidity);
    double phScore = scorePh(ph);
    double temperatureScore = scoreTemperature(temperature);
    double conductivityScore = scoreConductivity(conductivity);

    double wqi = turbidityScore * TURBIDITY_WEIGHT
        + phScore * PH_WEIGHT
        + temperatureScore * TEMPERATURE_WEIGHT
        + conductivityScore * CONDUCTIVITY_WEIGHT;
    wqi = BigDecimal.valueOf(wqi).setScale(2, RoundingMode.HALF_EVEN).doubleValue();

    Band band = classify(wqi);
    return new WaterQualityResult(wqi, band.status(), band.color(), band.indicator(), band.message(),
        turbidityScore, phScore, temperatureScore, conductivityScore);
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(value, max));
  }
}
