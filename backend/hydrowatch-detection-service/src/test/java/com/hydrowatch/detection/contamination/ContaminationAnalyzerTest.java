package com.hydrowatch.detection.contamination;

import static org.junit.jupiter.api.Assertions.*;

import com.hydrowatch.detection.exception.InvalidInputException;
import com.hydrowatch.detection.model.ContaminationPatternResult;
import com.hydrowatch.detection.model.ContaminationResult;
import com.hydrowatch.detection.model.GpsPoint;
import com.hydrowatch.detection.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ContaminationAnalyzer Tests")
class ContaminationAnalyzerTest {

  private final ContaminationAnalyzer analyzer = new ContaminationAnalyzer();

  @ParameterizedTest(name = "turbidity={0} -> {1} ({2})")
  @CsvSource({
      "12,  CRITICAL, 0.95",
      "10,  CRITICAL, 0.95",
      "8,   HIGH,     0.8",
      "7,   HIGH,     0.8",
      "5,   MEDIUM,   0.6"
  })
  void turbidityBands(double turbidity, Severity severity, double confidence) {
    ContaminationResult r = analyzer.detect(turbidity, 23.0, null);
    assertTrue(r.detected());
    assertEquals(severity, r.severity());
    assertEquals(confidence, r.confidence(), 1e-9);
    assertNotNull(r.recommendedAction());
  }

  @Test
  @DisplayName("Clean water is not flagged and gets no GPS estimate")
  void clean() {
    ContaminationResult r = analyzer.detect(3.0, 23.0, new GpsPoint(1, 2));
    assertFalse(r.detected());
    assertEquals(Severity.LOW, r.severity());
    assertEquals(0.0, r.confidence());
    assertNull(r.gpsEstimate());
  }

  @Test
  @DisplayName("Temperature alone is a low-severity finding")
  void temperatureOnly() {
    ContaminationResult r = analyzer.detect(3.0, 40.0, new GpsPoint(1, 2));
    assertTrue(r.detected());
    assertEquals(Severity.LOW, r.severity());
    assertEquals(0.5, r.confidence(), 1e-9);
    assertTrue(r.description().startsWith("Temperature anomaly detected: 40.00 C"));
    assertEquals(0.5, r.gpsEstimate().confidence(), 1e-9);
  }

  @Test
  @DisplayName("Temperature on top of turbidity adds 0.1, capped at 1")
  void temperatureBoost() {
    ContaminationResult high = analyzer.detect(8.0, 10.0, null);
    assertEquals(0.9, high.confidence(), 1e-9);
    assertTrue(high.description().endsWith(". Temperature anomaly: 10.00 C"));

    ContaminationResult critical = analyzer.detect(12.0, 40.0, null);
    assertEquals(1.0, critical.confidence(), 1e-9);
    assertEquals(Severity.CRITICAL, critical.severity());
  }

  @Test
  @DisplayName("A single outlying reading is a spike")
  void spike() {
    ContaminationPatternResult r = analyzer.detectPattern(
        new double[] {1, 1, 1, 1, 1, 1, 1, 1, 1, 9}, null);
    assertTrue(r.detected());
    assertTrue(r.spikeDetected());
    assertEquals(0.7, r.confidence(), 1e-9);
    assertEquals(9.0, r.currentTurbidity());
    assertEquals(1.0, r.baselineTurbidity(), 1e-9);
    assertNull(r.message());
  }

  @Test
  @DisplayName("A rising trend counts once turbidity is above the safe limit")
  void trendAboveSafeLimit() {
    ContaminationPatternResult r = analyzer.detectPattern(
        new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10}, null);
    assertFalse(r.spikeDetected());
    assertTrue(r.increasingTrend());
    assertTrue(r.detected());
    assertEquals(0.5, r.confidence(), 1e-9);
    assertEquals(1.0, r.trendSlope(), 1e-9);
  }

  @Test
  @DisplayName("A rising trend below the safe limit is not a detection")
  void trendBelowSafeLimit() {
    ContaminationPatternResult r = analyzer.detectPattern(
        new double[] {0.2, 0.4, 0.6, 0.8, 1.0, 1.2, 1.4, 1.6, 1.8, 2.0}, null);
    assertTrue(r.increasingTrend());
    assertFalse(r.spikeDetected());
    assertFalse(r.detected());
  }

  @Test
  @DisplayName("Short series have no trend slope")
  void shortSeriesNoTrend() {
    ContaminationPatternResult r = analyzer.detectPattern(new double[] {1, 1.1, 0.9, 1.0, 1.05}, null);
    assertNull(r.trendSlope());
    assertFalse(r.increasingTrend());
    assertFalse(r.detected());
  }

  @Test
  @DisplayName("Fewer than five points is insufficient data")
  void insufficient() {
    ContaminationPatternResult r = analyzer.detectPattern(new double[] {1, 2, 3, 4}, null);
    assertFalse(r.detected());
    assertEquals(0.0, r.confidence());
    assertEquals(ContaminationPatternResult.INSUFFICIENT_DATA, r.message());
  }

  @Test
  @DisplayName("Non-finite turbidity is rejected")
  void nonFinite() {
    assertThrows(InvalidInputException.class, () -> analyzer.detect(Double.NaN, 20, null));
    assertThrows(InvalidInputException.class,
        () -> analyzer.detectPattern(new double[] {1, 2, Double.NaN, 4, 5}, null));
  }
}
