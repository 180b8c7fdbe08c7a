package com.hydrowatch.detection.outlier;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StandardScaler Tests")
class StandardScalerTest {

  private static final double EPS = 1e-12;

  @Test
  @DisplayName("Centres on the mean and divides by the population deviation")
  void fitAndTransform() {
    StandardScaler scaler = StandardScaler.fit(new double[][] {{1, 10}, {3, 10}});
    assertArrayEquals(new double[] {2, 10}, scaler.mean(), EPS);
    assertArrayEquals(new double[] {1, 1}, scaler.scale(), EPS);
    assertArrayEquals(new double[] {1, 0}, scaler.transform(new double[] {3, 10}), EPS);
  }

  @Test
  @DisplayName("Scale is the population, not the sample, deviation")
  void populationDeviation() {
    StandardScaler scaler = StandardScaler.fit(new double[][] {{1}, {2}, {6}});
    assertArrayEquals(new double[] {3}, scaler.mean(), EPS);
    assertArrayEquals(new double[] {Math.sqrt(14.0 / 3.0)}, scaler.scale(), EPS);
  }

  @Test
  @DisplayName("Constant features keep a unit scale")
  void constantFeature() {
    StandardScaler scaler = StandardScaler.fit(new double[][] {{5}, {5}, {5}});
    assertArrayEquals(new double[] {2}, scaler.transform(new double[] {7}), EPS);
  }

  @Test
  @DisplayName("Rejects rows of the wrong width")
  void widthMismatch() {
    StandardScaler scaler = StandardScaler.fit(new double[][] {{1, 2}, {3, 4}});
    assertThrows(IllegalArgumentException.class, () -> scaler.transform(new double[] {1}));
  }
}
