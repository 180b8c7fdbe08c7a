package com.hydrowatch.detection.stats;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SeriesStats Tests")
class SeriesStatsTest {

  private static final double EPS = 1e-9;

  @Test
  @DisplayName("Standard deviation divides by n")
  void populationStd() {
    assertEquals(2.0, SeriesStats.populationStd(new double[] {2, 4, 4, 4, 5, 5, 7, 9}), EPS);
    assertEquals(0.0, SeriesStats.populationStd(new double[0]), EPS);
  }

  @Test
  @DisplayName("Gradient uses one-sided ends and central differences inside")
  void gradient() {
    assertArrayEquals(new double[] {1.0, 1.5, 2.5, 3.0},
        SeriesStats.gradient(new double[] {1, 2, 4, 7}), EPS);
    assertArrayEquals(new double[1], SeriesStats.gradient(new double[] {3}), EPS);
  }

  @Test
  @DisplayName("argMin returns the first minimum")
  void argMinFirst() {
    assertEquals(1, SeriesStats.argMin(new double[] {3, -1, 2, -1}));
  }

  @Test
  @DisplayName("Pearson is undefined for constant series")
  void pearsonConstant() {
    assertTrue(Double.isNaN(SeriesStats.pearson(new double[] {1, 2, 3}, new double[] {5, 5, 5})));
    assertEquals(-1.0, SeriesStats.pearson(new double[] {1, 2, 3}, new double[] {6, 4, 2}), EPS);
  }

  @Test
  @DisplayName("Pearson rejects series of different lengths")
  void pearsonLengthMismatch() {
    assertThrows(IllegalArgumentException.class,
        () -> SeriesStats.pearson(new double[] {1, 2}, new double[] {1, 2, 3}));
  }

  @Test
  @DisplayName("Slope against index of a straight line")
  void slope() {
    assertEquals(0.5, SeriesStats.slopeAgainstIndex(new double[] {1, 1.5, 2, 2.5}), EPS);
  }

  @Test
  @DisplayName("tail and allButLast slice from the end")
  void slicing() {
    assertArrayEquals(new double[] {3, 4}, SeriesStats.tail(new double[] {1, 2, 3, 4}, 2), EPS);
    assertArrayEquals(new double[] {1, 2}, SeriesStats.tail(new double[] {1, 2}, 5), EPS);
    assertArrayEquals(new double[] {1, 2, 3}, SeriesStats.allButLast(new double[] {1, 2, 3, 4}), EPS);
  }
}
