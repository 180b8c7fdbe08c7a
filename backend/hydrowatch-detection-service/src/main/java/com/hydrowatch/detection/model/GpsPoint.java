package com.hydrowatch.detection.model;

/** Coordinates reported by a sensor. */
public record GpsPoint(double lat, double lon) {

  /** Null unless both coordinates are present. */
  public static GpsPoint ofNullable(Double lat, Double lon) {
    if (lat == null || lon == null) return null;
    return new GpsPoint(lat, lon);
  }
}
