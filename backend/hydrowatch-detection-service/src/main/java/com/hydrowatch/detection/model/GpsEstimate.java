package com.hydrowatch.detection.model;

public record GpsEstimate(double lat, double lon, double confidence, String method) {

  public static final String SENSOR_LOCATION = "sensor_location";

  public static GpsEstimate atSensor(GpsPoint gps, double confidence) {
    return new GpsEstimate(gps.lat(), gps.lon(), confidence, SENSOR_LOCATION);
  }
}
