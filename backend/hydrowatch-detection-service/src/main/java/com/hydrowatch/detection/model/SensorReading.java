package com.hydrowatch.detection.model;

/** A simultaneous reading from one sensor, used for multi-sensor leak localisation. */
public record SensorReading(String deviceId, double pressure, double flowRate, Double gpsLat, Double gpsLon) {}
