package com.hydrowatch.detection.model;

public record LeakLocalization(String deviceId, Double lat, Double lon, double confidence, String method) {}
