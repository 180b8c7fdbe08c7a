package com.hydrowatch.detection.model;

public record ContaminationResult(
    boolean detected,
    Severity severity,
    double confidence,
    String description,
    double turbidity,
    double temperature,
    GpsEstimate gpsEstimate,
    String recommendedAction
) {}
