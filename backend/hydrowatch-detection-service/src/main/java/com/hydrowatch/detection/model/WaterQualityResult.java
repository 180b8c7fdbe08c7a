package com.hydrowatch.detection.model;

public record WaterQualityResult(
    double wqi,
    String status,
    String color,
    String indicator,
    String message,
    double turbidityScore,
    double phScore,
    double temperatureScore,
    double conductivityScore
) {}
