package com.hydrowatch.detection.model;

/** Instantaneous leak verdict for a single pressure/flow reading. Confidence is 0-1. */
public record LeakResult(
    boolean detected,
    double confidence,
    GpsEstimate gpsEstimate,
    double pressure,
    double flowRate
) {}
