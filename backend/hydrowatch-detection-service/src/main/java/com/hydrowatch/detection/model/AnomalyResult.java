package com.hydrowatch.detection.model;

/**
 * Outcome of classifying one sample. {@code confidence} is on the 0-100 scale; {@code type}
 * is null when nothing was detected.
 */
public record AnomalyResult(
    boolean detected,
    AnomalyType type,
    Severity severity,
    double confidence,
    double anomalyScore,
    String description,
    String recommendedAction
) {}
