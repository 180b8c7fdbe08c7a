package com.hydrowatch.detection.outlier;

/** Binary outlier decision plus the forest score it was derived from (higher = more anomalous). */
public record OutlierVerdict(boolean outlier, double anomalyScore) {}
