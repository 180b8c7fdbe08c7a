package com.hydrowatch.detection.model;

import java.time.Instant;

/**
 * Merged verdict for one telemetry sample. Leak and contamination details are only present
 * when the classification routed the sample to those analyzers.
 */
public record OrchestratedResult(
    String deviceId,
    Instant timestamp,
    boolean detected,
    AnomalyType type,
    Severity severity,
    double confidence,
    String description,
    String recommendedAction,
    GpsEstimate gpsEstimate,
    LeakResult leakDetails,
    ContaminationResult contaminationDetails,
    WaterQualityResult waterQuality
) {}
