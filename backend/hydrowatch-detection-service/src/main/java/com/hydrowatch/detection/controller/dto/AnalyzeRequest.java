package com.hydrowatch.detection.controller.dto;

/** Raw telemetry as posted by a device or gateway; numbers are checked before use. */
public record AnalyzeRequest(
    String deviceId,
    Double flowRate,
    Double pressure,
    Double turbidity,
    Double temperature,
    Double ph,
    Double conductivity,
    Double gpsLat,
    Double gpsLon,
    String timestamp
) {}
