package com.hydrowatch.detection.controller.dto;

public record HealthResponse(String status, String service, boolean outlierModelReady) {}
