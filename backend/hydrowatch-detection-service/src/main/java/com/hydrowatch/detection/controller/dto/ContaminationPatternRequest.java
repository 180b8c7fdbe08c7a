package com.hydrowatch.detection.controller.dto;

import java.util.List;

public record ContaminationPatternRequest(String deviceId, List<Double> turbidityData, List<Double> temperatureData) {}
