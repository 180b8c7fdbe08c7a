package com.hydrowatch.detection.controller.dto;

import java.util.List;

public record LeakHistoryRequest(String deviceId, List<Double> pressureData, List<Double> flowData) {}
