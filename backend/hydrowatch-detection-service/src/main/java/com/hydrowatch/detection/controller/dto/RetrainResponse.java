package com.hydrowatch.detection.controller.dto;

public record RetrainResponse(boolean success, String message) {}
