package com.hydrowatch.detection.controller.dto;

import java.util.List;

/** Rows of {@code [flow_rate, pressure, turbidity, temperature]}. */
public record RetrainRequest(List<List<Double>> rows) {}
