package com.hydrowatch.detection.classify;

import com.hydrowatch.detection.model.AnomalyType;
import com.hydrowatch.detection.model.Severity;

public record Classification(AnomalyType type, Severity severity) {}
