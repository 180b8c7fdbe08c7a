package com.hydrowatch.detection.controller.dto;

import com.hydrowatch.detection.model.PipelineTopology;
import com.hydrowatch.detection.model.SensorReading;
import java.util.List;

public record LocalizeLeakRequest(List<SensorReading> readings, PipelineTopology topology) {}
