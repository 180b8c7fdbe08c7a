package com.hydrowatch.detection.model;

import java.util.List;

/** Pipe segments between sensors. */
public record PipelineTopology(List<Segment> segments) {

  public record Segment(String fromDeviceId, String toDeviceId, Double lengthMeters) {}

  public static PipelineTopology empty() {
    return new PipelineTopology(List.of());
  }
}
