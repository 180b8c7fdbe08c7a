package com.hydrowatch.detection.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
  PRESSURE_ANOMALY("pressure_anomaly"),
  LOW_FLOW("low_flow"),
  CONTAMINATION("contamination"),
  LEAK("leak"),
  GENERAL_ANOMALY("general_anomaly");

  private final String code;

  AnomalyType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Types that route a sample to the leak analyzer. */
  public boolean isLeakRelevant() {
    return this == LEAK || this == PRESSURE_ANOMALY;
  }

  public boolean isTurbidityRelevant() {
    return this == CONTAMINATION;
  }

  public static AnomalyType fromCode(String code) {
    for (AnomalyType t : values()) {
      if (t.code.equalsIgnoreCase(code)) return t;
    }
    throw new IllegalArgumentException("Unknown anomaly type: " + code);
  }
}
