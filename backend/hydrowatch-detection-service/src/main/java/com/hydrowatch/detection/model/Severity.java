package com.hydrowatch.detection.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Ordered severity band attached to a detected issue. */
public enum Severity {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high"),
  CRITICAL("critical");

  private final String code;

  Severity(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
