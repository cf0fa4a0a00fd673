package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Review tier derived from a 0-100 confidence score. */
public enum ConfidenceLevel {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  public static final double HIGH_THRESHOLD = 80.0;
  public static final double MEDIUM_THRESHOLD = 60.0;

  private final String value;

  ConfidenceLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static ConfidenceLevel fromScore(double score) {
    if (score >= HIGH_THRESHOLD) {
      return HIGH;
    }
    if (score >= MEDIUM_THRESHOLD) {
      return MEDIUM;
    }
    return LOW;
  }
}
