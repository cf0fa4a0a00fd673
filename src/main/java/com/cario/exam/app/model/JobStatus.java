package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of a processing job: pending, in_progress, then completed or failed. */
public enum JobStatus {
  PENDING("pending"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static JobStatus fromValue(String value) {
    for (JobStatus s : values()) {
      if (s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
        return s;
      }
    }
    throw new IllegalArgumentException("unknown job status: " + value);
  }
}
