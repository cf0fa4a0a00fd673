package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CorrectionType {
  RESIZE("resize"),
  MOVE("move"),
  SPLIT("split"),
  MERGE("merge"),
  DELETE("delete"),
  CREATE("create"),
  RETYPE("retype");

  private final String value;

  CorrectionType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
