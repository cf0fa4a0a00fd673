package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QuestionType {
  MCQ("mcq"),
  MULTI_SELECT("multi_select"),
  TRUE_FALSE("true_false"),
  FILL_BLANK("fill_blank"),
  ESSAY("essay"),
  UNKNOWN("unknown");

  private final String value;

  QuestionType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
