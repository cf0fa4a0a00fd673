package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Content classification of a page region. */
public enum RegionType {
  QUESTION("question"),
  ANSWER_OPTIONS("answer_options"),
  QUESTION_GROUP("question_group"),
  PASSAGE("passage"),
  DIAGRAM("diagram"),
  TABLE("table"),
  UNKNOWN("unknown");

  private final String value;

  RegionType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static RegionType fromValue(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (RegionType t : values()) {
      if (t.value.equals(v) || t.name().toLowerCase(Locale.ROOT).equals(v)) {
        return t;
      }
    }
    throw new IllegalArgumentException("unknown region type: " + value);
  }
}
