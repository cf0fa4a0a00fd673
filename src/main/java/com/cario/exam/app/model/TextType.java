package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Whether a document carries an extractable text layer or must be OCR'd. */
public enum TextType {
  SEARCHABLE,
  SCANNED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
