package com.cario.exam.app.service.correct;

import java.util.Locale;

/** HORIZONTAL cuts at y into top and bottom halves; VERTICAL cuts at x into left and right. */
public enum SplitAxis {
  HORIZONTAL,
  VERTICAL;

  public static SplitAxis fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("split axis must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown split axis: " + value, e);
    }
  }
}
