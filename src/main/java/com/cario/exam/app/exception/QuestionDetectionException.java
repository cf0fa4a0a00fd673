package com.cario.exam.app.exception;

import java.util.Map;

/** Region detection or question grouping failed. */
public class QuestionDetectionException extends ExtractionException {

  public QuestionDetectionException(String message) {
    this(message, null, null);
  }

  public QuestionDetectionException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public QuestionDetectionException(String message, Map<String, Object> details, Throwable cause) {
    super(ErrorCode.QUESTION_DETECTION_ERROR, message, details, cause);
  }
}
