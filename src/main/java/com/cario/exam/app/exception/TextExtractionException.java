package com.cario.exam.app.exception;

import java.util.Map;

/** Text could not be read from the document or its text layer. */
public class TextExtractionException extends ExtractionException {

  public TextExtractionException(String message) {
    this(message, null, null);
  }

  public TextExtractionException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public TextExtractionException(String message, Map<String, Object> details, Throwable cause) {
    super(ErrorCode.TEXT_EXTRACTION_ERROR, message, details, cause);
  }
}
