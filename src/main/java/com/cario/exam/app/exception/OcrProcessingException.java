package com.cario.exam.app.exception;

import java.util.Map;

/** No OCR engine available, or every selected engine failed. */
public class OcrProcessingException extends ExtractionException {

  public OcrProcessingException(String message) {
    this(message, null, null);
  }

  public OcrProcessingException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public OcrProcessingException(String message, Map<String, Object> details, Throwable cause) {
    super(ErrorCode.OCR_PROCESSING_ERROR, message, details, cause);
  }
}
