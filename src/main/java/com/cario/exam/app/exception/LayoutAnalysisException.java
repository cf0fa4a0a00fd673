package com.cario.exam.app.exception;

import java.util.Map;

/** Line assembly or column detection failed. */
public class LayoutAnalysisException extends ExtractionException {

  public LayoutAnalysisException(String message) {
    this(message, null, null);
  }

  public LayoutAnalysisException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public LayoutAnalysisException(String message, Map<String, Object> details, Throwable cause) {
    super(ErrorCode.LAYOUT_ANALYSIS_ERROR, message, details, cause);
  }
}
