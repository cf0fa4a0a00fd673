package com.cario.exam.app.exception;

/** Stable error codes recorded on failed jobs. Critical codes page an operator. */
public enum ErrorCode {
  FILE_SECURITY_ERROR(true),
  OCR_PROCESSING_ERROR(false),
  TEXT_EXTRACTION_ERROR(false),
  QUESTION_DETECTION_ERROR(false),
  LAYOUT_ANALYSIS_ERROR(false),
  PROCESSING_TIMEOUT(true);

  private final boolean critical;

  ErrorCode(boolean critical) {
    this.critical = critical;
  }

  public boolean isCritical() {
    return critical;
  }
}
