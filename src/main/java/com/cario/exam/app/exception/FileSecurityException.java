package com.cario.exam.app.exception;

import java.util.Map;

/** Upload rejected: wrong type, oversized, encrypted or malformed. */
public class FileSecurityException extends ExtractionException {

  public FileSecurityException(String message) {
    this(message, null, null);
  }

  public FileSecurityException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public FileSecurityException(String message, Map<String, Object> details, Throwable cause) {
    super(ErrorCode.FILE_SECURITY_ERROR, message, details, cause);
  }
}
