package com.cario.exam.app.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Base of the typed pipeline failures. Each subtype carries a fixed {@link ErrorCode}. */
public abstract class ExtractionException extends RuntimeException {

  private final ErrorCode errorCode;
  private final Map<String, Object> details;

  protected ExtractionException(
      ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
    super(message, cause);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    this.details =
        details == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public boolean isCritical() {
    return errorCode.isCritical();
  }

  /** Short type name recorded in error details, e.g. {@code OcrProcessingException}. */
  public String getErrorType() {
    return getClass().getSimpleName();
  }
}
