package com.cario.exam.app.api;

import com.cario.exam.app.exception.ExtractionException;
import com.cario.exam.app.exception.FileSecurityException;
import com.cario.exam.app.exception.ResourceNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Maps service exceptions to JSON error bodies. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(ResourceNotFoundException ex) {
    return body(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
  }

  @ExceptionHandler(FileSecurityException.class)
  public ResponseEntity<Map<String, Object>> fileSecurity(FileSecurityException ex) {
    log.warn("api.rejected.file msg={}", ex.getMessage());
    return body(HttpStatus.BAD_REQUEST, ex.getErrorCode().name(), ex.getMessage(), ex.getDetails());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, Object>> tooLarge(MaxUploadSizeExceededException ex) {
    log.warn("api.rejected.size max={}", ex.getMaxUploadSize());
    return body(HttpStatus.BAD_REQUEST, "FILE_SECURITY_ERROR", "file exceeds upload limit", null);
  }

  @ExceptionHandler(ExtractionException.class)
  public ResponseEntity<Map<String, Object>> extraction(ExtractionException ex) {
    log.warn("api.extraction.failed code={} msg={}", ex.getErrorCode(), ex.getMessage());
    HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
    return body(status, ex.getErrorCode().name(), ex.getMessage(), ex.getDetails());
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    ConstraintViolationException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<Map<String, Object>> badRequest(Exception ex) {
    return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException ex) {
    Map<String, Object> fields =
        ex.getBindingResult().getFieldErrors().stream()
            .collect(
                Collectors.toMap(
                    f -> f.getField(),
                    f -> String.valueOf(f.getDefaultMessage()),
                    (a, b) -> a,
                    LinkedHashMap::new));
    return body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "request body is invalid", fields);
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<Map<String, Object>> busy(TaskRejectedException ex) {
    log.warn("api.busy msg={}", ex.getMessage());
    return body(HttpStatus.SERVICE_UNAVAILABLE, "BUSY", "processing capacity exhausted", null);
  }

  private static ResponseEntity<Map<String, Object>> body(
      HttpStatus status, String code, String message, Map<String, Object> details) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", message);
    body.put("error_code", code);
    body.put("status", status.value());
    body.put("timestamp", Instant.now().toString());
    if (details != null && !details.isEmpty()) {
      body.put("details", details);
    }
    return ResponseEntity.status(status).body(body);
  }
}
