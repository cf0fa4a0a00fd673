package com.cario.exam.app.service.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Structured pipeline events, one JSON object per line on the {@code exam.processing} logger.
 * {@code log4j2.xml} routes that logger to its own rolling file for timing analysis.
 */
public class ProcessingLogger {

  public static final String LOGGER_NAME = "exam.processing";

  private static final Logger EVENTS = LogManager.getLogger(LOGGER_NAME);

  private final ObjectMapper mapper;

  public ProcessingLogger(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
  }

  public void stepStart(String jobId, String documentId, String step) {
    Map<String, Object> e = event("step_start", jobId, documentId);
    e.put("step", step);
    emit(Level.INFO, e);
  }

  public void stepComplete(
      String jobId, String documentId, String step, long durationMs, Map<String, Object> results) {
    Map<String, Object> e = event("step_complete", jobId, documentId);
    e.put("step", step);
    e.put("duration_seconds", durationMs / 1000.0);
    e.put("results", results == null ? Map.of() : results);
    emit(Level.INFO, e);
  }

  public void warning(
      String jobId, String documentId, String message, Map<String, Object> details) {
    Map<String, Object> e = event("warning", jobId, documentId);
    e.put("message", message);
    e.put("details", details == null ? Map.of() : details);
    emit(Level.WARN, e);
  }

  public void extractionResult(
      String jobId, String documentId, int pageNumber, int questionsFound, double confidenceAvg) {
    Map<String, Object> e = event("extraction_result", jobId, documentId);
    e.put("page_number", pageNumber);
    e.put("questions_found", questionsFound);
    e.put("confidence_avg", confidenceAvg);
    emit(Level.INFO, e);
  }

  public void performanceMetrics(String jobId, String documentId, Map<String, Object> metrics) {
    Map<String, Object> e = event("performance_metrics", jobId, documentId);
    e.put("metrics", metrics);
    emit(Level.INFO, e);
  }

  private static Map<String, Object> event(String name, String jobId, String documentId) {
    Map<String, Object> e = new LinkedHashMap<>();
    e.put("event", name);
    e.put("job_id", jobId);
    e.put("document_id", documentId);
    e.put("timestamp", Instant.now().toString());
    return e;
  }

  private void emit(Level level, Map<String, Object> event) {
    if (!EVENTS.isEnabled(level)) {
      return;
    }
    try {
      EVENTS.log(level, mapper.writeValueAsString(event));
    } catch (JsonProcessingException ex) {
      EVENTS.log(level, "unserializable event={} error={}", event, ex.getMessage());
    }
  }
}
