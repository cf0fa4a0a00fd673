package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.exception.ExtractionException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Result of one pipeline step: a summary on success, or the typed error that stopped it. */
public final class StepOutcome {

  private final Map<String, Object> summary;
  private final ExtractionException error;

  private StepOutcome(Map<String, Object> summary, ExtractionException error) {
    this.summary = summary;
    this.error = error;
  }

  public static StepOutcome ok() {
    return ok(Map.of());
  }

  public static StepOutcome ok(Map<String, Object> summary) {
    return new StepOutcome(Collections.unmodifiableMap(new LinkedHashMap<>(summary)), null);
  }

  public static StepOutcome failed(ExtractionException error) {
    return new StepOutcome(Map.of(), Objects.requireNonNull(error, "error must not be null"));
  }

  public boolean isOk() {
    return error == null;
  }

  public Map<String, Object> getSummary() {
    return summary;
  }

  /** Null when {@link #isOk()}. */
  public ExtractionException getError() {
    return error;
  }

  @Override
  public String toString() {
    return isOk() ? "ok" + summary : "failed(" + error.getErrorCode() + ")";
  }
}
