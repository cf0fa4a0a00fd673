package com.cario.exam.app.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One staged run of the extraction pipeline against a single document.
 *
 * <p>The job moves through the following states:
 *
 * <ul>
 *   <li>{@code pending}, when created
 *   <li>{@code in_progress}, once the first step starts
 *   <li>{@code completed} or {@code failed}, both terminal
 * </ul>
 *
 * <p>Progress only ever moves forward while the job is active. A job that reached a terminal state
 * is never restarted; retrying a document means creating a new job.
 *
 * <p>Defensive copies are used for the step map so callers cannot mutate the job's history.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingJob {

  private String id;

  private String documentId;

  private JobStatus status;

  /** Step key, or {@code completed} once the run finished. */
  private String currentStep;

  private String currentStepDisplay;

  /** 0-100, non-decreasing while active. */
  private int progressPercentage;

  /** Per-step timing keyed by step key, in execution order. */
  private Map<String, StepRecord> stepDetails;

  private ErrorDetails errorDetails;

  private Instant createdAt;

  private Instant startedAt;

  private Instant completedAt;

  public Map<String, StepRecord> getStepDetails() {
    return stepDetails == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stepDetails);
  }

  public void setStepDetails(Map<String, StepRecord> stepDetails) {
    this.stepDetails =
        stepDetails == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stepDetails);
  }

  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }

  /** Creates a pending job for {@code documentId}. */
  public static ProcessingJob newJob(String id, String documentId) {
    return ProcessingJob.builder()
        .id(id)
        .documentId(documentId)
        .status(JobStatus.PENDING)
        .progressPercentage(0)
        .stepDetails(new LinkedHashMap<>())
        .createdAt(Instant.now())
        .build();
  }
}
