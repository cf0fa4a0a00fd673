package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Complete, self-describing view of a job at one instant. Observers may receive the same snapshot
 * twice or out of order; each one stands on its own.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobStatusSnapshot {

  String jobId;
  String documentId;
  JobStatus status;
  String currentStep;
  String currentStepDisplay;
  int progressPercentage;
  ErrorDetails errorDetails;

  /** Summary of the extraction, present only once the job completed. */
  Map<String, Object> results;

  Instant timestamp;

  public static JobStatusSnapshot of(ProcessingJob job, Map<String, Object> results) {
    return JobStatusSnapshot.builder()
        .jobId(job.getId())
        .documentId(job.getDocumentId())
        .status(job.getStatus())
        .currentStep(job.getCurrentStep())
        .currentStepDisplay(job.getCurrentStepDisplay())
        .progressPercentage(job.getProgressPercentage())
        .errorDetails(job.getErrorDetails())
        .results(job.getStatus() == JobStatus.COMPLETED ? results : null)
        .timestamp(Instant.now())
        .build();
  }
}
