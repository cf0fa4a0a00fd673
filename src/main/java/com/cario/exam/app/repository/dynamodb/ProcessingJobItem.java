package com.cario.exam.app.repository.dynamodb;

import java.time.Instant;
import java.util.Map;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/**
 * Job-level record holding current status, progress and every step summary. Error fields are
 * flattened so a failed job can be filtered on {@code errorCode} without unmarshalling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ProcessingJobItem {

  /** Partition key. */
  private String jobId;

  private String documentId;

  /** pending | in_progress | completed | failed. */
  private String status;

  private String currentStep;

  private String currentStepDisplay;

  private Integer progressPercentage;

  private Instant createdAt;

  private Instant startedAt;

  private Instant completedAt;

  /** Per-step records keyed by step key. */
  private Map<String, StepRecordItem> steps;

  // ---------- error details, set only on failure ----------

  private String errorMessage;

  private String errorType;

  private String errorCode;

  private String errorStep;

  private Instant errorTimestamp;

  private String traceback;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute("jobId")
  public String getJobId() {
    return jobId;
  }

  @DynamoDbAttribute("documentId")
  public String getDocumentId() {
    return documentId;
  }

  @DynamoDbAttribute("status")
  public String getStatus() {
    return status;
  }

  @DynamoDbAttribute("currentStep")
  public String getCurrentStep() {
    return currentStep;
  }

  @DynamoDbAttribute("currentStepDisplay")
  public String getCurrentStepDisplay() {
    return currentStepDisplay;
  }

  @DynamoDbAttribute("progressPercentage")
  public Integer getProgressPercentage() {
    return progressPercentage;
  }

  @DynamoDbAttribute("createdAt")
  public Instant getCreatedAt() {
    return createdAt;
  }

  @DynamoDbAttribute("startedAt")
  public Instant getStartedAt() {
    return startedAt;
  }

  @DynamoDbAttribute("completedAt")
  public Instant getCompletedAt() {
    return completedAt;
  }

  @DynamoDbAttribute("steps")
  public Map<String, StepRecordItem> getSteps() {
    return steps;
  }

  @DynamoDbAttribute("errorMessage")
  public String getErrorMessage() {
    return errorMessage;
  }

  @DynamoDbAttribute("errorType")
  public String getErrorType() {
    return errorType;
  }

  @DynamoDbAttribute("errorCode")
  public String getErrorCode() {
    return errorCode;
  }

  @DynamoDbAttribute("errorStep")
  public String getErrorStep() {
    return errorStep;
  }

  @DynamoDbAttribute("errorTimestamp")
  public Instant getErrorTimestamp() {
    return errorTimestamp;
  }

  @DynamoDbAttribute("traceback")
  public String getTraceback() {
    return traceback;
  }
}
