package com.cario.exam.app.repository.dynamodb;

import java.time.Instant;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Lifecycle of a single pipeline step inside a job record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class StepRecordItem {

  /** STARTED | SUCCEEDED | FAILED. */
  private String status;

  private Instant startedAt;

  private Instant completedAt;

  private Long durationMs;

  /** Outcome summary or error message. */
  private String message;

  @DynamoDbAttribute("status")
  public String getStatus() {
    return status;
  }

  @DynamoDbAttribute("startedAt")
  public Instant getStartedAt() {
    return startedAt;
  }

  @DynamoDbAttribute("completedAt")
  public Instant getCompletedAt() {
    return completedAt;
  }

  @DynamoDbAttribute("durationMs")
  public Long getDurationMs() {
    return durationMs;
  }

  @DynamoDbAttribute("message")
  public String getMessage() {
    return message;
  }
}
