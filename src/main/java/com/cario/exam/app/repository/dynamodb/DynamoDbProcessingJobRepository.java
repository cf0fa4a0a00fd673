package com.cario.exam.app.repository.dynamodb;

import com.cario.exam.app.model.ErrorDetails;
import com.cario.exam.app.model.JobStatus;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.StepRecord;
import com.cario.exam.app.repository.ProcessingJobRepository;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Job state in a DynamoDB table through the enhanced client. */
@Log4j2
@Repository
@Profile({"local", "production"})
public class DynamoDbProcessingJobRepository implements ProcessingJobRepository {

  private final DynamoDbTable<ProcessingJobItem> table;

  public DynamoDbProcessingJobRepository(
      DynamoDbClient ddb,
      @Value("${aws.dynamodb.jobs.table:ExamProcessingJobs}") String tableName) {
    DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
    this.table = enhanced.table(tableName, TableSchema.fromBean(ProcessingJobItem.class));
  }

  // -------- CRUD --------

  @Override
  public void save(ProcessingJob job) {
    Objects.requireNonNull(job, "job must not be null");
    table.putItem(toItem(job));
    log.debug(
        "jobstate.save jobId={} status={} progress={}",
        job.getId(),
        job.getStatus(),
        job.getProgressPercentage());
  }

  @Override
  public Optional<ProcessingJob> findById(String jobId) {
    if (jobId == null) {
      return Optional.empty();
    }
    ProcessingJobItem item = table.getItem(Key.builder().partitionValue(jobId).build());
    return Optional.ofNullable(item).map(DynamoDbProcessingJobRepository::fromItem);
  }

  /** Scans with a filter; the jobs table stays small enough that no index is kept for this. */
  @Override
  public Optional<ProcessingJob> findLatestByDocumentId(String documentId) {
    Expression filter =
        Expression.builder()
            .expression("documentId = :d")
            .putExpressionValue(":d", AttributeValue.fromS(documentId))
            .build();
    return table.scan(ScanEnhancedRequest.builder().filterExpression(filter).build()).items()
        .stream()
        .max(
            Comparator.comparing(
                ProcessingJobItem::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
        .map(DynamoDbProcessingJobRepository::fromItem);
  }

  // -------- Mapping --------

  static ProcessingJobItem toItem(ProcessingJob job) {
    Map<String, StepRecordItem> steps = new LinkedHashMap<>();
    job.getStepDetails()
        .forEach(
            (k, v) ->
                steps.put(
                    k,
                    StepRecordItem.builder()
                        .status(v.getStatus())
                        .startedAt(v.getStartedAt())
                        .completedAt(v.getCompletedAt())
                        .durationMs(v.getDurationMs())
                        .message(v.getMessage())
                        .build()));
    ProcessingJobItem.ProcessingJobItemBuilder b =
        ProcessingJobItem.builder()
            .jobId(job.getId())
            .documentId(job.getDocumentId())
            .status(job.getStatus() == null ? null : job.getStatus().value())
            .currentStep(job.getCurrentStep())
            .currentStepDisplay(job.getCurrentStepDisplay())
            .progressPercentage(job.getProgressPercentage())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .steps(steps);
    ErrorDetails e = job.getErrorDetails();
    if (e != null) {
      b.errorMessage(e.getError())
          .errorType(e.getErrorType())
          .errorCode(e.getErrorCode())
          .errorStep(e.getStep())
          .errorTimestamp(e.getTimestamp())
          .traceback(e.getTraceback());
    }
    return b.build();
  }

  static ProcessingJob fromItem(ProcessingJobItem item) {
    Map<String, StepRecord> steps = new LinkedHashMap<>();
    if (item.getSteps() != null) {
      item.getSteps()
          .forEach(
              (k, v) ->
                  steps.put(
                      k,
                      StepRecord.builder()
                          .status(v.getStatus())
                          .startedAt(v.getStartedAt())
                          .completedAt(v.getCompletedAt())
                          .durationMs(v.getDurationMs())
                          .message(v.getMessage())
                          .build()));
    }
    ErrorDetails error =
        item.getErrorCode() == null && item.getErrorMessage() == null
            ? null
            : ErrorDetails.builder()
                .error(item.getErrorMessage())
                .errorType(item.getErrorType())
                .errorCode(item.getErrorCode())
                .step(item.getErrorStep())
                .timestamp(item.getErrorTimestamp())
                .traceback(item.getTraceback())
                .build();
    return ProcessingJob.builder()
        .id(item.getJobId())
        .documentId(item.getDocumentId())
        .status(item.getStatus() == null ? null : JobStatus.fromValue(item.getStatus()))
        .currentStep(item.getCurrentStep())
        .currentStepDisplay(item.getCurrentStepDisplay())
        .progressPercentage(
            item.getProgressPercentage() == null ? 0 : item.getProgressPercentage())
        .createdAt(item.getCreatedAt())
        .startedAt(item.getStartedAt())
        .completedAt(item.getCompletedAt())
        .stepDetails(steps)
        .errorDetails(error)
        .build();
  }
}
