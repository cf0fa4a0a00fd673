package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.exception.ResourceNotFoundException;
import com.cario.exam.app.model.DocumentStatistics;
import com.cario.exam.app.model.ErrorDetails;
import com.cario.exam.app.model.JobStatus;
import com.cario.exam.app.model.JobStatusSnapshot;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.model.StepRecord;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.repository.ProcessingJobRepository;
import com.cario.exam.app.service.stats.StatisticsAggregator;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

/**
 * Central status writer for processing jobs.
 *
 * <p>Every transition updates the job, persists it and publishes a fresh snapshot:
 *
 * <ul>
 *   <li>create (pending)
 *   <li>start, step started, step succeeded (in_progress)
 *   <li>failed or completed (terminal)
 * </ul>
 *
 * <p>Progress only moves forward. The last step's weight is applied together with completion, so
 * a job shows 100 only once it has completed.
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class ProcessingJobService {

  public static final String STEP_STARTED = "STARTED";
  public static final String STEP_SUCCEEDED = "SUCCEEDED";
  public static final String STEP_FAILED = "FAILED";

  private final ProcessingJobRepository repo;
  private final JobProgressBroker broker;
  private final DocumentStore documents;
  private final StatisticsAggregator aggregator;

  // =====================================================================
  // Reads
  // =====================================================================

  public ProcessingJob get(String jobId) {
    validateId(jobId);
    return repo.findById(jobId).orElseThrow(() -> new ResourceNotFoundException("job", jobId));
  }

  public JobStatusSnapshot snapshot(String jobId) {
    return snapshot(get(jobId));
  }

  /** Snapshot of {@code job}; completed jobs carry a results summary. */
  public JobStatusSnapshot snapshot(ProcessingJob job) {
    Map<String, Object> results = null;
    if (job.getStatus() == JobStatus.COMPLETED) {
      DocumentStatistics stats = aggregator.aggregate(documents.findQuestions(job.getDocumentId()));
      results = new LinkedHashMap<>();
      results.put("document_id", job.getDocumentId());
      results.put("total_questions", stats.getTotal());
      results.put("statistics", stats);
    }
    return JobStatusSnapshot.of(job, results);
  }

  // =====================================================================
  // Transitions
  // =====================================================================

  public ProcessingJob create(String documentId) {
    validateId(documentId);
    ProcessingJob job = ProcessingJob.newJob(UUID.randomUUID().toString(), documentId);
    persist(job);
    log.info("job.created jobId={} docId={}", job.getId(), documentId);
    return job;
  }

  public void start(ProcessingJob job) {
    job.setStatus(JobStatus.IN_PROGRESS);
    job.setStartedAt(Instant.now());
    persist(job);
    log.info("job.started jobId={} docId={}", job.getId(), job.getDocumentId());
  }

  public void stepStarted(ProcessingJob job, ProcessingStep step) {
    job.setCurrentStep(step.key());
    job.setCurrentStepDisplay(step.displayName());
    Map<String, StepRecord> details = job.getStepDetails();
    details.put(
        step.key(), StepRecord.builder().status(STEP_STARTED).startedAt(Instant.now()).build());
    job.setStepDetails(details);
    persist(job);
  }

  public void stepSucceeded(
      ProcessingJob job, ProcessingStep step, long durationMs, String message) {
    Map<String, StepRecord> details = job.getStepDetails();
    StepRecord record = details.getOrDefault(step.key(), StepRecord.builder().build());
    record.setStatus(STEP_SUCCEEDED);
    record.setCompletedAt(Instant.now());
    record.setDurationMs(durationMs);
    record.setMessage(message);
    details.put(step.key(), record);
    job.setStepDetails(details);

    int target = step.cumulativeWeight();
    if (target < ProcessingStep.totalWeight() && target > job.getProgressPercentage()) {
      job.setProgressPercentage(target);
    }
    persist(job);
    log.info(
        "job.step.succeeded jobId={} step={} durationMs={} progress={}",
        job.getId(),
        step.key(),
        durationMs,
        job.getProgressPercentage());
  }

  public void failed(ProcessingJob job, ProcessingStep step, ErrorDetails error) {
    Objects.requireNonNull(error, "error must not be null");
    if (step != null) {
      Map<String, StepRecord> details = job.getStepDetails();
      StepRecord record = details.getOrDefault(step.key(), StepRecord.builder().build());
      record.setStatus(STEP_FAILED);
      record.setCompletedAt(Instant.now());
      record.setMessage(error.getError());
      details.put(step.key(), record);
      job.setStepDetails(details);
    }
    job.setStatus(JobStatus.FAILED);
    job.setErrorDetails(error);
    job.setCompletedAt(Instant.now());
    persist(job);
    log.warn(
        "job.failed jobId={} step={} code={} err={}",
        job.getId(),
        error.getStep(),
        error.getErrorCode(),
        error.getError());
  }

  public void completed(ProcessingJob job) {
    job.setStatus(JobStatus.COMPLETED);
    job.setCurrentStep(ProcessingStep.COMPLETED_STEP);
    job.setCurrentStepDisplay(ProcessingStep.COMPLETED_DISPLAY);
    job.setProgressPercentage(100);
    job.setCompletedAt(Instant.now());
    persist(job);
    log.info("job.completed jobId={} docId={}", job.getId(), job.getDocumentId());
  }

  // =====================================================================

  private void persist(ProcessingJob job) {
    repo.save(job);
    broker.publish(snapshot(job));
  }

  private static void validateId(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id must not be null/blank");
    }
  }
}
