package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.model.ErrorDetails;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.service.diagnostics.ErrorRecorder;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

/** Hands each submitted document to its own worker, which drives it through every step. */
@Log4j2
public class JobRunner {

  public static final String DOC_PENDING = "PENDING";

  private final ProcessingOrchestrator orchestrator;
  private final ProcessingJobService jobs;
  private final DocumentStore documents;
  private final TaskExecutor jobExecutor;
  private final ErrorRecorder errors;

  public JobRunner(
      ProcessingOrchestrator orchestrator,
      ProcessingJobService jobs,
      DocumentStore documents,
      TaskExecutor jobExecutor,
      ErrorRecorder errors) {
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
    this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
    this.documents = Objects.requireNonNull(documents, "documents must not be null");
    this.jobExecutor = Objects.requireNonNull(jobExecutor, "jobExecutor must not be null");
    this.errors = Objects.requireNonNull(errors, "errors must not be null");
  }

  /**
   * Stores the document, creates a pending job and queues it.
   *
   * @return a copy of the job as created; follow progress through {@link ProcessingJobService}
   * @throws TaskRejectedException when the worker pool is saturated; the job is marked failed
   */
  public ProcessingJob submit(ExamDocument document) {
    Objects.requireNonNull(document, "document must not be null");
    if (document.getId() == null || document.getId().isBlank()) {
      document.setId(UUID.randomUUID().toString());
    }
    document.setStatus(DOC_PENDING);
    documents.save(document);

    ProcessingJob job = jobs.create(document.getId());
    ProcessingJob view = job.toBuilder().build();
    try {
      jobExecutor.execute(() -> runSafely(job, document));
    } catch (TaskRejectedException e) {
      log.warn("job.rejected jobId={} docId={}", job.getId(), document.getId());
      markFailed(job, e);
      throw e;
    }
    log.info(
        "job.submitted jobId={} docId={} filename={}",
        job.getId(),
        document.getId(),
        document.getFilename());
    return view;
  }

  private void runSafely(ProcessingJob job, ExamDocument document) {
    try {
      orchestrator.run(job, document);
    } catch (RuntimeException e) {
      log.error("job.crashed jobId={} docId={}", job.getId(), document.getId(), e);
      if (!job.isTerminal()) {
        markFailed(job, e);
      }
    }
  }

  private void markFailed(ProcessingJob job, RuntimeException cause) {
    ErrorDetails details =
        errors.record(cause, job.getCurrentStep(), Map.of("job_id", job.getId()));
    jobs.failed(job, null, details);
  }
}
