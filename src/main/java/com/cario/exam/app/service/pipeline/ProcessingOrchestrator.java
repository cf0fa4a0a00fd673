package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.exception.ExtractionException;
import com.cario.exam.app.exception.ProcessingTimeoutException;
import com.cario.exam.app.model.ErrorDetails;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.service.diagnostics.ErrorRecorder;
import com.cario.exam.app.service.diagnostics.OperatorNotifier;
import com.cario.exam.app.service.diagnostics.ProcessingLogger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Drives one job through the fixed step sequence.
 *
 * <p>Each step runs on the step executor under a wall-clock budget. The first step that does not
 * return {@link StepOutcome#ok} ends the run: its error is recorded on the job, the document is
 * marked failed and critical errors are passed to the operator notifier. Nothing is retried.
 */
@Log4j2
public class ProcessingOrchestrator {

  public static final String DOC_PROCESSING = "PROCESSING";
  public static final String DOC_COMPLETED = "COMPLETED";
  public static final String DOC_FAILED = "FAILED";

  private final List<PipelineStep> steps;
  private final ProcessingJobService jobs;
  private final DocumentStore documents;
  private final AsyncTaskExecutor stepExecutor;
  private final long stepTimeoutSeconds;
  private final ErrorRecorder errors;
  private final OperatorNotifier notifier;
  private final ProcessingLogger processingLog;

  public ProcessingOrchestrator(
      List<PipelineStep> steps,
      ProcessingJobService jobs,
      DocumentStore documents,
      AsyncTaskExecutor stepExecutor,
      long stepTimeoutSeconds,
      ErrorRecorder errors,
      OperatorNotifier notifier,
      ProcessingLogger processingLog) {
    List<ProcessingStep> order =
        steps.stream().map(PipelineStep::step).collect(Collectors.toList());
    if (!order.equals(Arrays.asList(ProcessingStep.values()))) {
      throw new IllegalArgumentException("steps out of order: " + order);
    }
    this.steps = List.copyOf(steps);
    this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
    this.documents = Objects.requireNonNull(documents, "documents must not be null");
    this.stepExecutor = Objects.requireNonNull(stepExecutor, "stepExecutor must not be null");
    this.stepTimeoutSeconds = stepTimeoutSeconds;
    this.errors = Objects.requireNonNull(errors, "errors must not be null");
    this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
    this.processingLog = Objects.requireNonNull(processingLog, "processingLog must not be null");
  }

  /** Runs every step for {@code document}; returns the job in its terminal state. */
  public ProcessingJob run(ProcessingJob job, ExamDocument document) {
    long t0 = System.nanoTime();
    Map<String, Object> timings = new LinkedHashMap<>();
    try (ProcessingContext context = new ProcessingContext(job, document)) {
      jobs.start(job);
      document.setStatus(DOC_PROCESSING);
      documents.save(document);

      for (PipelineStep step : steps) {
        long s0 = System.nanoTime();
        StepOutcome outcome = runStep(step, context);
        timings.put(step.step().key() + "_ms", (System.nanoTime() - s0) / 1_000_000);
        if (!outcome.isOk()) {
          fail(context, step.step(), outcome.getError());
          return job;
        }
      }

      document.setStatus(DOC_COMPLETED);
      document.setErrorMessage(null);
      documents.save(document);
      jobs.completed(job);

      timings.put("total_ms", (System.nanoTime() - t0) / 1_000_000);
      timings.put("pages", context.getOcrResults().size());
      timings.put("regions", context.regionCount());
      timings.put("questions", context.getQuestions().size());
      processingLog.performanceMetrics(job.getId(), document.getId(), timings);
      return job;
    }
  }

  private StepOutcome runStep(PipelineStep step, ProcessingContext context) {
    ProcessingJob job = context.getJob();
    String key = step.step().key();
    jobs.stepStarted(job, step.step());
    processingLog.stepStart(job.getId(), context.documentId(), key);

    long t0 = System.nanoTime();
    StepOutcome outcome;
    Future<StepOutcome> future = null;
    try {
      future = stepExecutor.submit(() -> step.execute(context));
      outcome = future.get(stepTimeoutSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      outcome = StepOutcome.failed(new ProcessingTimeoutException(key, stepTimeoutSeconds));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      outcome = StepOutcome.failed(StepErrors.wrap(step.errorCode(), key, cause));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (future != null) {
        future.cancel(true);
      }
      outcome = StepOutcome.failed(StepErrors.wrap(step.errorCode(), key, e));
    } catch (RuntimeException e) {
      // the executor refused the task
      outcome = StepOutcome.failed(StepErrors.wrap(step.errorCode(), key, e));
    }
    if (outcome == null) {
      outcome = StepOutcome.ok();
    }

    long durationMs = (System.nanoTime() - t0) / 1_000_000;
    if (outcome.isOk()) {
      jobs.stepSucceeded(job, step.step(), durationMs, outcome.getSummary().toString());
      processingLog.stepComplete(
          job.getId(), context.documentId(), key, durationMs, outcome.getSummary());
    }
    return outcome;
  }

  private void fail(ProcessingContext context, ProcessingStep step, ExtractionException error) {
    ProcessingJob job = context.getJob();
    ExamDocument document = context.getDocument();
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("job_id", job.getId());
    ctx.put("document_id", document.getId());
    ctx.put("filename", String.valueOf(document.getFilename()));
    ErrorDetails details = errors.record(error, step.key(), ctx);

    jobs.failed(job, step, details);
    document.setStatus(DOC_FAILED);
    document.setErrorMessage(error.getMessage());
    documents.save(document);

    if (error.isCritical()) {
      notifier.notifyCritical(job, details);
    }
  }
}
