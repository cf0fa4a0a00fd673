package com.cario.exam.app.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.JobStatus;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.repository.InMemoryDocumentStore;
import com.cario.exam.app.repository.InMemoryProcessingJobRepository;
import com.cario.exam.app.service.diagnostics.ErrorRecorder;
import com.cario.exam.app.service.diagnostics.OperatorNotifier;
import com.cario.exam.app.service.diagnostics.ProcessingLogger;
import com.cario.exam.app.service.pdf.PageSource;
import com.cario.exam.app.service.stats.StatisticsAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ProcessingOrchestratorTest {

  /** Step whose behavior is set per test; counts how often it ran. */
  private static final class FakeStep implements PipelineStep {
    final ProcessingStep step;
    final ErrorCode code;
    Behavior behavior = ctx -> StepOutcome.ok(Map.of("step", "done"));
    final AtomicInteger runs = new AtomicInteger();

    FakeStep(ProcessingStep step, ErrorCode code) {
      this.step = step;
      this.code = code;
    }

    @Override
    public ProcessingStep step() {
      return step;
    }

    @Override
    public ErrorCode errorCode() {
      return code;
    }

    @Override
    public StepOutcome execute(ProcessingContext context) throws Exception {
      runs.incrementAndGet();
      return behavior.run(context);
    }
  }

  @FunctionalInterface
  private interface Behavior {
    StepOutcome run(ProcessingContext context) throws Exception;
  }

  private ThreadPoolTaskExecutor executor;
  private InMemoryDocumentStore documents;
  private ProcessingJobService jobs;
  private ErrorRecorder errors;
  private OperatorNotifier notifier;
  private Map<ProcessingStep, FakeStep> steps;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setThreadNamePrefix("test-step-");
    executor.initialize();
    documents = new InMemoryDocumentStore();
    jobs =
        new ProcessingJobService(
            new InMemoryProcessingJobRepository(),
            new JobProgressBroker(),
            documents,
            new StatisticsAggregator());
    errors = new ErrorRecorder(10);
    notifier = mock(OperatorNotifier.class);
    steps = new EnumMap<>(ProcessingStep.class);
    for (ProcessingStep s : ProcessingStep.values()) {
      steps.put(s, new FakeStep(s, ErrorCode.LAYOUT_ANALYSIS_ERROR));
    }
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  private ProcessingOrchestrator orchestrator(long timeoutSeconds) {
    return new ProcessingOrchestrator(
        new ArrayList<>(steps.values()),
        jobs,
        documents,
        executor,
        timeoutSeconds,
        errors,
        notifier,
        new ProcessingLogger(new ObjectMapper()));
  }

  private ExamDocument document() {
    return documents.save(ExamDocument.builder().id("doc-1").filename("paper.pdf").build());
  }

  @Test
  void runsEveryStepAndCompletes() {
    ExamDocument doc = document();
    ProcessingJob job = orchestrator(5).run(jobs.create(doc.getId()), doc);

    assertEquals(JobStatus.COMPLETED, job.getStatus());
    assertEquals(100, job.getProgressPercentage());
    assertEquals(ProcessingOrchestrator.DOC_COMPLETED, doc.getStatus());
    steps.values().forEach(s -> assertEquals(1, s.runs.get()));
    assertEquals(ProcessingStep.values().length, job.getStepDetails().size());
    verify(notifier, never()).notifyCritical(any(), any());
  }

  @Test
  void failedOutcomeStopsTheRunWithoutPagingAnOperator() {
    steps.get(ProcessingStep.OCR_PROCESSING).behavior =
        ctx -> StepOutcome.failed(new OcrProcessingException("no engine produced text"));
    ExamDocument doc = document();

    ProcessingJob job = orchestrator(5).run(jobs.create(doc.getId()), doc);

    assertEquals(JobStatus.FAILED, job.getStatus());
    assertEquals("OCR_PROCESSING_ERROR", job.getErrorDetails().getErrorCode());
    assertEquals("ocr_processing", job.getErrorDetails().getStep());
    assertEquals(ProcessingStep.DETECT_TEXT_TYPE.cumulativeWeight(), job.getProgressPercentage());
    assertEquals(0, steps.get(ProcessingStep.LAYOUT_ANALYSIS).runs.get());
    assertEquals(ProcessingOrchestrator.DOC_FAILED, doc.getStatus());
    assertEquals("no engine produced text", doc.getErrorMessage());
    assertEquals(1, errors.recent(10).size());
    verify(notifier, never()).notifyCritical(any(), any());
  }

  @Test
  void thrownExceptionTakesTheStepErrorKind() {
    steps.get(ProcessingStep.LAYOUT_ANALYSIS).behavior =
        ctx -> {
          throw new IllegalStateException("columns collapsed");
        };
    ExamDocument doc = document();

    ProcessingJob job = orchestrator(5).run(jobs.create(doc.getId()), doc);

    assertEquals(JobStatus.FAILED, job.getStatus());
    assertEquals("LAYOUT_ANALYSIS_ERROR", job.getErrorDetails().getErrorCode());
    assertEquals("LayoutAnalysisException", job.getErrorDetails().getErrorType());
    assertTrue(job.getErrorDetails().getError().contains("columns collapsed"));
    assertTrue(job.getErrorDetails().getTraceback().length() <= 500);
  }

  @Test
  void slowStepTimesOutAndAlertsTheOperator() {
    steps.get(ProcessingStep.TEXT_EXTRACTION).behavior =
        ctx -> {
          Thread.sleep(10_000);
          return StepOutcome.ok();
        };
    ExamDocument doc = document();

    ProcessingJob job = orchestrator(1).run(jobs.create(doc.getId()), doc);

    assertEquals(JobStatus.FAILED, job.getStatus());
    assertEquals("PROCESSING_TIMEOUT", job.getErrorDetails().getErrorCode());
    assertEquals(0, steps.get(ProcessingStep.QA_DETECTION).runs.get());
    verify(notifier)
        .notifyCritical(
            same(job), argThat(d -> "PROCESSING_TIMEOUT".equals(d.getErrorCode())));
  }

  @Test
  void stepStillRunningAfterItsTimeoutCannotReadClosedPages() throws Exception {
    PageSource source = mock(PageSource.class);
    CountDownLatch sourceClosed = new CountDownLatch(1);
    doAnswer(
            inv -> {
              sourceClosed.countDown();
              return null;
            })
        .when(source)
        .close();
    AtomicReference<Throwable> lateRead = new AtomicReference<>();
    CountDownLatch orphanDone = new CountDownLatch(1);
    steps.get(ProcessingStep.DETECT_TEXT_TYPE).behavior =
        ctx -> {
          ctx.setPages(source);
          return StepOutcome.ok();
        };
    steps.get(ProcessingStep.OCR_PROCESSING).behavior =
        ctx -> {
          PageSource pages = ctx.requirePages();
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException e) {
            // cancelled by the timeout; carry on like a step that ignores interrupts
          }
          try {
            sourceClosed.await(5, TimeUnit.SECONDS);
            pages.page(1);
          } catch (RuntimeException e) {
            lateRead.set(e);
          } finally {
            orphanDone.countDown();
          }
          return StepOutcome.ok();
        };
    ExamDocument doc = document();

    ProcessingJob job = orchestrator(1).run(jobs.create(doc.getId()), doc);

    assertEquals(JobStatus.FAILED, job.getStatus());
    assertEquals("PROCESSING_TIMEOUT", job.getErrorDetails().getErrorCode());
    assertTrue(orphanDone.await(10, TimeUnit.SECONDS));
    assertInstanceOf(ContextClosedException.class, lateRead.get());
    verify(source, never()).page(1);
    assertEquals(JobStatus.FAILED, jobs.get(job.getId()).getStatus());
  }

  @Test
  void nullOutcomeCountsAsSuccess() {
    steps.get(ProcessingStep.FINALIZATION).behavior = ctx -> null;
    ExamDocument doc = document();

    ProcessingJob job = orchestrator(5).run(jobs.create(doc.getId()), doc);

    assertEquals(JobStatus.COMPLETED, job.getStatus());
    assertNull(job.getErrorDetails());
  }

  @Test
  void stepsMustFollowThePipelineOrder() {
    List<PipelineStep> reversed = new ArrayList<>(steps.values());
    Collections.reverse(reversed);

    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ProcessingOrchestrator(
                reversed,
                jobs,
                documents,
                executor,
                5,
                errors,
                notifier,
                new ProcessingLogger(new ObjectMapper())));
  }
}
