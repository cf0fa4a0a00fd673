package com.cario.exam.app.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.exam.app.exception.ResourceNotFoundException;
import com.cario.exam.app.model.ErrorDetails;
import com.cario.exam.app.model.JobStatus;
import com.cario.exam.app.model.JobStatusSnapshot;
import com.cario.exam.app.model.ProcessingJob;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.repository.InMemoryDocumentStore;
import com.cario.exam.app.repository.InMemoryProcessingJobRepository;
import com.cario.exam.app.service.stats.StatisticsAggregator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProcessingJobServiceTest {

  private JobProgressBroker broker;
  private ProcessingJobService service;

  @BeforeEach
  void setUp() {
    broker = new JobProgressBroker();
    service =
        new ProcessingJobService(
            new InMemoryProcessingJobRepository(),
            broker,
            new InMemoryDocumentStore(),
            new StatisticsAggregator());
  }

  @Test
  void progressOnlyRisesAndReachesHundredOnCompletion() {
    ProcessingJob job = service.create("doc-1");
    List<JobStatusSnapshot> seen = new ArrayList<>();
    broker.subscribe(job.getId(), seen::add);

    service.start(job);
    for (ProcessingStep step : ProcessingStep.values()) {
      service.stepStarted(job, step);
      service.stepSucceeded(job, step, 5, "ok");
      assertTrue(job.getProgressPercentage() < 100, "progress before completion");
    }
    assertEquals(95, job.getProgressPercentage());
    service.completed(job);

    int last = 0;
    for (JobStatusSnapshot s : seen) {
      assertTrue(s.getProgressPercentage() >= last);
      if (s.getProgressPercentage() == 100) {
        assertEquals(JobStatus.COMPLETED, s.getStatus());
      }
      last = s.getProgressPercentage();
    }
    JobStatusSnapshot done = seen.get(seen.size() - 1);
    assertEquals(100, done.getProgressPercentage());
    assertEquals(ProcessingStep.COMPLETED_STEP, done.getCurrentStep());
    assertNotNull(done.getResults());
    assertEquals(0L, ((Number) done.getResults().get("total_questions")).longValue());
    assertEquals(0, broker.subscriberCount(job.getId()));
  }

  @Test
  void stepRecordsFollowTheJob() {
    ProcessingJob job = service.create("doc-2");
    service.start(job);
    service.stepStarted(job, ProcessingStep.VALIDATE_UPLOAD);
    service.stepSucceeded(job, ProcessingStep.VALIDATE_UPLOAD, 12, "fine");
    service.stepStarted(job, ProcessingStep.DETECT_TEXT_TYPE);
    service.failed(
        job,
        ProcessingStep.DETECT_TEXT_TYPE,
        ErrorDetails.builder().error("broken pdf").errorCode("TEXT_EXTRACTION_ERROR").build());

    ProcessingJob stored = service.get(job.getId());
    assertEquals(JobStatus.FAILED, stored.getStatus());
    assertEquals(5, stored.getProgressPercentage());
    assertEquals(
        ProcessingJobService.STEP_SUCCEEDED,
        stored.getStepDetails().get("validate_upload").getStatus());
    assertEquals(12L, stored.getStepDetails().get("validate_upload").getDurationMs());
    assertEquals(
        ProcessingJobService.STEP_FAILED,
        stored.getStepDetails().get("detect_text_type").getStatus());
    assertEquals("broken pdf", stored.getStepDetails().get("detect_text_type").getMessage());
    assertNull(service.snapshot(stored).getResults());
    assertNotNull(stored.getCompletedAt());
  }

  @Test
  void unknownAndBlankIdsAreRejected() {
    assertThrows(ResourceNotFoundException.class, () -> service.get("nope"));
    assertThrows(IllegalArgumentException.class, () -> service.get(" "));
    assertThrows(IllegalArgumentException.class, () -> service.create(null));
  }
}
