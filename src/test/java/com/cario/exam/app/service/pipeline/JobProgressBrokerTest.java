package com.cario.exam.app.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.cario.exam.app.model.JobStatus;
import com.cario.exam.app.model.JobStatusSnapshot;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobProgressBrokerTest {

  private final JobProgressBroker broker = new JobProgressBroker();

  private static JobStatusSnapshot snapshot(JobStatus status, int progress) {
    return JobStatusSnapshot.builder()
        .jobId("job-1")
        .documentId("doc-1")
        .status(status)
        .progressPercentage(progress)
        .build();
  }

  @Test
  void deliversToSubscribersOfThatJobOnly() {
    List<Integer> seen = new ArrayList<>();
    List<Integer> other = new ArrayList<>();
    broker.subscribe("job-1", s -> seen.add(s.getProgressPercentage()));
    broker.subscribe("job-2", s -> other.add(s.getProgressPercentage()));

    broker.publish(snapshot(JobStatus.IN_PROGRESS, 15));
    broker.publish(snapshot(JobStatus.IN_PROGRESS, 45));

    assertEquals(List.of(15, 45), seen);
    assertEquals(List.of(), other);
  }

  @Test
  void throwingSubscriberIsDroppedWithoutAffectingOthers() {
    List<Integer> seen = new ArrayList<>();
    broker.subscribe(
        "job-1",
        s -> {
          throw new IllegalStateException("client went away");
        });
    broker.subscribe("job-1", s -> seen.add(s.getProgressPercentage()));

    broker.publish(snapshot(JobStatus.IN_PROGRESS, 5));

    assertEquals(List.of(5), seen);
    assertEquals(1, broker.subscriberCount("job-1"));
  }

  @Test
  void closedSubscriptionsAndTerminalSnapshotsEndDelivery() {
    List<Integer> seen = new ArrayList<>();
    JobProgressBroker.Subscription first = broker.subscribe("job-1", s -> seen.add(-1));
    broker.subscribe("job-1", s -> seen.add(s.getProgressPercentage()));
    first.close();

    broker.publish(snapshot(JobStatus.COMPLETED, 100));
    broker.publish(snapshot(JobStatus.COMPLETED, 100));

    assertEquals(List.of(100), seen);
    assertEquals(0, broker.subscriberCount("job-1"));
  }
}
