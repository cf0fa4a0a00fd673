package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.model.JobStatusSnapshot;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;

/**
 * In-memory fan-out of job snapshots to per-job subscribers.
 *
 * <p>Every message is a full snapshot, so a subscriber that sees one twice or late renders the
 * same state. A subscriber that throws is dropped. Subscriptions end by themselves once a terminal
 * snapshot has been delivered.
 */
@Log4j2
public class JobProgressBroker {

  /** Handle returned by {@link #subscribe}; closing it stops delivery. */
  public interface Subscription extends AutoCloseable {
    @Override
    void close();
  }

  private final Map<String, List<Consumer<JobStatusSnapshot>>> subscribers =
      new ConcurrentHashMap<>();

  public Subscription subscribe(String jobId, Consumer<JobStatusSnapshot> listener) {
    Objects.requireNonNull(jobId, "jobId must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    subscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(listener);
    log.debug("broker.subscribe jobId={} subscribers={}", jobId, subscriberCount(jobId));
    return () -> unsubscribe(jobId, listener);
  }

  public void publish(JobStatusSnapshot snapshot) {
    String jobId = snapshot.getJobId();
    List<Consumer<JobStatusSnapshot>> listeners = subscribers.get(jobId);
    if (listeners == null) {
      return;
    }
    for (Consumer<JobStatusSnapshot> l : listeners) {
      try {
        l.accept(snapshot);
      } catch (RuntimeException e) {
        log.warn("broker.deliver.failed jobId={} msg={}", jobId, e.getMessage());
        listeners.remove(l);
      }
    }
    if (snapshot.getStatus() != null && snapshot.getStatus().isTerminal()) {
      subscribers.remove(jobId);
    }
  }

  public int subscriberCount(String jobId) {
    List<Consumer<JobStatusSnapshot>> listeners = subscribers.get(jobId);
    return listeners == null ? 0 : listeners.size();
  }

  private void unsubscribe(String jobId, Consumer<JobStatusSnapshot> listener) {
    subscribers.computeIfPresent(
        jobId,
        (k, list) -> {
          list.remove(listener);
          return list.isEmpty() ? null : list;
        });
  }
}
