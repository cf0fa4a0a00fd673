package com.cario.exam.app.repository;

import com.cario.exam.app.model.ProcessingJob;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

/** Job state kept in memory; used when no DynamoDB-backed profile is active. */
@Repository
@Profile("!local & !production")
public class InMemoryProcessingJobRepository implements ProcessingJobRepository {

  private final Map<String, ProcessingJob> jobs = new ConcurrentHashMap<>();

  @Override
  public void save(ProcessingJob job) {
    Objects.requireNonNull(job, "job must not be null");
    jobs.put(job.getId(), job.toBuilder().build());
  }

  @Override
  public Optional<ProcessingJob> findById(String jobId) {
    return Optional.ofNullable(jobs.get(jobId)).map(j -> j.toBuilder().build());
  }

  @Override
  public Optional<ProcessingJob> findLatestByDocumentId(String documentId) {
    return jobs.values().stream()
        .filter(j -> Objects.equals(j.getDocumentId(), documentId))
        .max(
            Comparator.comparing(
                ProcessingJob::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
        .map(j -> j.toBuilder().build());
  }
}
