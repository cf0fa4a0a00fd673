package com.cario.exam.app.repository;

import com.cario.exam.app.model.ProcessingJob;
import java.util.Optional;

/** Persistence for job state. Saves are whole-record upserts. */
public interface ProcessingJobRepository {

  void save(ProcessingJob job);

  Optional<ProcessingJob> findById(String jobId);

  /** Most recently created job for the document, if any. */
  Optional<ProcessingJob> findLatestByDocumentId(String documentId);
}
