package com.cario.exam.app.repository;

import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ExtractedQuestion;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Repository;

@Log4j2
@Repository
public class InMemoryDocumentStore implements DocumentStore {

  private final Map<String, ExamDocument> documents = new ConcurrentHashMap<>();
  private final Map<String, List<ExtractedQuestion>> questions = new ConcurrentHashMap<>();

  @Override
  public ExamDocument save(ExamDocument document) {
    Objects.requireNonNull(document, "document must not be null");
    Objects.requireNonNull(document.getId(), "document id must not be null");
    if (document.getCreatedAt() == null) {
      document.setCreatedAt(Instant.now());
    }
    document.setUpdatedAt(Instant.now());
    documents.put(document.getId(), document);
    log.debug("docstore.save docId={} status={}", document.getId(), document.getStatus());
    return document;
  }

  @Override
  public Optional<ExamDocument> findById(String documentId) {
    return documentId == null ? Optional.empty() : Optional.ofNullable(documents.get(documentId));
  }

  @Override
  public void saveQuestions(String documentId, List<ExtractedQuestion> list) {
    questions.put(documentId, List.copyOf(list));
    log.debug("docstore.questions docId={} count={}", documentId, list.size());
  }

  @Override
  public List<ExtractedQuestion> findQuestions(String documentId) {
    return questions.getOrDefault(documentId, List.of());
  }
}
