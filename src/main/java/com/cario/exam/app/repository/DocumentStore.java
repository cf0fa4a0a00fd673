package com.cario.exam.app.repository;

import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ExtractedQuestion;
import java.util.List;
import java.util.Optional;

/** Documents and the questions extracted from them. */
public interface DocumentStore {

  ExamDocument save(ExamDocument document);

  Optional<ExamDocument> findById(String documentId);

  default boolean exists(String documentId) {
    return findById(documentId).isPresent();
  }

  /** Replaces the document's questions. */
  void saveQuestions(String documentId, List<ExtractedQuestion> questions);

  List<ExtractedQuestion> findQuestions(String documentId);
}
