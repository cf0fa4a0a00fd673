package com.cario.exam.app.service.stats;

import com.cario.exam.app.model.ConfidenceLevel;
import com.cario.exam.app.model.DocumentStatistics;
import com.cario.exam.app.model.ExtractedQuestion;
import java.util.List;

/** Document roll-up computed only from the questions' current scores. */
public class StatisticsAggregator {

  public DocumentStatistics aggregate(List<ExtractedQuestion> questions) {
    if (questions == null || questions.isEmpty()) {
      return DocumentStatistics.empty();
    }
    int high = 0;
    int medium = 0;
    int low = 0;
    double sum = 0.0;
    for (ExtractedQuestion q : questions) {
      ConfidenceLevel level = ConfidenceLevel.fromScore(q.getConfidenceScore());
      switch (level) {
        case HIGH:
          high++;
          break;
        case MEDIUM:
          medium++;
          break;
        default:
          low++;
      }
      sum += q.getConfidenceScore();
    }
    double average = Math.round(sum / questions.size() * 100.0) / 100.0;
    return DocumentStatistics.builder()
        .total(questions.size())
        .high(high)
        .medium(medium)
        .low(low)
        .averageConfidence(average)
        .needsReviewCount(low)
        .build();
  }
}
