package com.cario.exam.app.service.stats;

import static org.junit.jupiter.api.Assertions.*;

import com.cario.exam.app.model.DocumentStatistics;
import com.cario.exam.app.model.ExtractedQuestion;
import java.util.List;
import org.junit.jupiter.api.Test;

class StatisticsAggregatorTest {

  private final StatisticsAggregator aggregator = new StatisticsAggregator();

  private static ExtractedQuestion scored(double score) {
    return ExtractedQuestion.builder().build().scored(score);
  }

  @Test
  void countsOneQuestionPerTier() {
    DocumentStatistics stats = aggregator.aggregate(List.of(scored(95), scored(70), scored(40)));

    assertEquals(3, stats.getTotal());
    assertEquals(1, stats.getHigh());
    assertEquals(1, stats.getMedium());
    assertEquals(1, stats.getLow());
    assertEquals(1, stats.getNeedsReviewCount());
    assertEquals(68.33, stats.getAverageConfidence());
  }

  @Test
  void emptyInputGivesZeroes() {
    DocumentStatistics stats = aggregator.aggregate(List.of());
    assertEquals(0, stats.getTotal());
    assertEquals(0.0, stats.getAverageConfidence());
  }

  @Test
  void aggregateIsRepeatable() {
    List<ExtractedQuestion> qs = List.of(scored(81), scored(61.5));
    assertEquals(aggregator.aggregate(qs), aggregator.aggregate(qs));
  }

  @Test
  void scorerWeightsRegionAndOcrConfidence() {
    ConfidenceScorer scorer = new ConfidenceScorer(0.6);
    assertEquals(0.6 * 90 + 0.4 * 70, scorer.score(0.9, 70), 1e-9);
    assertEquals(100.0, scorer.score(1.0, 250), 1e-9);
    assertEquals(0.0, scorer.score(0.0, -10), 1e-9);
    assertThrows(IllegalArgumentException.class, () -> new ConfidenceScorer(1.5));
  }
}
