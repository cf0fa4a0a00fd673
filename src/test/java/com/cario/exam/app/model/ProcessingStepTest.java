package com.cario.exam.app.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProcessingStepTest {

  @Test
  void weightsAddUpToOneHundred() {
    assertEquals(100, ProcessingStep.totalWeight());
    assertEquals(100, ProcessingStep.FINALIZATION.cumulativeWeight());
  }

  @Test
  void cumulativeWeightGrowsWithEveryStep() {
    int previous = 0;
    for (ProcessingStep step : ProcessingStep.values()) {
      assertTrue(step.weight() > 0);
      assertEquals(previous + step.weight(), step.cumulativeWeight());
      previous = step.cumulativeWeight();
    }
    assertEquals(45, ProcessingStep.OCR_PROCESSING.cumulativeWeight());
  }

  @Test
  void scoredQuestionDerivesLevelAndReviewFlag() {
    ExtractedQuestion q = ExtractedQuestion.builder().build();

    q.scored(80.0);
    assertEquals(ConfidenceLevel.HIGH, q.getConfidenceLevel());
    assertFalse(q.isRequiresReview());

    q.scored(59.9);
    assertEquals(ConfidenceLevel.LOW, q.getConfidenceLevel());
    assertTrue(q.isRequiresReview());

    q.scored(140);
    assertEquals(100.0, q.getConfidenceScore());
  }
}
