package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A parsed question ready for review. {@code confidenceLevel} and {@code requiresReview} always
 * follow {@code confidenceScore}; use {@link #scored(double)} rather than setting them directly.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractedQuestion {

  private String id;
  private String documentId;
  private String regionId;
  private int pageNumber;
  private String questionNumber;
  private String questionText;
  private QuestionType questionType;

  @Builder.Default private List<AnswerOption> options = new ArrayList<>();

  @Builder.Default private List<String> correctAnswers = new ArrayList<>();

  /** 0-100. */
  private double confidenceScore;

  private ConfidenceLevel confidenceLevel;
  private boolean requiresReview;

  /** Sets the score and the level and review flag derived from it. */
  public ExtractedQuestion scored(double score) {
    double clamped = Math.max(0.0, Math.min(100.0, score));
    this.confidenceScore = Math.round(clamped * 100.0) / 100.0;
    this.confidenceLevel = ConfidenceLevel.fromScore(this.confidenceScore);
    this.requiresReview = this.confidenceLevel == ConfidenceLevel.LOW;
    return this;
  }
}
