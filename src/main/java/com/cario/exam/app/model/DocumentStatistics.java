package com.cario.exam.app.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/** Per-document roll-up of question confidence tiers. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DocumentStatistics {

  int total;
  int high;
  int medium;
  int low;

  /** 0-100, rounded to two decimals; 0 when there are no questions. */
  double averageConfidence;

  int needsReviewCount;

  public static DocumentStatistics empty() {
    return DocumentStatistics.builder().build();
  }
}
