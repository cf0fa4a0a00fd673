package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Summary of the manual corrections made to one document. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CorrectionStats {

  long total;
  Map<String, Long> byType;
  long uniqueActors;

  /** Null when there are no corrections. */
  String mostCommonType;
}
