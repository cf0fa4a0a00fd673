package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Audit entry for one manual edit of a region. Entries are appended, never changed. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegionCorrection {

  String id;
  String documentId;
  String regionId;
  CorrectionType correctionType;

  /** Null for {@link CorrectionType#CREATE}. */
  BoundingBox originalCoordinates;

  /** Null for {@link CorrectionType#DELETE}. */
  BoundingBox correctedCoordinates;

  String actor;
  Instant timestamp;
  Double confidenceBefore;
  Double confidenceAfter;
  String notes;
}
