package com.cario.exam.app.api;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/** Region as shown to reviewers: box, type, a short text preview and a review hint. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegionView {

  static final int PREVIEW_LENGTH = 100;
  static final double REVIEW_THRESHOLD = 0.8;

  String id;
  RegionType type;
  BoundingBox coordinates;
  double confidence;
  String textPreview;
  boolean needsReview;
  int pageNumber;

  public static RegionView of(Region region) {
    String text = region.getText();
    return RegionView.builder()
        .id(region.getId())
        .type(region.getRegionType())
        .coordinates(region.box())
        .confidence(region.getConfidence())
        .textPreview(text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text)
        .needsReview(region.getConfidence() < REVIEW_THRESHOLD)
        .pageNumber(region.getPageNumber())
        .build();
  }

  public static List<RegionView> of(List<Region> regions) {
    return regions.stream().map(RegionView::of).collect(Collectors.toList());
  }
}
