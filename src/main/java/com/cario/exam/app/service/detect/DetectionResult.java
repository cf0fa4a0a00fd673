package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.QuestionGroup;
import com.cario.exam.app.model.Region;
import java.util.List;
import lombok.Value;

/** Regions found on one page and the tier that produced the primary set. */
@Value
public class DetectionResult {

  public enum Tier {
    STRUCTURAL,
    GEOMETRIC
  }

  Tier tier;

  /** Empty when the geometric tier was used. */
  List<QuestionGroup> groups;

  /** Group regions first, then geometric regions that overlap no group. */
  List<Region> regions;
}
