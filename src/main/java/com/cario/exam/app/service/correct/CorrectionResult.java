package com.cario.exam.app.service.correct;

import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionCorrection;
import java.util.List;
import lombok.Value;

/** Regions produced by one manual edit and the audit entry describing it. */
@Value
public class CorrectionResult {

  /** New regions; empty for a delete. */
  List<Region> regions;

  /** Ids of the stored regions this edit replaces or removes. */
  List<String> replacedIds;

  RegionCorrection correction;

  public Region single() {
    if (regions.size() != 1) {
      throw new IllegalStateException("expected one region, got " + regions.size());
    }
    return regions.get(0);
  }
}
