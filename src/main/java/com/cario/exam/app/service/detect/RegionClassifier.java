package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.RegionType;

/**
 * Coarse content type for geometric regions, from the ink mask alone. Tables show at least two
 * long horizontal and two long vertical rules; diagrams are dense; passages have text-like density
 * and at least two lines of height.
 */
class RegionClassifier {

  private static final double RULE_FRACTION = 0.8;
  private static final double DIAGRAM_DENSITY = 0.35;
  private static final double TEXT_MIN_DENSITY = 0.02;
  private static final int PASSAGE_MIN_HEIGHT = 30;

  RegionType classify(boolean[] mask, int maskWidth, BoundingBox box) {
    if (countRules(mask, maskWidth, box, true) >= 2
        && countRules(mask, maskWidth, box, false) >= 2) {
      return RegionType.TABLE;
    }
    double density = BinaryMorphology.density(mask, maskWidth, box);
    if (density > DIAGRAM_DENSITY) {
      return RegionType.DIAGRAM;
    }
    if (density >= TEXT_MIN_DENSITY && box.getHeight() >= PASSAGE_MIN_HEIGHT) {
      return RegionType.PASSAGE;
    }
    return RegionType.UNKNOWN;
  }

  /** Rows (or columns) whose longest ink run spans most of the box. */
  private static int countRules(boolean[] mask, int w, BoundingBox box, boolean horizontal) {
    int outer = horizontal ? box.getHeight() : box.getWidth();
    int inner = horizontal ? box.getWidth() : box.getHeight();
    int needed = (int) Math.ceil(inner * RULE_FRACTION);
    int rules = 0;
    boolean previousWasRule = false;
    for (int i = 0; i < outer; i++) {
      int run = 0;
      int longest = 0;
      for (int j = 0; j < inner; j++) {
        int x = box.getX() + (horizontal ? j : i);
        int y = box.getY() + (horizontal ? i : j);
        if (mask[y * w + x]) {
          run++;
          longest = Math.max(longest, run);
        } else {
          run = 0;
        }
      }
      boolean isRule = longest >= needed;
      // thick rules span several adjacent rows; count each once
      if (isRule && !previousWasRule) {
        rules++;
      }
      previousWasRule = isRule;
    }
    return rules;
  }
}
