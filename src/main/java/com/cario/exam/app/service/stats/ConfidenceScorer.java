package com.cario.exam.app.service.stats;

import com.cario.exam.app.model.Region;

/**
 * Question score on the 0-100 scale: a weighted mix of how sure detection was about the region
 * (0-1, scaled up) and the mean OCR confidence of its text (already 0-100).
 */
public class ConfidenceScorer {

  private final double structureWeight;

  public ConfidenceScorer(double structureWeight) {
    if (structureWeight < 0.0 || structureWeight > 1.0) {
      throw new IllegalArgumentException("structureWeight must be within [0,1]");
    }
    this.structureWeight = structureWeight;
  }

  public double score(Region region, double ocrConfidence) {
    return score(region.getConfidence(), ocrConfidence);
  }

  public double score(double regionConfidence, double ocrConfidence) {
    double raw =
        structureWeight * regionConfidence * 100.0 + (1.0 - structureWeight) * ocrConfidence;
    return Math.max(0.0, Math.min(100.0, raw));
  }
}
