package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.BoundingBox;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Raw boxes for the three geometric strategies on one gray page. Filtering by size, merging and
 * typing happen in {@link GeometricRegionDetector}; implementations only differ in the imaging
 * library doing the pixel work.
 */
interface CandidateExtractor {

  String id();

  boolean isAvailable();

  /** Otsu ink mask (dark pixels true), row major. */
  boolean[] inkMask(BufferedImage gray);

  /** Ink closed with a 15x3 kernel, then its components. */
  List<BoundingBox> lineBoxes(BufferedImage gray);

  /** Light blur, Otsu ink closed with a 25x5 kernel, then its components. */
  List<BoundingBox> blockBoxes(BufferedImage gray);

  /** Edges dilated twice with a 3x3 kernel, then their outlines. */
  List<BoundingBox> edgeBoxes(BufferedImage gray);
}
