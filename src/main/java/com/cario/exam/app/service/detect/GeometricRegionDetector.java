package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Finds generic text regions from pixels alone. Used when structural detection finds no question
 * groups on a page.
 *
 * <p>The three strategies all start from an Otsu ink mask:
 *
 * <ul>
 *   <li>line closing with a wide, short kernel
 *   <li>block closing with a larger kernel after a light blur
 *   <li>edges dilated into blobs
 * </ul>
 *
 * <p>The pixel work runs through OpenCV when its natives load and through {@link
 * JdkCandidateExtractor} otherwise. Candidates go through {@link RegionMerger}.
 */
@Log4j2
public class GeometricRegionDetector {

  static final double LINE_CONFIDENCE = 0.7;
  static final double BLOCK_CONFIDENCE = 0.8;
  static final double EDGE_CONFIDENCE = 0.6;

  private final RegionMerger merger;
  private final CandidateExtractor extractor;
  private final RegionClassifier classifier = new RegionClassifier();

  public GeometricRegionDetector(RegionMerger merger) {
    this(merger, List.of(new OpenCvCandidateExtractor(), new JdkCandidateExtractor()));
  }

  GeometricRegionDetector(RegionMerger merger, List<CandidateExtractor> extractors) {
    this.merger = Objects.requireNonNull(merger, "merger must not be null");
    this.extractor =
        extractors.stream()
            .filter(CandidateExtractor::isAvailable)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("no candidate extractor available"));
    log.info("detect.geometric.init extractor={}", extractor.id());
  }

  String extractorId() {
    return extractor.id();
  }

  public List<Region> detect(BufferedImage page, int pageNumber) {
    long t0 = System.nanoTime();
    BufferedImage gray = ImageUtils.toGray(page);
    int w = gray.getWidth();
    int h = gray.getHeight();
    boolean[] ink = extractor.inkMask(gray);

    List<Region> candidates = new ArrayList<>();
    for (BoundingBox b : extractor.lineBoxes(gray)) {
      long area = b.area();
      if (area >= 500 && area <= 200_000 && b.getHeight() >= 10 && b.getHeight() <= 500) {
        candidates.add(candidate(b, pageNumber, LINE_CONFIDENCE, "morphological"));
      }
    }
    for (BoundingBox b : extractor.blockBoxes(gray)) {
      if (b.area() >= 1500 && b.getHeight() >= 30) {
        candidates.add(candidate(b, pageNumber, BLOCK_CONFIDENCE, "block"));
      }
    }
    for (BoundingBox b : extractor.edgeBoxes(gray)) {
      if (b.getWidth() > 50 && b.getHeight() > 20) {
        candidates.add(candidate(b, pageNumber, EDGE_CONFIDENCE, "contour"));
      }
    }

    List<Region> merged = merger.merge(candidates);
    List<Region> typed = new ArrayList<>(merged.size());
    for (Region r : merged) {
      BoundingBox clipped = clip(r.box(), w, h);
      if (clipped == null) {
        continue;
      }
      typed.add(
          r.withBox(clipped).toBuilder().regionType(classifier.classify(ink, w, clipped)).build());
    }
    log.debug(
        "detect.geometric page={} extractor={} candidates={} regions={} durationMs={}",
        pageNumber,
        extractor.id(),
        candidates.size(),
        typed.size(),
        (System.nanoTime() - t0) / 1_000_000);
    return typed;
  }

  private static Region candidate(BoundingBox b, int page, double confidence, String method) {
    return Region.of(b, page, RegionType.UNKNOWN, confidence, "")
        .withMetadata(Map.of("detection_method", method));
  }

  private static BoundingBox clip(BoundingBox b, int w, int h) {
    int x = Math.min(b.getX(), w - 1);
    int y = Math.min(b.getY(), h - 1);
    int x2 = Math.min(b.x2(), w);
    int y2 = Math.min(b.y2(), h);
    if (x2 <= x || y2 <= y) {
      return null;
    }
    return BoundingBox.fromCorners(x, y, x2, y2);
  }
}
