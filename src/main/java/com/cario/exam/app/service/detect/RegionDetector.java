package com.cario.exam.app.service.detect;

import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.QuestionGroup;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.service.layout.LayoutAnalyzer;
import com.cario.exam.app.service.layout.PageLayout;
import com.cario.exam.app.service.ocr.OcrEnsemble;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Page-level region detection.
 *
 * <p>The structural tier runs first. When it finds question groups, the geometric regions that do
 * not substantially overlap any group are added next to them so passages and diagrams are kept.
 * When it finds none, or no OCR text is available, the geometric regions are used alone.
 */
@Log4j2
public class RegionDetector {

  private final GeometricRegionDetector geometric;
  private final StructuralRegionDetector structural;
  private final LayoutAnalyzer layoutAnalyzer;
  private final OcrEnsemble ensemble;
  private final double overlapRatio;

  public RegionDetector(
      GeometricRegionDetector geometric,
      StructuralRegionDetector structural,
      LayoutAnalyzer layoutAnalyzer,
      OcrEnsemble ensemble,
      double overlapRatio) {
    this.geometric = Objects.requireNonNull(geometric, "geometric must not be null");
    this.structural = Objects.requireNonNull(structural, "structural must not be null");
    this.layoutAnalyzer = Objects.requireNonNull(layoutAnalyzer, "layoutAnalyzer must not be null");
    this.ensemble = ensemble;
    this.overlapRatio = overlapRatio;
  }

  /** Detects regions, running OCR on {@code image} to build the layout. */
  public DetectionResult detect(BufferedImage image, int pageNumber) {
    PageLayout layout = null;
    if (ensemble != null) {
      try {
        layout = layoutAnalyzer.analyze(pageNumber, ensemble.extract(image).getWords());
      } catch (OcrProcessingException e) {
        log.warn("detect.ocr.unavailable page={} msg={}", pageNumber, e.getMessage());
      }
    }
    return detect(image, pageNumber, layout);
  }

  /**
   * Detects regions using an existing layout. A {@code null} layout skips the structural tier.
   */
  public DetectionResult detect(BufferedImage image, int pageNumber, PageLayout layout) {
    List<Region> tierA = geometric.detect(image, pageNumber);
    List<QuestionGroup> groups = layout == null ? List.of() : structural.detect(layout);
    if (groups.isEmpty()) {
      log.info("detect.page page={} tier=geometric regions={}", pageNumber, tierA.size());
      return new DetectionResult(DetectionResult.Tier.GEOMETRIC, List.of(), tierA);
    }

    List<Region> regions =
        groups.stream()
            .map(QuestionGroup::getRegion)
            .collect(Collectors.toCollection(ArrayList::new));
    int supplemented = 0;
    for (Region r : tierA) {
      if (!coveredByGroup(r, groups)) {
        regions.add(r);
        supplemented++;
      }
    }
    log.info(
        "detect.page page={} tier=structural groups={} supplemented={}",
        pageNumber,
        groups.size(),
        supplemented);
    return new DetectionResult(DetectionResult.Tier.STRUCTURAL, List.copyOf(groups), regions);
  }

  private boolean coveredByGroup(Region r, List<QuestionGroup> groups) {
    for (QuestionGroup g : groups) {
      long inter = r.box().intersectionArea(g.getRegion().box());
      if ((double) inter / r.getArea() >= overlapRatio) {
        return true;
      }
    }
    return false;
  }
}
