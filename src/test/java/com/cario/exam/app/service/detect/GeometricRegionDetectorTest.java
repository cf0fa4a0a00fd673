package com.cario.exam.app.service.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.cario.exam.app.TestImages;
import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.util.OpenCv;
import java.awt.image.BufferedImage;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeometricRegionDetectorTest {

  private static GeometricRegionDetector jdk() {
    return new GeometricRegionDetector(
        new RegionMerger(0.5, 50), List.of(new JdkCandidateExtractor()));
  }

  private static GeometricRegionDetector openCv() {
    assumeTrue(OpenCv.isAvailable(), "OpenCV natives not loadable here");
    return new GeometricRegionDetector(
        new RegionMerger(0.5, 50), List.of(new OpenCvCandidateExtractor()));
  }

  private static void assertTwoBlocks(GeometricRegionDetector detector) {
    BufferedImage page =
        TestImages.withBlocks(600, 600, new int[] {50, 50, 300, 40}, new int[] {50, 400, 300, 40});

    List<Region> regions = detector.detect(page, 3);

    assertEquals(2, regions.size());
    BoundingBox first = BoundingBox.of(50, 50, 300, 40);
    BoundingBox second = BoundingBox.of(50, 400, 300, 40);
    for (Region r : regions) {
      assertEquals(3, r.getPageNumber());
      assertTrue(r.getX() >= 0 && r.getY() >= 0);
      assertTrue(r.getX2() <= 600 && r.getY2() <= 600);
      assertTrue(r.getConfidence() >= 0.0 && r.getConfidence() <= 1.0);
    }
    assertTrue(regions.get(0).box().intersectionArea(first) > 0);
    assertTrue(regions.get(1).box().intersectionArea(second) > 0);
  }

  @Test
  void blankPageHasNoRegions() {
    assertTrue(jdk().detect(TestImages.blank(400, 400), 1).isEmpty());
  }

  @Test
  void findsSeparatedBlocksInsideThePage() {
    assertTwoBlocks(jdk());
  }

  @Test
  void openCvFindsNoRegionsOnABlankPage() {
    assertTrue(openCv().detect(TestImages.blank(400, 400), 1).isEmpty());
  }

  @Test
  void openCvFindsSeparatedBlocksInsideThePage() {
    assertTwoBlocks(openCv());
  }

  @Test
  void prefersOpenCvWhenItLoadsAndFallsBackOtherwise() {
    GeometricRegionDetector standard = new GeometricRegionDetector(new RegionMerger(0.5, 50));

    assertEquals(OpenCv.isAvailable() ? "opencv" : "jdk", standard.extractorId());
  }

  @Test
  void needsAtLeastOneUsableExtractor() {
    CandidateExtractor missing =
        new JdkCandidateExtractor() {
          @Override
          public boolean isAvailable() {
            return false;
          }
        };

    assertThrows(
        IllegalArgumentException.class,
        () -> new GeometricRegionDetector(new RegionMerger(0.5, 50), List.of(missing)));
  }
}
