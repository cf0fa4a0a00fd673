package com.cario.exam.app.service.correct;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.CorrectionType;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionType;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class RegionCorrectorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final RegionCorrector corrector =
      new RegionCorrector(Clock.fixed(NOW, ZoneOffset.UTC));

  private final Region region =
      Region.of(BoundingBox.of(100, 100, 200, 100), 1, RegionType.QUESTION, 0.8, "body");

  @Test
  void splitHalvesLoseConfidenceAndCoverTheOriginal() {
    CorrectionResult result = corrector.split("doc", region, 150, SplitAxis.HORIZONTAL, "ann");

    assertEquals(2, result.getRegions().size());
    Region top = result.getRegions().get(0);
    Region bottom = result.getRegions().get(1);
    assertEquals(BoundingBox.of(100, 100, 200, 50), top.box());
    assertEquals(BoundingBox.of(100, 150, 200, 50), bottom.box());
    assertTrue(top.getConfidence() <= region.getConfidence());
    assertEquals(0.72, bottom.getConfidence(), 1e-9);
    assertEquals("body", top.getText());
    assertEquals(region.getId(), top.metadataValue("split_from"));
    assertEquals(List.of(region.getId()), result.getReplacedIds());
    assertEquals(CorrectionType.SPLIT, result.getCorrection().getCorrectionType());
    assertEquals(NOW, result.getCorrection().getTimestamp());
  }

  @Test
  void splitOutsideTheRegionIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> corrector.split("doc", region, 100, SplitAxis.VERTICAL, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> corrector.split("doc", region, 200, SplitAxis.HORIZONTAL, null));
  }

  @Test
  void mergeTakesTheUnionAndAveragesConfidence() {
    Region other =
        Region.of(BoundingBox.of(100, 250, 200, 50), 1, RegionType.QUESTION, 0.6, "more");

    CorrectionResult result = corrector.merge("doc", List.of(region, other), "ann");

    Region merged = result.single();
    assertEquals(BoundingBox.of(100, 100, 200, 200), merged.box());
    assertEquals(0.7, merged.getConfidence(), 1e-9);
    assertEquals("body\nmore", merged.getText());
    assertEquals(2, merged.metadataValue("merge_count"));
    assertEquals(List.of(region.getId(), other.getId()), result.getReplacedIds());
  }

  @Test
  void mergeAcrossPagesIsRejected() {
    Region elsewhere =
        Region.of(BoundingBox.of(0, 0, 10, 10), 2, RegionType.QUESTION, 0.6, "");

    assertThrows(
        IllegalArgumentException.class,
        () -> corrector.merge("doc", List.of(region, elsewhere), "ann"));
    assertThrows(
        IllegalArgumentException.class, () -> corrector.merge("doc", List.of(region), "ann"));
  }

  @Test
  void moveClampsAtTheOriginAndCountsCorrections() {
    Region moved = corrector.move("doc", region, -500, 20, "ann").single();
    Region movedAgain = corrector.move("doc", moved, 5, 0, "ann").single();

    assertEquals(BoundingBox.of(0, 120, 200, 100), moved.box());
    assertEquals(region.getId(), moved.getId());
    assertEquals(2, movedAgain.metadataValue("correction_count"));
    assertEquals(true, movedAgain.metadataValue("manually_corrected"));
  }

  @Test
  void createdRegionsAreFullyConfidentAndUnsignedActorsAreAnonymous() {
    CorrectionResult result =
        corrector.create("doc", BoundingBox.of(5, 5, 50, 50), 3, RegionType.DIAGRAM, " ");

    assertEquals(1.0, result.single().getConfidence(), 1e-9);
    assertEquals(3, result.single().getPageNumber());
    assertTrue(result.getReplacedIds().isEmpty());
    assertNull(result.getCorrection().getOriginalCoordinates());
    assertEquals("anonymous", result.getCorrection().getActor());
  }

  @Test
  void retypeAndDeleteAreRecorded() {
    CorrectionResult retyped = corrector.retype("doc", region, RegionType.PASSAGE, "ann");
    CorrectionResult deleted = corrector.delete("doc", region, "ann");

    assertEquals(RegionType.PASSAGE, retyped.single().getRegionType());
    assertEquals("question -> passage", retyped.getCorrection().getNotes());
    assertTrue(deleted.getRegions().isEmpty());
    assertNull(deleted.getCorrection().getCorrectedCoordinates());
  }
}
