package com.cario.exam.app.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class RegionTest {

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Region.builder().x(0).y(0).width(0).height(10).pageNumber(1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> Region.builder().x(0).y(0).width(10).height(-1).pageNumber(1).build());
  }

  @Test
  void rejectsNegativeOriginAndBadPage() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Region.builder().x(-1).y(0).width(5).height(5).pageNumber(1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> Region.builder().x(0).y(0).width(5).height(5).pageNumber(0).build());
  }

  @Test
  void rejectsConfidenceOutsideUnitRange() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Region.of(BoundingBox.of(0, 0, 5, 5), 1, RegionType.QUESTION, 1.01, ""));
    assertThrows(
        IllegalArgumentException.class,
        () -> Region.of(BoundingBox.of(0, 0, 5, 5), 1, RegionType.QUESTION, Double.NaN, ""));
  }

  @Test
  void fillsDefaults() {
    Region r = Region.builder().x(1).y(2).width(3).height(4).pageNumber(1).build();
    assertNotNull(r.getId());
    assertEquals(RegionType.UNKNOWN, r.getRegionType());
    assertEquals("", r.getText());
    assertTrue(r.getMetadata().isEmpty());
    assertEquals(4, r.getX2());
    assertEquals(6, r.getY2());
    assertEquals(12, r.getArea());
  }

  @Test
  void copiesKeepIdAndMergeMetadata() {
    Region r =
        Region.of(BoundingBox.of(10, 10, 20, 20), 2, RegionType.QUESTION, 0.7, "Q")
            .withMetadata(Map.of("a", 1));
    Region moved = r.withBox(BoundingBox.of(0, 0, 5, 5)).withMetadata(Map.of("b", 2));

    assertEquals(r.getId(), moved.getId());
    assertEquals(1, moved.metadataValue("a"));
    assertEquals(2, moved.metadataValue("b"));
    assertEquals(10, r.getX());
    assertThrows(UnsupportedOperationException.class, () -> r.getMetadata().put("c", 3));
  }

  @Test
  void regionTypeParsesWireValues() {
    assertEquals(RegionType.ANSWER_OPTIONS, RegionType.fromValue("answer_options"));
    assertEquals(RegionType.QUESTION_GROUP, RegionType.fromValue(" QUESTION_GROUP "));
    assertThrows(IllegalArgumentException.class, () -> RegionType.fromValue("footnote"));
  }
}
