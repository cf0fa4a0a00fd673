package com.cario.exam.app.service.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionType;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class RegionMergerTest {

  private final RegionMerger merger = new RegionMerger(0.5, 50);

  private static Region region(int x, int y, int w, int h, double confidence) {
    return Region.of(BoundingBox.of(x, y, w, h), 1, RegionType.PASSAGE, confidence, "");
  }

  private static List<BoundingBox> boxes(List<Region> regions) {
    return regions.stream().map(Region::box).collect(Collectors.toList());
  }

  @Test
  void keepsTheLargerOfTwoOverlappingRegions() {
    Region big = region(0, 0, 400, 200, 0.8);
    Region inner = region(10, 10, 100, 50, 0.7);

    List<Region> out = merger.dropOverlaps(List.of(inner, big));

    assertEquals(1, out.size());
    assertEquals(big.box(), out.get(0).box());
  }

  @Test
  void fusesVerticallyAdjacentRegionsInTheSameColumn() {
    Region top = region(100, 100, 300, 40, 0.8);
    Region below = region(120, 170, 280, 40, 0.6);

    List<Region> out = merger.merge(List.of(below, top));

    assertEquals(1, out.size());
    Region fused = out.get(0);
    assertEquals(BoundingBox.of(100, 100, 300, 110), fused.box());
    assertEquals(0.7, fused.getConfidence(), 1e-9);
    assertEquals(2, fused.metadataValue("merged_count"));
  }

  @Test
  void leavesDistantRegionsApart() {
    Region a = region(100, 100, 300, 40, 0.8);
    Region b = region(100, 400, 300, 40, 0.8);
    Region c = region(600, 100, 100, 40, 0.8);

    List<Region> out = merger.merge(List.of(a, b, c));

    assertEquals(3, out.size());
  }

  @Test
  void mergingTwiceChangesNothing() {
    List<Region> input =
        List.of(
            region(0, 0, 200, 30, 0.7),
            region(0, 60, 200, 30, 0.9),
            region(10, 5, 50, 10, 0.6),
            region(0, 120, 200, 30, 0.5),
            region(400, 0, 100, 300, 0.8),
            region(390, 320, 100, 30, 0.8));

    List<Region> once = merger.merge(input);
    List<Region> twice = merger.merge(once);

    assertEquals(boxes(once), boxes(twice));
  }
}
