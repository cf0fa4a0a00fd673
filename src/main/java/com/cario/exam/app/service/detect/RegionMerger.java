package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.Region;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines candidate boxes from the geometric strategies.
 *
 * <p>Two passes, repeated until the region count stops changing:
 *
 * <ol>
 *   <li>Largest first, drop a box whose overlap with a kept box exceeds {@code overlapRatio} of the
 *       smaller box's area.
 *   <li>Top to bottom, fuse boxes that share horizontal extent and sit at most {@code maxGap}
 *       pixels apart vertically. The fused confidence is the mean of its members.
 * </ol>
 *
 * <p>Running to a fixpoint makes {@link #merge(List)} idempotent.
 */
public class RegionMerger {

  private static final int MAX_ROUNDS = 16;

  private final double overlapRatio;
  private final int maxGap;

  public RegionMerger(double overlapRatio, int maxGap) {
    this.overlapRatio = overlapRatio;
    this.maxGap = maxGap;
  }

  public List<Region> merge(List<Region> candidates) {
    List<Region> current = new ArrayList<>(candidates);
    for (int round = 0; round < MAX_ROUNDS; round++) {
      List<Region> next = mergeVertical(dropOverlaps(current));
      boolean stable = next.size() == current.size();
      current = next;
      if (stable) {
        break;
      }
    }
    current.sort(Comparator.comparingInt(Region::getY).thenComparingInt(Region::getX));
    return current;
  }

  List<Region> dropOverlaps(List<Region> regions) {
    List<Region> sorted = new ArrayList<>(regions);
    sorted.sort(Comparator.comparingLong(Region::getArea).reversed());
    List<Region> kept = new ArrayList<>();
    for (Region r : sorted) {
      boolean redundant = false;
      for (Region k : kept) {
        long inter = r.box().intersectionArea(k.box());
        long smaller = Math.min(r.getArea(), k.getArea());
        if (smaller > 0 && (double) inter / smaller > overlapRatio) {
          redundant = true;
          break;
        }
      }
      if (!redundant) {
        kept.add(r);
      }
    }
    return kept;
  }

  List<Region> mergeVertical(List<Region> regions) {
    List<Region> sorted = new ArrayList<>(regions);
    sorted.sort(Comparator.comparingInt(Region::getY).thenComparingInt(Region::getX));
    List<List<Region>> groups = new ArrayList<>();
    for (Region r : sorted) {
      List<Region> target = null;
      for (List<Region> g : groups) {
        if (adjacent(bounds(g), r.box())) {
          target = g;
          break;
        }
      }
      if (target == null) {
        target = new ArrayList<>();
        groups.add(target);
      }
      target.add(r);
    }
    List<Region> out = new ArrayList<>();
    for (List<Region> g : groups) {
      out.add(g.size() == 1 ? g.get(0) : fuse(g));
    }
    return out;
  }

  private boolean adjacent(BoundingBox above, BoundingBox below) {
    int gap = below.getY() - above.y2();
    boolean sharesColumn =
        Math.min(above.x2(), below.x2()) - Math.max(above.getX(), below.getX()) > 0;
    return sharesColumn && gap >= 0 && gap <= maxGap;
  }

  private static BoundingBox bounds(List<Region> group) {
    BoundingBox b = group.get(0).box();
    for (int i = 1; i < group.size(); i++) {
      b = b.union(group.get(i).box());
    }
    return b;
  }

  private static Region fuse(List<Region> group) {
    double conf = group.stream().mapToDouble(Region::getConfidence).average().orElse(0.0);
    Map<String, Object> meta = new LinkedHashMap<>(group.get(0).getMetadata());
    meta.put("merged_count", group.size());
    return Region.of(
            bounds(group),
            group.get(0).getPageNumber(),
            group.get(0).getRegionType(),
            conf,
            group.get(0).getText())
        .withMetadata(meta);
  }
}
