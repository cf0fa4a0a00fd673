package com.cario.exam.app.service.correct;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.CorrectionType;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionCorrection;
import com.cario.exam.app.model.RegionType;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Manual region edits. Every operation is pure: it returns new regions and the correction record
 * and leaves the inputs untouched. Persisting both is up to {@link RegionCorrectionService}.
 */
public class RegionCorrector {

  /** Each half of a split keeps this share of the original confidence. */
  static final double SPLIT_CONFIDENCE_FACTOR = 0.9;

  static final double MANUAL_CONFIDENCE = 1.0;

  private final Clock clock;

  public RegionCorrector() {
    this(Clock.systemUTC());
  }

  public RegionCorrector(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  // -------------------- GEOMETRY --------------------

  public CorrectionResult resize(String documentId, Region region, BoundingBox box, String actor) {
    requireValid(box);
    Region resized = markCorrected(region.withBox(box));
    return single(documentId, CorrectionType.RESIZE, region, resized, actor, null);
  }

  /** Translates by {@code (dx, dy)}; the origin is clamped at zero. */
  public CorrectionResult move(String documentId, Region region, int dx, int dy, String actor) {
    BoundingBox moved =
        BoundingBox.of(
            Math.max(0, region.getX() + dx),
            Math.max(0, region.getY() + dy),
            region.getWidth(),
            region.getHeight());
    Region result = markCorrected(region.withBox(moved));
    return single(documentId, CorrectionType.MOVE, region, result, actor, null);
  }

  /**
   * Cuts the region in two at {@code at}, an absolute page coordinate strictly inside the region.
   * The first part keeps the text; both lose some confidence.
   */
  public CorrectionResult split(
      String documentId, Region region, int at, SplitAxis axis, String actor) {
    Objects.requireNonNull(axis, "axis must not be null");
    BoundingBox first;
    BoundingBox second;
    if (axis == SplitAxis.HORIZONTAL) {
      if (at <= region.getY() || at >= region.getY2()) {
        throw new IllegalArgumentException(
            "split y=" + at + " outside region " + region.getY() + ".." + region.getY2());
      }
      first = BoundingBox.fromCorners(region.getX(), region.getY(), region.getX2(), at);
      second = BoundingBox.fromCorners(region.getX(), at, region.getX2(), region.getY2());
    } else {
      if (at <= region.getX() || at >= region.getX2()) {
        throw new IllegalArgumentException(
            "split x=" + at + " outside region " + region.getX() + ".." + region.getX2());
      }
      first = BoundingBox.fromCorners(region.getX(), region.getY(), at, region.getY2());
      second = BoundingBox.fromCorners(at, region.getY(), region.getX2(), region.getY2());
    }

    double confidence = region.getConfidence() * SPLIT_CONFIDENCE_FACTOR;
    Region part1 = splitPart(region, first, confidence, region.getText(), 1);
    Region part2 = splitPart(region, second, confidence, "", 2);

    RegionCorrection correction =
        record(
            documentId,
            region.getId(),
            CorrectionType.SPLIT,
            region.box(),
            region.box(),
            actor,
            region.getConfidence(),
            confidence,
            axis.name().toLowerCase(Locale.ROOT) + " at " + at);
    return new CorrectionResult(List.of(part1, part2), List.of(region.getId()), correction);
  }

  /** Fuses two or more regions of one page into their bounding box. */
  public CorrectionResult merge(String documentId, List<Region> regions, String actor) {
    if (regions == null || regions.size() < 2) {
      throw new IllegalArgumentException("merge needs at least two regions");
    }
    int page = regions.get(0).getPageNumber();
    if (regions.stream().anyMatch(r -> r.getPageNumber() != page)) {
      throw new IllegalArgumentException("merged regions must be on the same page");
    }
    BoundingBox box = regions.get(0).box();
    for (Region r : regions) {
      box = box.union(r.box());
    }
    String text =
        regions.stream()
            .map(Region::getText)
            .filter(t -> t != null && !t.isBlank())
            .collect(Collectors.joining("\n"));
    double confidence = regions.stream().mapToDouble(Region::getConfidence).average().orElse(0.0);
    List<String> ids = regions.stream().map(Region::getId).collect(Collectors.toList());

    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("merged_from", ids);
    meta.put("merge_count", regions.size());
    meta.put("manually_corrected", true);
    Region merged =
        Region.of(box, page, regions.get(0).getRegionType(), confidence, text).withMetadata(meta);

    double before = regions.stream().mapToDouble(Region::getConfidence).max().orElse(0.0);
    RegionCorrection correction =
        record(
            documentId,
            merged.getId(),
            CorrectionType.MERGE,
            regions.get(0).box(),
            box,
            actor,
            before,
            confidence,
            "merged " + String.join(", ", ids));
    return new CorrectionResult(List.of(merged), ids, correction);
  }

  public CorrectionResult delete(String documentId, Region region, String actor) {
    RegionCorrection correction =
        record(
            documentId,
            region.getId(),
            CorrectionType.DELETE,
            region.box(),
            null,
            actor,
            region.getConfidence(),
            null,
            null);
    return new CorrectionResult(List.of(), List.of(region.getId()), correction);
  }

  // -------------------- CONTENT --------------------

  public CorrectionResult create(
      String documentId, BoundingBox box, int pageNumber, RegionType type, String actor) {
    requireValid(box);
    Region created =
        Region.of(box, pageNumber, type, MANUAL_CONFIDENCE, "")
            .withMetadata(Map.of("detection_method", "manual", "manually_corrected", true));
    RegionCorrection correction =
        record(
            documentId,
            created.getId(),
            CorrectionType.CREATE,
            null,
            box,
            actor,
            null,
            MANUAL_CONFIDENCE,
            null);
    return new CorrectionResult(List.of(created), List.of(), correction);
  }

  public CorrectionResult retype(String documentId, Region region, RegionType type, String actor) {
    Objects.requireNonNull(type, "type must not be null");
    Region retyped = markCorrected(region.toBuilder().regionType(type).build());
    return single(
        documentId,
        CorrectionType.RETYPE,
        region,
        retyped,
        actor,
        region.getRegionType().value() + " -> " + type.value());
  }

  // -------------------- HELPERS --------------------

  private CorrectionResult single(
      String documentId,
      CorrectionType type,
      Region before,
      Region after,
      String actor,
      String notes) {
    RegionCorrection correction =
        record(
            documentId,
            before.getId(),
            type,
            before.box(),
            after.box(),
            actor,
            before.getConfidence(),
            after.getConfidence(),
            notes);
    return new CorrectionResult(List.of(after), List.of(before.getId()), correction);
  }

  private RegionCorrection record(
      String documentId,
      String regionId,
      CorrectionType type,
      BoundingBox original,
      BoundingBox corrected,
      String actor,
      Double confidenceBefore,
      Double confidenceAfter,
      String notes) {
    return RegionCorrection.builder()
        .id(UUID.randomUUID().toString())
        .documentId(documentId)
        .regionId(regionId)
        .correctionType(type)
        .originalCoordinates(original)
        .correctedCoordinates(corrected)
        .actor(actor == null || actor.isBlank() ? "anonymous" : actor)
        .timestamp(clock.instant())
        .confidenceBefore(confidenceBefore)
        .confidenceAfter(confidenceAfter)
        .notes(notes)
        .build();
  }

  private static Region splitPart(
      Region source, BoundingBox box, double confidence, String text, int part) {
    Map<String, Object> meta = new LinkedHashMap<>(source.getMetadata());
    meta.put("split_from", source.getId());
    meta.put("split_part", part);
    meta.put("manually_corrected", true);
    return Region.of(box, source.getPageNumber(), source.getRegionType(), confidence, text)
        .withMetadata(meta);
  }

  private static Region markCorrected(Region region) {
    Object count = region.metadataValue("correction_count");
    int next = count instanceof Number ? ((Number) count).intValue() + 1 : 1;
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("manually_corrected", true);
    meta.put("correction_count", next);
    return region.withMetadata(meta);
  }

  private static void requireValid(BoundingBox box) {
    Objects.requireNonNull(box, "box must not be null");
    if (!box.isValid()) {
      throw new IllegalArgumentException("invalid box " + box);
    }
  }
}
