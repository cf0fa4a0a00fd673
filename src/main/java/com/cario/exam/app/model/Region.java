package com.cario.exam.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * A rectangular area of one page with a content type, OCR text and a detection confidence.
 *
 * <p>Regions are immutable. Detection strategies create them and every manual correction produces
 * new instances, so a region handed to a reviewer never changes underneath it.
 *
 * <p>Invariants checked on construction:
 *
 * <ul>
 *   <li>{@code width > 0} and {@code height > 0}
 *   <li>{@code x >= 0} and {@code y >= 0}
 *   <li>{@code pageNumber >= 1}
 *   <li>{@code 0 <= confidence <= 1}
 * </ul>
 */
@Value
public class Region {

  String id;
  int x;
  int y;
  int width;
  int height;
  int pageNumber;
  RegionType regionType;
  double confidence;
  String text;
  Map<String, Object> metadata;

  @Builder(toBuilder = true)
  private Region(
      String id,
      int x,
      int y,
      int width,
      int height,
      int pageNumber,
      RegionType regionType,
      double confidence,
      String text,
      Map<String, Object> metadata) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          "region width and height must be positive, got " + width + "x" + height);
    }
    if (x < 0 || y < 0) {
      throw new IllegalArgumentException("region origin must be non-negative, got " + x + "," + y);
    }
    if (pageNumber < 1) {
      throw new IllegalArgumentException("page number must be >= 1, got " + pageNumber);
    }
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be within [0,1], got " + confidence);
    }
    this.id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
    this.pageNumber = pageNumber;
    this.regionType = regionType == null ? RegionType.UNKNOWN : regionType;
    this.confidence = confidence;
    this.text = text == null ? "" : text;
    this.metadata =
        metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Convenience factory for a region placed at {@code box}. */
  public static Region of(
      BoundingBox box, int pageNumber, RegionType type, double confidence, String text) {
    return Region.builder()
        .x(box.getX())
        .y(box.getY())
        .width(box.getWidth())
        .height(box.getHeight())
        .pageNumber(pageNumber)
        .regionType(type)
        .confidence(confidence)
        .text(text)
        .build();
  }

  public int getX2() {
    return x + width;
  }

  public int getY2() {
    return y + height;
  }

  public long getArea() {
    return (long) width * height;
  }

  public double getCenterX() {
    return x + width / 2.0;
  }

  public double getCenterY() {
    return y + height / 2.0;
  }

  public BoundingBox box() {
    return BoundingBox.of(x, y, width, height);
  }

  /** Copy of this region relocated to {@code box}; id, type, text and metadata are kept. */
  public Region withBox(BoundingBox box) {
    return toBuilder()
        .x(box.getX())
        .y(box.getY())
        .width(box.getWidth())
        .height(box.getHeight())
        .build();
  }

  /** Copy with {@code extra} merged over the current metadata. */
  public Region withMetadata(Map<String, Object> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.putAll(extra);
    return toBuilder().metadata(merged).build();
  }

  public Object metadataValue(String key) {
    return metadata.get(key);
  }
}
