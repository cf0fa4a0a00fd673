package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/** Axis-aligned pixel rectangle, origin at the top-left of the page raster. */
@Value
public class BoundingBox {

  int x;
  int y;
  int width;
  int height;

  @JsonCreator
  public BoundingBox(
      @JsonProperty("x") int x,
      @JsonProperty("y") int y,
      @JsonProperty("width") int width,
      @JsonProperty("height") int height) {
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
  }

  public static BoundingBox of(int x, int y, int width, int height) {
    return new BoundingBox(x, y, width, height);
  }

  /** Box spanning two corners, corners given in any order. */
  public static BoundingBox fromCorners(int x1, int y1, int x2, int y2) {
    int left = Math.min(x1, x2);
    int top = Math.min(y1, y2);
    return new BoundingBox(left, top, Math.abs(x2 - x1), Math.abs(y2 - y1));
  }

  public int x2() {
    return x + width;
  }

  public int y2() {
    return y + height;
  }

  public long area() {
    return (long) width * height;
  }

  public boolean isValid() {
    return x >= 0 && y >= 0 && width > 0 && height > 0;
  }

  public BoundingBox union(BoundingBox other) {
    return fromCorners(
        Math.min(x, other.x),
        Math.min(y, other.y),
        Math.max(x2(), other.x2()),
        Math.max(y2(), other.y2()));
  }

  public long intersectionArea(BoundingBox other) {
    long w = Math.min(x2(), other.x2()) - Math.max(x, other.x);
    long h = Math.min(y2(), other.y2()) - Math.max(y, other.y);
    return w <= 0 || h <= 0 ? 0 : w * h;
  }

  public BoundingBox scaled(double factor) {
    return new BoundingBox(
        (int) Math.round(x * factor),
        (int) Math.round(y * factor),
        Math.max(1, (int) Math.round(width * factor)),
        Math.max(1, (int) Math.round(height * factor)));
  }

  /** Grows the box by {@code padding} on every side, clamping the origin at zero. */
  public BoundingBox padded(int padding) {
    int nx = Math.max(0, x - padding);
    int ny = Math.max(0, y - padding);
    return fromCorners(nx, ny, x2() + padding, y2() + padding);
  }
}
