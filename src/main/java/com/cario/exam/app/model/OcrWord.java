package com.cario.exam.app.model;

import java.awt.geom.AffineTransform;
import lombok.Builder;
import lombok.Value;

/** One recognized word with its box and a confidence on the canonical 0-100 scale. */
@Value
@Builder(toBuilder = true)
public class OcrWord {

  private static final double EPSILON = 1e-6;

  String text;

  /** 0-100. */
  double confidence;

  int x;
  int y;
  int width;
  int height;

  public int getX2() {
    return x + width;
  }

  public int getY2() {
    return y + height;
  }

  public double getCenterY() {
    return y + height / 2.0;
  }

  public BoundingBox box() {
    return BoundingBox.of(x, y, Math.max(1, width), Math.max(1, height));
  }

  public OcrWord scaled(double factor) {
    if (factor == 1.0) {
      return this;
    }
    return toBuilder()
        .x((int) Math.round(x * factor))
        .y((int) Math.round(y * factor))
        .width(Math.max(1, (int) Math.round(width * factor)))
        .height(Math.max(1, (int) Math.round(height * factor)))
        .build();
  }

  public OcrWord translated(int dx, int dy) {
    return toBuilder().x(x + dx).y(y + dy).build();
  }

  /** Copy whose box is the axis-aligned bound of this box's corners mapped through {@code t}. */
  public OcrWord transformed(AffineTransform t) {
    if (t.isIdentity()) {
      return this;
    }
    double[] corners = {x, y, x + width, y, x, y + height, x + width, y + height};
    t.transform(corners, 0, corners, 0, 4);
    double minX = Double.MAX_VALUE;
    double minY = Double.MAX_VALUE;
    double maxX = -Double.MAX_VALUE;
    double maxY = -Double.MAX_VALUE;
    for (int i = 0; i < corners.length; i += 2) {
      minX = Math.min(minX, corners[i]);
      maxX = Math.max(maxX, corners[i]);
      minY = Math.min(minY, corners[i + 1]);
      maxY = Math.max(maxY, corners[i + 1]);
    }
    int x1 = Math.max(0, (int) Math.floor(minX + EPSILON));
    int y1 = Math.max(0, (int) Math.floor(minY + EPSILON));
    int x2 = (int) Math.ceil(maxX - EPSILON);
    int y2 = (int) Math.ceil(maxY - EPSILON);
    return toBuilder()
        .x(x1)
        .y(y1)
        .width(Math.max(1, x2 - x1))
        .height(Math.max(1, y2 - y1))
        .build();
  }
}
