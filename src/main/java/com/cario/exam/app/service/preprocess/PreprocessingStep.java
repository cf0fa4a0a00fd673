package com.cario.exam.app.service.preprocess;

import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import lombok.Value;

/**
 * One capability-tagged image enhancement. Several strategies may share a {@link #name()}; the
 * preprocessor prefers the highest {@link #priority()} among the available ones and falls back to
 * the next when a strategy declines or fails on a particular image.
 */
public interface PreprocessingStep {

  /** Step name as requested by callers, e.g. {@code denoise}. */
  String name();

  default int priority() {
    return 0;
  }

  /** Whether the libraries this strategy needs are present. Checked once at construction. */
  default boolean isAvailable() {
    return true;
  }

  /** Whether this strategy is willing to process {@code image}. */
  default boolean supports(BufferedImage image) {
    return true;
  }

  /**
   * Applies the step to a {@code TYPE_BYTE_GRAY} image.
   *
   * @return the processed image and the label to record, or a skipped result
   */
  Result apply(BufferedImage image);

  @Value
  class Result {
    BufferedImage image;

    /** Label appended to the applied steps, null when the step left the image alone. */
    String label;

    /** Maps input pixel coordinates onto the output image. Never mutated after construction. */
    AffineTransform transform;

    public static Result applied(BufferedImage image, String label) {
      return new Result(image, label, new AffineTransform());
    }

    public static Result resized(BufferedImage image, String label, double sx, double sy) {
      return new Result(image, label, AffineTransform.getScaleInstance(sx, sy));
    }

    public static Result transformed(BufferedImage image, String label, AffineTransform transform) {
      return new Result(image, label, new AffineTransform(transform));
    }

    public static Result skipped(BufferedImage image) {
      return new Result(image, null, new AffineTransform());
    }
  }
}
