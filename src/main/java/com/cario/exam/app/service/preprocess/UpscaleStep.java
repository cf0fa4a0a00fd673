package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.util.Locale;

/** Enlarges images whose width or height is below {@code minDimension}. */
public class UpscaleStep implements PreprocessingStep {

  private final int minDimension;

  public UpscaleStep(int minDimension) {
    if (minDimension <= 0) {
      throw new IllegalArgumentException("minDimension must be positive");
    }
    this.minDimension = minDimension;
  }

  @Override
  public String name() {
    return "resize";
  }

  @Override
  public Result apply(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    if (w >= minDimension && h >= minDimension) {
      return Result.skipped(image);
    }
    double factor = Math.max((double) minDimension / h, (double) minDimension / w);
    int nw = (int) (w * factor);
    int nh = (int) (h * factor);
    BufferedImage out = ImageUtils.resize(image, nw, nh);
    String label = String.format(Locale.ROOT, "resize_%.1fx", factor);
    return Result.resized(out, label, (double) nw / w, (double) nh / h);
  }
}
