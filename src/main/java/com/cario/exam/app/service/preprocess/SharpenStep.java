package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.GrayImage;
import java.awt.image.BufferedImage;

/** Fixed 3x3 sharpening kernel: centre 9, neighbours -1. */
public class SharpenStep implements PreprocessingStep {

  @Override
  public String name() {
    return "sharpen";
  }

  @Override
  public Result apply(BufferedImage image) {
    GrayImage src = GrayImage.of(image);
    GrayImage out = new GrayImage(src.width(), src.height());
    for (int y = 0; y < src.height(); y++) {
      for (int x = 0; x < src.width(); x++) {
        int neighbours = 0;
        for (int dy = -1; dy <= 1; dy++) {
          for (int dx = -1; dx <= 1; dx++) {
            if (dx != 0 || dy != 0) {
              neighbours += src.getClamped(x + dx, y + dy);
            }
          }
        }
        out.set(x, y, 9 * src.get(x, y) - neighbours);
      }
    }
    return Result.applied(out.toBufferedImage(), "sharpen");
  }
}
