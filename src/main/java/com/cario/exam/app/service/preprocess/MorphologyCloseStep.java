package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.GrayImage;
import java.awt.image.BufferedImage;

/** Grayscale closing with a 2x2 square: a max filter followed by a min filter. */
public class MorphologyCloseStep implements PreprocessingStep {

  @Override
  public String name() {
    return "morphology";
  }

  @Override
  public Result apply(BufferedImage image) {
    GrayImage src = GrayImage.of(image);
    GrayImage dilated = new GrayImage(src.width(), src.height());
    for (int y = 0; y < src.height(); y++) {
      for (int x = 0; x < src.width(); x++) {
        int m =
            Math.max(
                Math.max(src.get(x, y), src.getClamped(x + 1, y)),
                Math.max(src.getClamped(x, y + 1), src.getClamped(x + 1, y + 1)));
        dilated.set(x, y, m);
      }
    }
    GrayImage closed = new GrayImage(src.width(), src.height());
    for (int y = 0; y < src.height(); y++) {
      for (int x = 0; x < src.width(); x++) {
        int m =
            Math.min(
                Math.min(dilated.get(x, y), dilated.getClamped(x - 1, y)),
                Math.min(dilated.getClamped(x, y - 1), dilated.getClamped(x - 1, y - 1)));
        closed.set(x, y, m);
      }
    }
    return Result.applied(closed.toBufferedImage(), "morphology");
  }
}
