package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.GrayImage;
import java.awt.image.BufferedImage;

/** Basic 3x3 mean blur, the fallback denoiser for any image size. */
public class BoxBlurDenoiseStep implements PreprocessingStep {

  @Override
  public String name() {
    return "denoise";
  }

  @Override
  public Result apply(BufferedImage image) {
    GrayImage src = GrayImage.of(image);
    GrayImage out = new GrayImage(src.width(), src.height());
    for (int y = 0; y < src.height(); y++) {
      for (int x = 0; x < src.width(); x++) {
        int sum = 0;
        for (int dy = -1; dy <= 1; dy++) {
          for (int dx = -1; dx <= 1; dx++) {
            sum += src.getClamped(x + dx, y + dy);
          }
        }
        out.set(x, y, (sum + 4) / 9);
      }
    }
    return Result.applied(out.toBufferedImage(), "denoise_basic");
  }
}
