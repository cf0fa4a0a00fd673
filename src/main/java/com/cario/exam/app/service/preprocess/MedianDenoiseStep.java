package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.GrayImage;
import java.awt.image.BufferedImage;

/** Edge-preserving 3x3 median filter. Declines images larger than its pixel budget. */
public class MedianDenoiseStep implements PreprocessingStep {

  private final long maxPixels;

  public MedianDenoiseStep(long maxPixels) {
    this.maxPixels = maxPixels;
  }

  @Override
  public String name() {
    return "denoise";
  }

  @Override
  public int priority() {
    return 10;
  }

  @Override
  public boolean supports(BufferedImage image) {
    return (long) image.getWidth() * image.getHeight() <= maxPixels;
  }

  @Override
  public Result apply(BufferedImage image) {
    GrayImage src = GrayImage.of(image);
    GrayImage out = new GrayImage(src.width(), src.height());
    int[] window = new int[9];
    for (int y = 0; y < src.height(); y++) {
      for (int x = 0; x < src.width(); x++) {
        int n = 0;
        for (int dy = -1; dy <= 1; dy++) {
          for (int dx = -1; dx <= 1; dx++) {
            window[n++] = src.getClamped(x + dx, y + dy);
          }
        }
        out.set(x, y, median9(window));
      }
    }
    return Result.applied(out.toBufferedImage(), "denoise_advanced");
  }

  private static int median9(int[] v) {
    // insertion sort, nine elements
    for (int i = 1; i < 9; i++) {
      int key = v[i];
      int j = i - 1;
      while (j >= 0 && v[j] > key) {
        v[j + 1] = v[j];
        j--;
      }
      v[j + 1] = key;
    }
    return v[4];
  }
}
