package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.GrayImage;
import java.awt.image.BufferedImage;

/**
 * Local thresholding: a pixel turns white when it is brighter than the Gaussian-weighted mean of
 * its {@code blockSize} neighbourhood minus {@code c}, black otherwise.
 */
public class AdaptiveBinarizeStep implements PreprocessingStep {

  private final int blockSize;
  private final int c;
  private final double[] kernel;

  public AdaptiveBinarizeStep(int blockSize, int c) {
    if (blockSize < 3 || blockSize % 2 == 0) {
      throw new IllegalArgumentException("blockSize must be odd and >= 3, got " + blockSize);
    }
    this.blockSize = blockSize;
    this.c = c;
    this.kernel = gaussianKernel(blockSize);
  }

  @Override
  public String name() {
    return "binarize";
  }

  @Override
  public Result apply(BufferedImage image) {
    GrayImage src = GrayImage.of(image);
    int w = src.width();
    int h = src.height();
    int r = blockSize / 2;

    double[] horizontal = new double[w * h];
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        double acc = 0;
        for (int k = -r; k <= r; k++) {
          acc += kernel[k + r] * src.getClamped(x + k, y);
        }
        horizontal[y * w + x] = acc;
      }
    }

    GrayImage out = new GrayImage(w, h);
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        double mean = 0;
        for (int k = -r; k <= r; k++) {
          int yy = Math.max(0, Math.min(h - 1, y + k));
          mean += kernel[k + r] * horizontal[yy * w + x];
        }
        out.set(x, y, src.get(x, y) > mean - c ? 255 : 0);
      }
    }
    return Result.applied(out.toBufferedImage(), "binarize");
  }

  /** Normalized 1-D Gaussian; sigma derived from the window size the way OpenCV does it. */
  static double[] gaussianKernel(int size) {
    double sigma = 0.3 * ((size - 1) * 0.5 - 1) + 0.8;
    double[] k = new double[size];
    int r = size / 2;
    double sum = 0;
    for (int i = -r; i <= r; i++) {
      k[i + r] = Math.exp(-(i * i) / (2 * sigma * sigma));
      sum += k[i + r];
    }
    for (int i = 0; i < size; i++) {
      k[i] /= sum;
    }
    return k;
  }
}
