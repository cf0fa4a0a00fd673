package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.OpenCv;
import java.awt.image.BufferedImage;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/** Gaussian adaptive threshold through OpenCV. Same parameters as {@link AdaptiveBinarizeStep}. */
public class OpenCvAdaptiveBinarizeStep implements PreprocessingStep {

  private final int blockSize;
  private final int c;

  public OpenCvAdaptiveBinarizeStep(int blockSize, int c) {
    if (blockSize < 3 || blockSize % 2 == 0) {
      throw new IllegalArgumentException("blockSize must be odd and >= 3, got " + blockSize);
    }
    this.blockSize = blockSize;
    this.c = c;
  }

  @Override
  public String name() {
    return "binarize";
  }

  @Override
  public int priority() {
    return 20;
  }

  @Override
  public boolean isAvailable() {
    return OpenCv.isAvailable();
  }

  @Override
  public Result apply(BufferedImage image) {
    Mat src = OpenCv.toMat(image);
    Mat dst = new Mat();
    try {
      Imgproc.adaptiveThreshold(
          src,
          dst,
          255,
          Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
          Imgproc.THRESH_BINARY,
          blockSize,
          c);
      return Result.applied(OpenCv.toImage(dst), "binarize");
    } finally {
      OpenCv.release(src, dst);
    }
  }
}
