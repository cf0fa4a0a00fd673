package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.OpenCv;
import java.awt.image.BufferedImage;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/** Edge-preserving bilateral filter. Preferred over the pure Java denoisers when OpenCV loads. */
public class OpenCvDenoiseStep implements PreprocessingStep {

  private static final int DIAMETER = 9;
  private static final double SIGMA = 75;

  @Override
  public String name() {
    return "denoise";
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
      Imgproc.bilateralFilter(src, dst, DIAMETER, SIGMA, SIGMA);
      return Result.applied(OpenCv.toImage(dst), "denoise_bilateral");
    } finally {
      OpenCv.release(src, dst);
    }
  }
}
