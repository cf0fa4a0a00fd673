package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.OpenCv;
import java.awt.image.BufferedImage;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

/** OpenCV's CLAHE; {@link ClaheContrastStep} is the pure Java equivalent. */
public class OpenCvClaheStep implements PreprocessingStep {

  private final double clipLimit;
  private final int grid;

  public OpenCvClaheStep(double clipLimit, int grid) {
    if (clipLimit <= 0 || grid <= 0) {
      throw new IllegalArgumentException("clipLimit and grid must be positive");
    }
    this.clipLimit = clipLimit;
    this.grid = grid;
  }

  @Override
  public String name() {
    return "contrast";
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
      CLAHE clahe = Imgproc.createCLAHE(clipLimit, new Size(grid, grid));
      clahe.apply(src, dst);
      return Result.applied(OpenCv.toImage(dst), "contrast");
    } finally {
      OpenCv.release(src, dst);
    }
  }
}
