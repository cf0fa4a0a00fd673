package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.OpenCv;
import java.awt.image.BufferedImage;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/** Grayscale closing with a 2x2 rectangle through OpenCV. */
public class OpenCvMorphologyCloseStep implements PreprocessingStep {

  @Override
  public String name() {
    return "morphology";
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
    Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(2, 2));
    try {
      Imgproc.morphologyEx(src, dst, Imgproc.MORPH_CLOSE, kernel);
      return Result.applied(OpenCv.toImage(dst), "morphology");
    } finally {
      OpenCv.release(src, dst, kernel);
    }
  }
}
