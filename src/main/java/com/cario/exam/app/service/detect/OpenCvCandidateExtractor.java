package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.util.OpenCv;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/** Geometric candidates through OpenCV: Otsu, rectangular closing, Canny and contours. */
class OpenCvCandidateExtractor implements CandidateExtractor {

  private static final double CANNY_LOW = 50;
  private static final double CANNY_HIGH = 150;
  private static final double APPROX_EPSILON = 0.02;

  @Override
  public String id() {
    return "opencv";
  }

  @Override
  public boolean isAvailable() {
    return OpenCv.isAvailable();
  }

  @Override
  public boolean[] inkMask(BufferedImage gray) {
    Mat src = OpenCv.toMat(gray);
    Mat ink = otsuInk(src);
    try {
      return OpenCv.toMask(ink);
    } finally {
      OpenCv.release(src, ink);
    }
  }

  @Override
  public List<BoundingBox> lineBoxes(BufferedImage gray) {
    Mat src = OpenCv.toMat(gray);
    Mat ink = otsuInk(src);
    Mat closed = close(ink, 15, 3);
    try {
      return OpenCv.externalBoxes(closed);
    } finally {
      OpenCv.release(src, ink, closed);
    }
  }

  @Override
  public List<BoundingBox> blockBoxes(BufferedImage gray) {
    Mat src = OpenCv.toMat(gray);
    Mat blurred = new Mat();
    Imgproc.blur(src, blurred, new Size(3, 3));
    Mat ink = otsuInk(blurred);
    Mat closed = close(ink, 25, 5);
    try {
      return OpenCv.externalBoxes(closed);
    } finally {
      OpenCv.release(src, blurred, ink, closed);
    }
  }

  @Override
  public List<BoundingBox> edgeBoxes(BufferedImage gray) {
    Mat src = OpenCv.toMat(gray);
    Mat edges = new Mat();
    Mat dilated = new Mat();
    Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
    Mat hierarchy = new Mat();
    List<MatOfPoint> contours = new ArrayList<>();
    try {
      Imgproc.Canny(src, edges, CANNY_LOW, CANNY_HIGH);
      Imgproc.dilate(edges, dilated, kernel, new Point(-1, -1), 2);
      Imgproc.findContours(
          dilated, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
      List<BoundingBox> boxes = new ArrayList<>(contours.size());
      for (MatOfPoint contour : contours) {
        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        Imgproc.approxPolyDP(
            curve, approx, APPROX_EPSILON * Imgproc.arcLength(curve, true), true);
        Rect r = Imgproc.boundingRect(approx);
        boxes.add(BoundingBox.of(r.x, r.y, r.width, r.height));
        OpenCv.release(curve, approx, contour);
      }
      return boxes;
    } finally {
      OpenCv.release(src, edges, dilated, kernel, hierarchy);
    }
  }

  private static Mat otsuInk(Mat gray) {
    Mat ink = new Mat();
    Imgproc.threshold(gray, ink, 0, 255, Imgproc.THRESH_BINARY_INV + Imgproc.THRESH_OTSU);
    return ink;
  }

  private static Mat close(Mat mask, int kw, int kh) {
    Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(kw, kh));
    Mat closed = new Mat();
    try {
      Imgproc.morphologyEx(mask, closed, Imgproc.MORPH_CLOSE, kernel);
      return closed;
    } finally {
      kernel.release();
    }
  }
}
