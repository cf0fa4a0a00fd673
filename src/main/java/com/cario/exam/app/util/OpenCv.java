package com.cario.exam.app.util;

import com.cario.exam.app.model.BoundingBox;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.opencv_java;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;

/**
 * Bridge to the OpenCV Java API bundled with the bytedeco natives. The native library is loaded
 * once, on first use; when loading fails every caller sees {@link #isAvailable()} false and keeps
 * to its pure Java path.
 *
 * <p>Conversions work on single-channel 8-bit images only.
 */
@Log4j2
public final class OpenCv {

  private static volatile Boolean available;

  private OpenCv() {}

  public static boolean isAvailable() {
    Boolean loaded = available;
    if (loaded == null) {
      synchronized (OpenCv.class) {
        if (available == null) {
          available = load();
        }
        loaded = available;
      }
    }
    return loaded;
  }

  private static boolean load() {
    try {
      Loader.load(opencv_java.class);
      log.info("opencv.loaded version={}", Core.VERSION);
      return true;
    } catch (RuntimeException | LinkageError ex) {
      log.warn("opencv.unavailable msg={}", ex.toString());
      return false;
    }
  }

  /** Copies a raster into a new {@code CV_8UC1} matrix, converting to gray first if needed. */
  public static Mat toMat(BufferedImage image) {
    BufferedImage gray = ImageUtils.toGray(image);
    int w = gray.getWidth();
    int h = gray.getHeight();
    byte[] pixels = (byte[]) gray.getRaster().getDataElements(0, 0, w, h, null);
    Mat mat = new Mat(h, w, CvType.CV_8UC1);
    mat.put(0, 0, pixels);
    return mat;
  }

  /** Copies a {@code CV_8UC1} matrix into a new gray raster. */
  public static BufferedImage toImage(Mat mat) {
    int w = mat.cols();
    int h = mat.rows();
    byte[] pixels = new byte[w * h];
    mat.get(0, 0, pixels);
    BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
    out.getRaster().setDataElements(0, 0, w, h, pixels);
    return out;
  }

  /** Nonzero pixels of a {@code CV_8UC1} mask, row major. */
  public static boolean[] toMask(Mat mat) {
    byte[] pixels = new byte[mat.cols() * mat.rows()];
    mat.get(0, 0, pixels);
    boolean[] mask = new boolean[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      mask[i] = pixels[i] != 0;
    }
    return mask;
  }

  /** Bounding boxes of the outer contours of a binary mask. The mask is left untouched. */
  public static List<BoundingBox> externalBoxes(Mat mask) {
    List<MatOfPoint> contours = new ArrayList<>();
    Mat hierarchy = new Mat();
    Mat work = mask.clone();
    try {
      Imgproc.findContours(
          work, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
      List<BoundingBox> boxes = new ArrayList<>(contours.size());
      for (MatOfPoint contour : contours) {
        Rect r = Imgproc.boundingRect(contour);
        boxes.add(BoundingBox.of(r.x, r.y, r.width, r.height));
        contour.release();
      }
      return boxes;
    } finally {
      work.release();
      hierarchy.release();
    }
  }

  public static void release(Mat... mats) {
    for (Mat m : mats) {
      if (m != null) {
        m.release();
      }
    }
  }
}
