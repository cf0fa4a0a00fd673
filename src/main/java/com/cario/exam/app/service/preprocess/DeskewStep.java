package com.cario.exam.app.service.preprocess;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.util.Locale;
import lombok.extern.log4j.Log4j2;
import com.recognition.software.jdeskew.ImageDeskew;
import org.springframework.util.ClassUtils;

/**
 * Rotates the page back to horizontal using the tess4j skew detector. Pages skewed by 0.5 degrees
 * or less are left untouched.
 *
 * <p>The canvas grows to hold the whole rotated page and the uncovered corners are painted white.
 * The result carries the exact rotation and translation, so word boxes found on the straightened
 * page can be mapped back onto the input.
 */
@Log4j2
public class DeskewStep implements PreprocessingStep {

  static final double MIN_ANGLE = 0.5;

  private static final String DETECTOR_CLASS = "com.recognition.software.jdeskew.ImageDeskew";

  @Override
  public String name() {
    return "deskew";
  }

  @Override
  public boolean isAvailable() {
    return ClassUtils.isPresent(DETECTOR_CLASS, DeskewStep.class.getClassLoader());
  }

  @Override
  public Result apply(BufferedImage image) {
    double angle;
    try {
      angle = new ImageDeskew(image).getSkewAngle();
    } catch (RuntimeException | LinkageError ex) {
      log.warn("preprocess.deskew.skipped msg={}", ex.getMessage());
      return Result.applied(image, "deskew_skipped");
    }
    if (Double.isNaN(angle) || Math.abs(angle) <= MIN_ANGLE) {
      return Result.skipped(image);
    }
    return rotate(image, -angle, String.format(Locale.ROOT, "deskew_%.1fdeg", angle));
  }

  /** Rotates {@code image} by {@code degrees} (clockwise on screen) about its centre. */
  public static Result rotate(BufferedImage image, double degrees, String label) {
    int w = image.getWidth();
    int h = image.getHeight();
    double rad = Math.toRadians(degrees);
    double sin = Math.abs(Math.sin(rad));
    double cos = Math.abs(Math.cos(rad));
    int nw = (int) Math.ceil(w * cos + h * sin);
    int nh = (int) Math.ceil(h * cos + w * sin);

    AffineTransform t = new AffineTransform();
    t.translate(nw / 2.0, nh / 2.0);
    t.rotate(rad);
    t.translate(-w / 2.0, -h / 2.0);

    BufferedImage out = new BufferedImage(nw, nh, BufferedImage.TYPE_BYTE_GRAY);
    Graphics2D g = out.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, nw, nh);
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.drawImage(image, t, null);
    } finally {
      g.dispose();
    }
    return Result.transformed(out, label, t);
  }
}
