package com.cario.exam.app.util;

import com.cario.exam.app.model.BoundingBox;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import javax.imageio.ImageIO;

/** Small raster helpers shared by the preprocessor, OCR engines and region detector. */
public final class ImageUtils {

  private ImageUtils() {}

  public static BufferedImage toGray(BufferedImage image) {
    if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
      return image;
    }
    return GrayImage.of(image).toBufferedImage();
  }

  /** Crops {@code box} clamped to the image bounds. Returns the whole image if nothing remains. */
  public static BufferedImage crop(BufferedImage image, BoundingBox box) {
    int x = Math.max(0, Math.min(box.getX(), image.getWidth() - 1));
    int y = Math.max(0, Math.min(box.getY(), image.getHeight() - 1));
    int w = Math.min(box.getWidth(), image.getWidth() - x);
    int h = Math.min(box.getHeight(), image.getHeight() - y);
    if (w <= 0 || h <= 0) {
      return image;
    }
    BufferedImage sub = image.getSubimage(x, y, w, h);
    BufferedImage copy = new BufferedImage(w, h, normalizedType(image));
    Graphics2D g = copy.createGraphics();
    try {
      g.drawImage(sub, 0, 0, null);
    } finally {
      g.dispose();
    }
    return copy;
  }

  public static BufferedImage resize(BufferedImage image, int width, int height) {
    BufferedImage out = new BufferedImage(width, height, normalizedType(image));
    Graphics2D g = out.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(image, 0, 0, width, height, null);
    } finally {
      g.dispose();
    }
    return out;
  }

  public static byte[] toPng(BufferedImage image) {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      if (!ImageIO.write(image, "png", out)) {
        throw new IllegalStateException("no PNG writer available");
      }
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException("PNG encoding failed", e);
    }
  }

  /** Decodes an image, or returns null when no ImageIO reader understands the bytes. */
  public static BufferedImage read(byte[] bytes) throws IOException {
    return ImageIO.read(new ByteArrayInputStream(bytes));
  }

  private static int normalizedType(BufferedImage image) {
    return image.getType() == BufferedImage.TYPE_BYTE_GRAY
        ? BufferedImage.TYPE_BYTE_GRAY
        : BufferedImage.TYPE_INT_RGB;
  }
}
