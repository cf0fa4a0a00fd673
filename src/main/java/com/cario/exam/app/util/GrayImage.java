package com.cario.exam.app.util;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Mutable 8-bit grayscale raster backed by an {@code int[]}, row major. Pixel filters work on this
 * rather than on {@link BufferedImage} so they can address neighbours cheaply.
 */
public final class GrayImage {

  private final int width;
  private final int height;
  private final int[] pixels;

  public GrayImage(int width, int height) {
    this(width, height, new int[width * height]);
  }

  public GrayImage(int width, int height, int[] pixels) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("image dimensions must be positive");
    }
    if (pixels.length != width * height) {
      throw new IllegalArgumentException("pixel buffer does not match " + width + "x" + height);
    }
    this.width = width;
    this.height = height;
    this.pixels = pixels;
  }

  /** Luminance copy of {@code image}. */
  public static GrayImage of(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    int[] px = new int[w * h];
    if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
      image.getRaster().getSamples(0, 0, w, h, 0, px);
      return new GrayImage(w, h, px);
    }
    int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
    for (int i = 0; i < rgb.length; i++) {
      int p = rgb[i];
      int r = (p >> 16) & 0xff;
      int g = (p >> 8) & 0xff;
      int b = p & 0xff;
      px[i] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
    }
    return new GrayImage(w, h, px);
  }

  public BufferedImage toBufferedImage() {
    BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
    WritableRaster raster = out.getRaster();
    raster.setSamples(0, 0, width, height, 0, pixels);
    return out;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int get(int x, int y) {
    return pixels[y * width + x];
  }

  /** Pixel with coordinates clamped to the image, i.e. replicated borders. */
  public int getClamped(int x, int y) {
    int cx = x < 0 ? 0 : (x >= width ? width - 1 : x);
    int cy = y < 0 ? 0 : (y >= height ? height - 1 : y);
    return pixels[cy * width + cx];
  }

  public void set(int x, int y, int value) {
    pixels[y * width + x] = clamp(value);
  }

  public int[] pixels() {
    return pixels;
  }

  public GrayImage copy() {
    return new GrayImage(width, height, pixels.clone());
  }

  public static int clamp(int v) {
    return v < 0 ? 0 : (v > 255 ? 255 : v);
  }
}
