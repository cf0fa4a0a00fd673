package com.cario.exam.app.service.preprocess;

import com.cario.exam.app.util.GrayImage;
import java.awt.image.BufferedImage;

/**
 * Contrast-limited adaptive histogram equalization. The page is cut into a grid of tiles, each
 * tile gets its own clipped equalization table, and every pixel blends the tables of the four
 * nearest tile centres.
 */
public class ClaheContrastStep implements PreprocessingStep {

  private final double clipLimit;
  private final int grid;

  public ClaheContrastStep(double clipLimit, int grid) {
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
  public Result apply(BufferedImage image) {
    GrayImage src = GrayImage.of(image);
    int w = src.width();
    int h = src.height();
    int tilesX = Math.min(grid, w);
    int tilesY = Math.min(grid, h);
    int tileW = (w + tilesX - 1) / tilesX;
    int tileH = (h + tilesY - 1) / tilesY;

    int[][] luts = new int[tilesX * tilesY][];
    for (int ty = 0; ty < tilesY; ty++) {
      for (int tx = 0; tx < tilesX; tx++) {
        luts[ty * tilesX + tx] = tileLut(src, tx * tileW, ty * tileH, tileW, tileH);
      }
    }

    GrayImage out = new GrayImage(w, h);
    for (int y = 0; y < h; y++) {
      double gy = (y - tileH / 2.0) / tileH;
      int ty0 = clampIndex((int) Math.floor(gy), tilesY);
      int ty1 = clampIndex(ty0 + 1, tilesY);
      double fy = clampFraction(gy - Math.floor(gy), gy < 0 || ty0 == tilesY - 1);
      for (int x = 0; x < w; x++) {
        double gx = (x - tileW / 2.0) / tileW;
        int tx0 = clampIndex((int) Math.floor(gx), tilesX);
        int tx1 = clampIndex(tx0 + 1, tilesX);
        double fx = clampFraction(gx - Math.floor(gx), gx < 0 || tx0 == tilesX - 1);
        int v = src.get(x, y);
        double top =
            (1 - fx) * luts[ty0 * tilesX + tx0][v] + fx * luts[ty0 * tilesX + tx1][v];
        double bottom =
            (1 - fx) * luts[ty1 * tilesX + tx0][v] + fx * luts[ty1 * tilesX + tx1][v];
        out.set(x, y, (int) Math.round((1 - fy) * top + fy * bottom));
      }
    }
    return Result.applied(out.toBufferedImage(), "contrast");
  }

  private int[] tileLut(GrayImage src, int x0, int y0, int tileW, int tileH) {
    int[] lut = new int[256];
    int x1 = Math.min(src.width(), x0 + tileW);
    int y1 = Math.min(src.height(), y0 + tileH);
    if (x0 >= x1 || y0 >= y1) {
      for (int i = 0; i < 256; i++) {
        lut[i] = i;
      }
      return lut;
    }
    int[] hist = new int[256];
    int n = 0;
    for (int y = y0; y < y1; y++) {
      for (int x = x0; x < x1; x++) {
        hist[src.get(x, y)]++;
        n++;
      }
    }
    int clip = Math.max(1, (int) (clipLimit * n / 256.0));
    int excess = 0;
    for (int i = 0; i < 256; i++) {
      if (hist[i] > clip) {
        excess += hist[i] - clip;
        hist[i] = clip;
      }
    }
    int perBin = excess / 256;
    int remainder = excess % 256;
    for (int i = 0; i < 256; i++) {
      hist[i] += perBin + (i < remainder ? 1 : 0);
    }
    long cdf = 0;
    for (int i = 0; i < 256; i++) {
      cdf += hist[i];
      lut[i] = GrayImage.clamp((int) Math.round(cdf * 255.0 / n));
    }
    return lut;
  }

  private static int clampIndex(int i, int n) {
    return i < 0 ? 0 : Math.min(i, n - 1);
  }

  private static double clampFraction(double f, boolean edge) {
    return edge ? 0.0 : f;
  }
}
