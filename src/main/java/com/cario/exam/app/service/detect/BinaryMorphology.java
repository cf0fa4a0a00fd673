package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.util.GrayImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary mask operations used by the geometric detector. A mask is a {@code boolean[]} of {@code
 * width * height}, row major, with {@code true} marking ink.
 */
final class BinaryMorphology {

  private BinaryMorphology() {}

  /** Otsu's global threshold over the 256-bin histogram. */
  static int otsuThreshold(GrayImage img) {
    int[] hist = new int[256];
    for (int p : img.pixels()) {
      hist[p]++;
    }
    int total = img.pixels().length;
    double sum = 0;
    for (int i = 0; i < 256; i++) {
      sum += (double) i * hist[i];
    }
    double sumB = 0;
    long wB = 0;
    double best = -1;
    int threshold = 127;
    for (int t = 0; t < 256; t++) {
      wB += hist[t];
      if (wB == 0) {
        continue;
      }
      long wF = total - wB;
      if (wF == 0) {
        break;
      }
      sumB += (double) t * hist[t];
      double mB = sumB / wB;
      double mF = (sum - sumB) / wF;
      double between = (double) wB * wF * (mB - mF) * (mB - mF);
      if (between > best) {
        best = between;
        threshold = t;
      }
    }
    return threshold;
  }

  /** Dark pixels at or below {@code threshold} become ink. */
  static boolean[] inkMask(GrayImage img, int threshold) {
    int[] px = img.pixels();
    boolean[] mask = new boolean[px.length];
    for (int i = 0; i < px.length; i++) {
      mask[i] = px[i] <= threshold;
    }
    return mask;
  }

  static boolean[] close(boolean[] mask, int w, int h, int kw, int kh) {
    return erode(dilate(mask, w, h, kw, kh), w, h, kw, kh);
  }

  static boolean[] dilate(boolean[] mask, int w, int h, int kw, int kh) {
    return vertical(horizontal(mask, w, h, kw, false), w, h, kh, false);
  }

  static boolean[] erode(boolean[] mask, int w, int h, int kw, int kh) {
    return vertical(horizontal(mask, w, h, kw, true), w, h, kh, true);
  }

  /**
   * One-dimensional pass with a window of {@code k} pixels anchored at its centre. Dilation sets a
   * pixel when any pixel in the window is set; erosion when every in-bounds pixel is set.
   */
  private static boolean[] horizontal(boolean[] mask, int w, int h, int k, boolean erode) {
    boolean[] out = new boolean[mask.length];
    int before = k / 2;
    int after = k - 1 - before;
    int[] prefix = new int[w + 1];
    for (int y = 0; y < h; y++) {
      int row = y * w;
      for (int x = 0; x < w; x++) {
        prefix[x + 1] = prefix[x] + (mask[row + x] ? 1 : 0);
      }
      for (int x = 0; x < w; x++) {
        int lo = Math.max(0, x - before);
        int hi = Math.min(w - 1, x + after);
        int count = prefix[hi + 1] - prefix[lo];
        out[row + x] = erode ? count == hi - lo + 1 : count > 0;
      }
    }
    return out;
  }

  private static boolean[] vertical(boolean[] mask, int w, int h, int k, boolean erode) {
    boolean[] out = new boolean[mask.length];
    int before = k / 2;
    int after = k - 1 - before;
    int[] prefix = new int[h + 1];
    for (int x = 0; x < w; x++) {
      for (int y = 0; y < h; y++) {
        prefix[y + 1] = prefix[y] + (mask[y * w + x] ? 1 : 0);
      }
      for (int y = 0; y < h; y++) {
        int lo = Math.max(0, y - before);
        int hi = Math.min(h - 1, y + after);
        int count = prefix[hi + 1] - prefix[lo];
        out[y * w + x] = erode ? count == hi - lo + 1 : count > 0;
      }
    }
    return out;
  }

  /** Gradient-magnitude edges from 3x3 Sobel operators. */
  static boolean[] sobelEdges(GrayImage img, double threshold) {
    int w = img.width();
    int h = img.height();
    boolean[] out = new boolean[w * h];
    double t2 = threshold * threshold;
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        int gx =
            -img.getClamped(x - 1, y - 1)
                - 2 * img.getClamped(x - 1, y)
                - img.getClamped(x - 1, y + 1)
                + img.getClamped(x + 1, y - 1)
                + 2 * img.getClamped(x + 1, y)
                + img.getClamped(x + 1, y + 1);
        int gy =
            -img.getClamped(x - 1, y - 1)
                - 2 * img.getClamped(x, y - 1)
                - img.getClamped(x + 1, y - 1)
                + img.getClamped(x - 1, y + 1)
                + 2 * img.getClamped(x, y + 1)
                + img.getClamped(x + 1, y + 1);
        out[y * w + x] = (double) gx * gx + (double) gy * gy > t2;
      }
    }
    return out;
  }

  /** 3x3 mean blur. */
  static GrayImage blur(GrayImage img) {
    GrayImage out = new GrayImage(img.width(), img.height());
    for (int y = 0; y < img.height(); y++) {
      for (int x = 0; x < img.width(); x++) {
        int sum = 0;
        for (int dy = -1; dy <= 1; dy++) {
          for (int dx = -1; dx <= 1; dx++) {
            sum += img.getClamped(x + dx, y + dy);
          }
        }
        out.set(x, y, (sum + 4) / 9);
      }
    }
    return out;
  }

  /** Bounding boxes of 8-connected ink components. */
  static List<BoundingBox> components(boolean[] mask, int w, int h) {
    List<BoundingBox> boxes = new ArrayList<>();
    boolean[] seen = new boolean[mask.length];
    int[] queue = new int[mask.length];
    for (int start = 0; start < mask.length; start++) {
      if (!mask[start] || seen[start]) {
        continue;
      }
      int head = 0;
      int tail = 0;
      queue[tail++] = start;
      seen[start] = true;
      int minX = w;
      int minY = h;
      int maxX = -1;
      int maxY = -1;
      while (head < tail) {
        int p = queue[head++];
        int px = p % w;
        int py = p / w;
        minX = Math.min(minX, px);
        minY = Math.min(minY, py);
        maxX = Math.max(maxX, px);
        maxY = Math.max(maxY, py);
        for (int dy = -1; dy <= 1; dy++) {
          int ny = py + dy;
          if (ny < 0 || ny >= h) {
            continue;
          }
          for (int dx = -1; dx <= 1; dx++) {
            int nx = px + dx;
            if (nx < 0 || nx >= w) {
              continue;
            }
            int q = ny * w + nx;
            if (mask[q] && !seen[q]) {
              seen[q] = true;
              queue[tail++] = q;
            }
          }
        }
      }
      boxes.add(BoundingBox.of(minX, minY, maxX - minX + 1, maxY - minY + 1));
    }
    return boxes;
  }

  /** Fraction of ink pixels inside {@code box}. */
  static double density(boolean[] mask, int w, BoundingBox box) {
    long ink = 0;
    for (int y = box.getY(); y < box.y2(); y++) {
      for (int x = box.getX(); x < box.x2(); x++) {
        if (mask[y * w + x]) {
          ink++;
        }
      }
    }
    return box.area() == 0 ? 0 : (double) ink / box.area();
  }
}
