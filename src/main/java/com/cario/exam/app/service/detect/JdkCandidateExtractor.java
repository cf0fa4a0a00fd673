package com.cario.exam.app.service.detect;

import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.util.GrayImage;
import java.awt.image.BufferedImage;
import java.util.List;

/** Pure Java candidates for deployments where the OpenCV natives cannot load. */
class JdkCandidateExtractor implements CandidateExtractor {

  private static final double EDGE_THRESHOLD = 100.0;

  @Override
  public String id() {
    return "jdk";
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public boolean[] inkMask(BufferedImage gray) {
    GrayImage img = GrayImage.of(gray);
    return BinaryMorphology.inkMask(img, BinaryMorphology.otsuThreshold(img));
  }

  @Override
  public List<BoundingBox> lineBoxes(BufferedImage gray) {
    int w = gray.getWidth();
    int h = gray.getHeight();
    boolean[] closed = BinaryMorphology.close(inkMask(gray), w, h, 15, 3);
    return BinaryMorphology.components(closed, w, h);
  }

  @Override
  public List<BoundingBox> blockBoxes(BufferedImage gray) {
    GrayImage blurred = BinaryMorphology.blur(GrayImage.of(gray));
    int w = blurred.width();
    int h = blurred.height();
    boolean[] ink = BinaryMorphology.inkMask(blurred, BinaryMorphology.otsuThreshold(blurred));
    return BinaryMorphology.components(BinaryMorphology.close(ink, w, h, 25, 5), w, h);
  }

  @Override
  public List<BoundingBox> edgeBoxes(BufferedImage gray) {
    GrayImage img = GrayImage.of(gray);
    int w = img.width();
    int h = img.height();
    boolean[] edges = BinaryMorphology.sobelEdges(img, EDGE_THRESHOLD);
    boolean[] dilated =
        BinaryMorphology.dilate(BinaryMorphology.dilate(edges, w, h, 3, 3), w, h, 3, 3);
    return BinaryMorphology.components(dilated, w, h);
  }
}
