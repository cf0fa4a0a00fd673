package com.cario.exam.app.service.preprocess;

import static org.junit.jupiter.api.Assertions.*;

import com.cario.exam.app.TestImages;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

class DeskewStepTest {

  @Test
  void rotationGrowsTheCanvasAndRecordsWherePixelsWent() {
    BufferedImage page = TestImages.withBlocks(600, 800, new int[] {200, 300, 120, 40});

    PreprocessingStep.Result r = DeskewStep.rotate(page, 4.0, "deskew_-4.0deg");

    assertTrue(r.getImage().getWidth() > 600);
    assertTrue(r.getImage().getHeight() > 800);
    Point2D inside = r.getTransform().transform(new Point2D.Double(260, 320), null);
    int px = r.getImage().getRGB((int) inside.getX(), (int) inside.getY()) & 0xff;
    assertTrue(px < 128, "block centre should still be ink after rotation, got " + px);
    Point2D corner = r.getTransform().transform(new Point2D.Double(0, 0), null);
    assertTrue(corner.getX() > 0 || corner.getY() > 0);
  }

  @Test
  void straightPageIsLeftAlone() {
    BufferedImage page =
        TestImages.withBlocks(
            400, 400, new int[] {40, 40, 300, 10}, new int[] {40, 100, 300, 10});

    PreprocessingStep.Result r = new DeskewStep().apply(page);

    assertSame(page, r.getImage());
    assertNull(r.getLabel());
    assertTrue(r.getTransform().isIdentity());
  }
}
