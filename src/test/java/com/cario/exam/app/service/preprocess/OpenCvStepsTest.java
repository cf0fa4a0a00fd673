package com.cario.exam.app.service.preprocess;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.cario.exam.app.TestImages;
import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.util.OpenCv;
import java.awt.image.BufferedImage;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenCvStepsTest {

  private BufferedImage page;

  @BeforeEach
  void setUp() {
    page = TestImages.withBlocks(200, 120, new int[] {20, 20, 120, 12}, new int[] {20, 60, 90, 12});
  }

  @Test
  void binarizeLeavesOnlyBlackAndWhite() {
    assumeTrue(OpenCv.isAvailable());

    BufferedImage out = new OpenCvAdaptiveBinarizeStep(11, 2).apply(page).getImage();

    assertEquals(200, out.getWidth());
    assertEquals(120, out.getHeight());
    for (int y = 0; y < out.getHeight(); y++) {
      for (int x = 0; x < out.getWidth(); x++) {
        int v = out.getRGB(x, y) & 0xff;
        assertTrue(v == 0 || v == 255, "pixel " + x + "," + y + " = " + v);
      }
    }
  }

  @Test
  void contrastAndDenoiseKeepTheInkWhereItWas() {
    assumeTrue(OpenCv.isAvailable());

    BufferedImage contrasted = new OpenCvClaheStep(2.0, 8).apply(page).getImage();
    BufferedImage denoised = new OpenCvDenoiseStep().apply(contrasted).getImage();

    assertTrue((denoised.getRGB(80, 26) & 0xff) < 128);
    assertTrue((denoised.getRGB(180, 100) & 0xff) > 128);
  }

  @Test
  void standardPreprocessorPrefersOpenCvStrategies() {
    ExtractionProperties.Preprocess cfg = new ExtractionProperties.Preprocess();
    ImagePreprocessor pre = ImagePreprocessor.standard(cfg);

    PreprocessingResult r = pre.enhance(page, List.of("denoise"));

    String expected = OpenCv.isAvailable() ? "denoise_bilateral" : "denoise_advanced";
    assertEquals(List.of(expected), r.getAppliedSteps());
  }
}
