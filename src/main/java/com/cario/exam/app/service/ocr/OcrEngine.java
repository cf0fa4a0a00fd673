package com.cario.exam.app.service.ocr;

import com.cario.exam.app.model.OcrResult;
import java.awt.image.BufferedImage;

/**
 * A text-recognition backend. Implementations convert their native confidence to the 0-100 scale
 * and drop their own low-confidence noise before building the result.
 */
public interface OcrEngine {

  /** Stable id used to select the engine, e.g. {@code tesseract}. */
  String id();

  /** Whether the backend can be called at all in this deployment. */
  boolean isAvailable();

  /**
   * Recognizes words in {@code image}.
   *
   * @throws com.cario.exam.app.exception.OcrProcessingException when the backend fails
   */
  OcrResult recognize(BufferedImage image);
}
