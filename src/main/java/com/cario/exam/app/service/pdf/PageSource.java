package com.cario.exam.app.service.pdf;

import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.PageImage;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Pages of one uploaded document, rendered on demand. Page numbers start at 1.
 *
 * <p>Implementations are safe to call from one pipeline worker at a time.
 */
public interface PageSource extends AutoCloseable {

  int pageCount();

  PageImage page(int pageNumber);

  /** Only the detection-resolution raster of a page. */
  default BufferedImage detectionImage(int pageNumber) {
    return page(pageNumber).getDetectionImage();
  }

  /** Embedded text of the page; empty when the document has no text layer. */
  String pageText(int pageNumber);

  /**
   * Words of the embedded text layer in detection-image pixels, confidence 100. Empty when there is
   * no text layer.
   */
  List<OcrWord> textLayerWords(int pageNumber);

  @Override
  void close();
}
