package com.cario.exam.app.service.pdf;

import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.exception.TextExtractionException;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Objects;

/** Opens the right {@link PageSource} for an uploaded document. */
public class PageSourceFactory {

  private final PdfTextLayerReader textLayer;
  private final ExtractionProperties.Render render;

  public PageSourceFactory(PdfTextLayerReader textLayer, ExtractionProperties.Render render) {
    this.textLayer = Objects.requireNonNull(textLayer, "textLayer must not be null");
    this.render = Objects.requireNonNull(render, "render must not be null");
  }

  public PageSource open(ExamDocument document) {
    if (document.isPdf()) {
      return PdfPageSource.open(document.getContent(), textLayer, render);
    }
    try {
      BufferedImage image = ImageUtils.read(document.getContent());
      if (image == null) {
        throw new TextExtractionException("Unsupported image data: " + document.getFilename());
      }
      return new ImagePageSource(image);
    } catch (IOException e) {
      throw new TextExtractionException("Could not decode image " + document.getFilename(), e);
    }
  }
}
