package com.cario.exam.app.service.pdf;

import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.PageImage;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/** A single raster upload; the same picture serves detection and OCR. */
public class ImagePageSource implements PageSource {

  private final PageImage page;

  public ImagePageSource(BufferedImage image) {
    this.page = PageImage.single(1, Objects.requireNonNull(image, "image must not be null"));
  }

  @Override
  public int pageCount() {
    return 1;
  }

  @Override
  public PageImage page(int pageNumber) {
    if (pageNumber != 1) {
      throw new IllegalArgumentException("image documents have one page, got " + pageNumber);
    }
    return page;
  }

  @Override
  public String pageText(int pageNumber) {
    return "";
  }

  @Override
  public List<OcrWord> textLayerWords(int pageNumber) {
    return List.of();
  }

  @Override
  public void close() {}
}
