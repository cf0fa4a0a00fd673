package com.cario.exam.app.model;

import java.awt.image.BufferedImage;
import lombok.Value;

/**
 * One page at both resolution tiers. Regions and layout live in detection-image pixels; {@link
 * #ocrScale()} converts to OCR-image pixels.
 */
@Value
public class PageImage {

  int pageNumber;
  BufferedImage detectionImage;
  BufferedImage ocrImage;

  /** Single-raster page, used for image uploads where both tiers are the same picture. */
  public static PageImage single(int pageNumber, BufferedImage image) {
    return new PageImage(pageNumber, image, image);
  }

  /** OCR pixels per detection pixel. */
  public double ocrScale() {
    return (double) ocrImage.getWidth() / detectionImage.getWidth();
  }
}
