package com.cario.exam.app.service.pdf;

import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.exception.TextExtractionException;
import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.PageImage;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/**
 * Renders PDF pages with PDFBox at the detection and OCR resolutions. The document stays open
 * until {@link #close()}; PDFBox documents are not thread-safe, so every access is synchronized.
 */
@Log4j2
public class PdfPageSource implements PageSource {

  private final PDDocument document;
  private final PDFRenderer renderer;
  private final PdfTextLayerReader textLayer;
  private final float detectionDpi;
  private final float ocrDpi;

  PdfPageSource(
      PDDocument document, PdfTextLayerReader textLayer, ExtractionProperties.Render render) {
    this.document = document;
    this.renderer = new PDFRenderer(document);
    this.textLayer = textLayer;
    this.detectionDpi = render.getDetectionDpi();
    this.ocrDpi = render.getOcrDpi();
  }

  public static PdfPageSource open(
      byte[] content, PdfTextLayerReader textLayer, ExtractionProperties.Render render) {
    try {
      return new PdfPageSource(Loader.loadPDF(content), textLayer, render);
    } catch (IOException e) {
      throw new TextExtractionException("Could not open PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public synchronized int pageCount() {
    return document.getNumberOfPages();
  }

  @Override
  public synchronized PageImage page(int pageNumber) {
    checkPage(pageNumber);
    long t0 = System.nanoTime();
    try {
      BufferedImage detection =
          renderer.renderImageWithDPI(pageNumber - 1, detectionDpi, ImageType.GRAY);
      BufferedImage ocr = renderer.renderImageWithDPI(pageNumber - 1, ocrDpi, ImageType.GRAY);
      log.debug(
          "pdf.render page={} detection={}x{} ocr={}x{} durationMs={}",
          pageNumber,
          detection.getWidth(),
          detection.getHeight(),
          ocr.getWidth(),
          ocr.getHeight(),
          (System.nanoTime() - t0) / 1_000_000);
      return new PageImage(pageNumber, detection, ocr);
    } catch (IOException e) {
      throw new TextExtractionException(
          "Failed to render page " + pageNumber, Map.of("page", pageNumber), e);
    }
  }

  @Override
  public synchronized BufferedImage detectionImage(int pageNumber) {
    checkPage(pageNumber);
    try {
      return renderer.renderImageWithDPI(pageNumber - 1, detectionDpi, ImageType.GRAY);
    } catch (IOException e) {
      throw new TextExtractionException(
          "Failed to render page " + pageNumber, Map.of("page", pageNumber), e);
    }
  }

  @Override
  public synchronized String pageText(int pageNumber) {
    checkPage(pageNumber);
    try {
      return textLayer.pageText(document, pageNumber);
    } catch (IOException e) {
      throw new TextExtractionException(
          "Failed to read text layer of page " + pageNumber, Map.of("page", pageNumber), e);
    }
  }

  @Override
  public synchronized List<OcrWord> textLayerWords(int pageNumber) {
    checkPage(pageNumber);
    try {
      return textLayer.words(document, pageNumber, detectionDpi);
    } catch (IOException e) {
      throw new TextExtractionException(
          "Failed to read text layer of page " + pageNumber, Map.of("page", pageNumber), e);
    }
  }

  @Override
  public synchronized void close() {
    try {
      document.close();
    } catch (IOException e) {
      log.warn("pdf.close.failed msg={}", e.getMessage());
    }
  }

  private void checkPage(int pageNumber) {
    if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
      throw new IllegalArgumentException("page out of range: " + pageNumber);
    }
  }
}
