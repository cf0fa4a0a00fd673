package com.cario.exam.app.service.ocr;

import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;

/**
 * Amazon Textract DetectDocumentText over in-memory PNG bytes. Textract confidences are 0-100 and
 * boxes are page-relative ratios, so they are multiplied back into pixels here.
 */
@Log4j2
public class TextractOcrEngine implements OcrEngine {

  public static final String ID = "textract";

  private final TextractClient textract;
  private final boolean enabled;
  private final float minWordConfidence;

  public TextractOcrEngine(TextractClient textract, boolean enabled, float minWordConfidence) {
    this.textract = Objects.requireNonNull(textract, "textract must not be null");
    this.enabled = enabled;
    this.minWordConfidence = minWordConfidence;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public boolean isAvailable() {
    return enabled;
  }

  @Override
  public OcrResult recognize(BufferedImage image) {
    long t0 = System.nanoTime();
    DetectDocumentTextResponse resp;
    try {
      resp =
          textract.detectDocumentText(
              DetectDocumentTextRequest.builder()
                  .document(
                      Document.builder()
                          .bytes(SdkBytes.fromByteArray(ImageUtils.toPng(image)))
                          .build())
                  .build());
    } catch (SdkException e) {
      throw new OcrProcessingException("Textract failed: " + e.getMessage(), e);
    }

    int w = image.getWidth();
    int h = image.getHeight();
    List<OcrWord> words = new ArrayList<>();
    int total = 0;
    for (Block b : resp.blocks()) {
      if (b.blockType() != BlockType.WORD) {
        continue;
      }
      total++;
      Float conf = b.confidence();
      if (conf == null || conf < minWordConfidence || b.text() == null || b.text().isBlank()) {
        continue;
      }
      software.amazon.awssdk.services.textract.model.BoundingBox box =
          b.geometry() == null ? null : b.geometry().boundingBox();
      if (box == null) {
        continue;
      }
      words.add(
          OcrWord.builder()
              .text(b.text().strip())
              .confidence(Math.min(100.0, conf))
              .x(Math.round(box.left() * w))
              .y(Math.round(box.top() * h))
              .width(Math.max(1, Math.round(box.width() * w)))
              .height(Math.max(1, Math.round(box.height() * h)))
              .build());
    }
    double seconds = (System.nanoTime() - t0) / 1e9;
    log.debug("ocr.textract.success words={} kept={} seconds={}", total, words.size(), seconds);
    return OcrResult.fromWords(ID, words, seconds);
  }
}
