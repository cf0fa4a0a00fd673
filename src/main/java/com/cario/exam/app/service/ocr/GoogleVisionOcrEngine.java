package com.cario.exam.app.service.ocr;

import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.util.ImageUtils;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Block;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.Page;
import com.google.cloud.vision.v1.Paragraph;
import com.google.cloud.vision.v1.Symbol;
import com.google.cloud.vision.v1.Vertex;
import com.google.cloud.vision.v1.Word;
import com.google.protobuf.ByteString;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Google Cloud Vision DOCUMENT_TEXT_DETECTION. Vision reports word confidence in 0-1; it is scaled
 * to 0-100 here.
 */
@Log4j2
public class GoogleVisionOcrEngine implements OcrEngine {

  public static final String ID = "google-vision";

  private final ImageAnnotatorClient client;
  private final double minWordConfidence;

  public GoogleVisionOcrEngine(ImageAnnotatorClient client, double minWordConfidence) {
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.minWordConfidence = minWordConfidence;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public OcrResult recognize(BufferedImage image) {
    long t0 = System.nanoTime();
    Image img = Image.newBuilder().setContent(ByteString.copyFrom(ImageUtils.toPng(image))).build();
    Feature feat = Feature.newBuilder().setType(Feature.Type.DOCUMENT_TEXT_DETECTION).build();
    AnnotateImageRequest req =
        AnnotateImageRequest.newBuilder().addFeatures(feat).setImage(img).build();

    AnnotateImageResponse resp;
    try {
      BatchAnnotateImagesResponse batch = client.batchAnnotateImages(List.of(req));
      resp = batch.getResponses(0);
    } catch (RuntimeException e) {
      throw new OcrProcessingException("GCV call failed: " + e.getMessage(), e);
    }
    if (resp.hasError()) {
      throw new OcrProcessingException("GCV error: " + resp.getError().getMessage());
    }

    List<OcrWord> words = new ArrayList<>();
    for (Page page : resp.getFullTextAnnotation().getPagesList()) {
      for (Block block : page.getBlocksList()) {
        for (Paragraph para : block.getParagraphsList()) {
          for (Word word : para.getWordsList()) {
            OcrWord w = toWord(word);
            if (w != null && w.getConfidence() >= minWordConfidence) {
              words.add(w);
            }
          }
        }
      }
    }
    double seconds = (System.nanoTime() - t0) / 1e9;
    log.debug("ocr.gcv.success kept={} seconds={}", words.size(), seconds);
    return OcrResult.fromWords(ID, words, seconds);
  }

  private static OcrWord toWord(Word word) {
    StringBuilder text = new StringBuilder();
    for (Symbol s : word.getSymbolsList()) {
      text.append(s.getText());
    }
    if (text.length() == 0 || word.getBoundingBox().getVerticesCount() == 0) {
      return null;
    }
    int minX = Integer.MAX_VALUE;
    int minY = Integer.MAX_VALUE;
    int maxX = 0;
    int maxY = 0;
    for (Vertex v : word.getBoundingBox().getVerticesList()) {
      minX = Math.min(minX, v.getX());
      minY = Math.min(minY, v.getY());
      maxX = Math.max(maxX, v.getX());
      maxY = Math.max(maxY, v.getY());
    }
    return OcrWord.builder()
        .text(text.toString())
        .confidence(word.getConfidence() * 100.0)
        .x(Math.max(0, minX))
        .y(Math.max(0, minY))
        .width(Math.max(1, maxX - minX))
        .height(Math.max(1, maxY - minY))
        .build();
  }
}
