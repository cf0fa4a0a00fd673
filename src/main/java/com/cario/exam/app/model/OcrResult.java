package com.cario.exam.app.model;

import java.awt.geom.AffineTransform;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Output of one OCR engine over one image. Confidence is always on the 0-100 scale; engines that
 * report 0-1 are converted before a result is built.
 */
@Value
@Builder(toBuilder = true)
public class OcrResult {

  String text;

  /** Mean of the kept word confidences, 0-100. */
  double confidence;

  String engineId;

  double processingTimeSeconds;

  @Singular List<OcrWord> words;

  @Singular("preprocessingStep")
  List<String> preprocessingApplied;

  public List<Double> getWordConfidences() {
    return words.stream().map(OcrWord::getConfidence).collect(Collectors.toList());
  }

  public int textLength() {
    return text == null ? 0 : text.strip().length();
  }

  public boolean isEmpty() {
    return textLength() == 0;
  }

  /** Copy with every word box multiplied by {@code factor}. */
  public OcrResult scaled(double factor) {
    if (factor == 1.0) {
      return this;
    }
    return toBuilder()
        .clearWords()
        .words(words.stream().map(w -> w.scaled(factor)).collect(Collectors.toList()))
        .build();
  }

  /** Copy with every word box mapped through {@code t}. */
  public OcrResult transformed(AffineTransform t) {
    if (t.isIdentity()) {
      return this;
    }
    return toBuilder()
        .clearWords()
        .words(words.stream().map(w -> w.transformed(t)).collect(Collectors.toList()))
        .build();
  }

  public static OcrResult empty(String engineId) {
    return OcrResult.builder().engineId(engineId).text("").confidence(0.0).build();
  }

  /**
   * Builds a result from kept words in reading order. A word whose vertical centre lies below the
   * previous word starts a new line of text.
   */
  public static OcrResult fromWords(String engineId, List<OcrWord> words, double seconds) {
    StringBuilder text = new StringBuilder();
    OcrWord prev = null;
    for (OcrWord w : words) {
      if (prev != null) {
        text.append(w.getCenterY() > prev.getY2() ? '\n' : ' ');
      }
      text.append(w.getText());
      prev = w;
    }
    double avg = words.stream().mapToDouble(OcrWord::getConfidence).average().orElse(0.0);
    return OcrResult.builder()
        .engineId(engineId)
        .text(text.toString())
        .confidence(avg)
        .processingTimeSeconds(seconds)
        .words(words)
        .build();
  }
}
