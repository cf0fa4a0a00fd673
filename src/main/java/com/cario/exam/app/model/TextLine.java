package com.cario.exam.app.model;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/** A horizontal run of OCR words read left to right. */
@Value
public class TextLine {

  List<OcrWord> words;
  String text;
  int x;
  int y;
  int width;
  int height;
  double confidence;

  public TextLine(List<OcrWord> words) {
    if (words == null || words.isEmpty()) {
      throw new IllegalArgumentException("a text line needs at least one word");
    }
    this.words = List.copyOf(words);
    this.text = words.stream().map(OcrWord::getText).collect(Collectors.joining(" "));
    int minX = Integer.MAX_VALUE;
    int minY = Integer.MAX_VALUE;
    int maxX = Integer.MIN_VALUE;
    int maxY = Integer.MIN_VALUE;
    for (OcrWord w : words) {
      minX = Math.min(minX, w.getX());
      minY = Math.min(minY, w.getY());
      maxX = Math.max(maxX, w.getX2());
      maxY = Math.max(maxY, w.getY2());
    }
    this.x = minX;
    this.y = minY;
    this.width = Math.max(1, maxX - minX);
    this.height = Math.max(1, maxY - minY);
    this.confidence = words.stream().mapToDouble(OcrWord::getConfidence).average().orElse(0.0);
  }

  public int getX2() {
    return x + width;
  }

  public int getY2() {
    return y + height;
  }

  public BoundingBox box() {
    return BoundingBox.of(x, y, width, height);
  }
}
