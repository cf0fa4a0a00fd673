package com.cario.exam.app;

import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.TextLine;
import java.util.List;

/** OCR words and lines placed by hand for layout and detection tests. */
public final class Lines {

  public static final int HEIGHT = 20;

  private Lines() {}

  public static OcrWord word(String text, int x, int y, int width) {
    return OcrWord.builder()
        .text(text)
        .confidence(90)
        .x(x)
        .y(y)
        .width(width)
        .height(HEIGHT)
        .build();
  }

  /** A single-word line; the width follows the text length. */
  public static TextLine line(String text, int x, int y) {
    return new TextLine(List.of(word(text, x, y, Math.max(10, text.length() * 9))));
  }
}
