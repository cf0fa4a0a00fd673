package com.cario.exam.app.service.layout;

import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.TextLine;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts OCR words into lines. Words whose vertical extents overlap by at least half of the shorter
 * word share a line; within a line, a horizontal gap wider than {@code splitGap} starts a new line
 * so words from side-by-side columns are never joined.
 */
public class LineAssembler {

  private final double minWordConfidence;
  private final int splitGap;

  public LineAssembler(double minWordConfidence, int splitGap) {
    this.minWordConfidence = minWordConfidence;
    this.splitGap = splitGap;
  }

  /**
   * Keeps words above the confidence floor and drops single-character punctuation noise. Single
   * letters and digits survive because option labels and answers can be one character.
   */
  public List<OcrWord> filter(List<OcrWord> words) {
    List<OcrWord> kept = new ArrayList<>();
    for (OcrWord w : words) {
      String t = w.getText() == null ? "" : w.getText().strip();
      if (t.isEmpty() || w.getConfidence() <= minWordConfidence) {
        continue;
      }
      if (t.length() == 1 && !Character.isLetterOrDigit(t.charAt(0))) {
        continue;
      }
      kept.add(w);
    }
    return kept;
  }

  /** Lines in reading order: top to bottom, then left to right. */
  public List<TextLine> assemble(List<OcrWord> words) {
    List<OcrWord> sorted = new ArrayList<>(filter(words));
    sorted.sort(Comparator.comparingDouble(OcrWord::getCenterY).thenComparingInt(OcrWord::getX));

    List<List<OcrWord>> rows = new ArrayList<>();
    List<OcrWord> current = new ArrayList<>();
    int rowTop = 0;
    int rowBottom = 0;
    for (OcrWord w : sorted) {
      if (!current.isEmpty() && sharesRow(rowTop, rowBottom, w)) {
        current.add(w);
        rowTop = Math.min(rowTop, w.getY());
        rowBottom = Math.max(rowBottom, w.getY2());
        continue;
      }
      if (!current.isEmpty()) {
        rows.add(current);
      }
      current = new ArrayList<>();
      current.add(w);
      rowTop = w.getY();
      rowBottom = w.getY2();
    }
    if (!current.isEmpty()) {
      rows.add(current);
    }

    List<TextLine> lines = new ArrayList<>();
    for (List<OcrWord> row : rows) {
      row.sort(Comparator.comparingInt(OcrWord::getX));
      List<OcrWord> segment = new ArrayList<>();
      for (OcrWord w : row) {
        if (!segment.isEmpty() && w.getX() - segment.get(segment.size() - 1).getX2() > splitGap) {
          lines.add(new TextLine(segment));
          segment = new ArrayList<>();
        }
        segment.add(w);
      }
      lines.add(new TextLine(segment));
    }
    lines.sort(Comparator.comparingInt(TextLine::getY).thenComparingInt(TextLine::getX));
    return lines;
  }

  private static boolean sharesRow(int top, int bottom, OcrWord w) {
    int overlap = Math.min(bottom, w.getY2()) - Math.max(top, w.getY());
    int shorter = Math.max(1, Math.min(bottom - top, w.getHeight()));
    return overlap >= shorter / 2.0;
  }
}
