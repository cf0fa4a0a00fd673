package com.cario.exam.app.service.pdf;

import com.cario.exam.app.model.OcrWord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Reads the embedded text layer of a PDF page, both as plain text and as positioned words.
 *
 * <p>PDF coordinates are points (1/72 inch); words are scaled to the requested DPI so they line up
 * with the rendered page.
 */
public class PdfTextLayerReader {

  static final double POINTS_PER_INCH = 72.0;

  public String pageText(PDDocument document, int pageNumber) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);
    stripper.setStartPage(pageNumber);
    stripper.setEndPage(pageNumber);
    return stripper.getText(document);
  }

  public List<OcrWord> words(PDDocument document, int pageNumber, float dpi) throws IOException {
    WordCollector collector = new WordCollector(dpi / POINTS_PER_INCH);
    collector.setSortByPosition(true);
    collector.setStartPage(pageNumber);
    collector.setEndPage(pageNumber);
    collector.getText(document);
    return collector.words;
  }

  private static final class WordCollector extends PDFTextStripper {

    private final double scale;
    private final List<OcrWord> words = new ArrayList<>();

    WordCollector(double scale) {
      this.scale = scale;
    }

    @Override
    protected void writeString(String text, List<TextPosition> positions) throws IOException {
      List<TextPosition> current = new ArrayList<>();
      for (TextPosition tp : positions) {
        if (tp.getUnicode() == null || tp.getUnicode().isBlank()) {
          flush(current);
        } else {
          current.add(tp);
        }
      }
      flush(current);
      super.writeString(text, positions);
    }

    private void flush(List<TextPosition> chars) {
      if (chars.isEmpty()) {
        return;
      }
      StringBuilder sb = new StringBuilder();
      float left = Float.MAX_VALUE;
      float right = 0f;
      float top = Float.MAX_VALUE;
      float bottom = 0f;
      for (TextPosition tp : chars) {
        sb.append(tp.getUnicode());
        left = Math.min(left, tp.getXDirAdj());
        right = Math.max(right, tp.getXDirAdj() + tp.getWidthDirAdj());
        // YDirAdj is the baseline measured from the top of the page
        top = Math.min(top, tp.getYDirAdj() - tp.getHeightDir());
        bottom = Math.max(bottom, tp.getYDirAdj());
      }
      chars.clear();
      int x = (int) Math.max(0, Math.round(left * scale));
      int y = (int) Math.max(0, Math.round(top * scale));
      words.add(
          OcrWord.builder()
              .text(sb.toString())
              .confidence(100.0)
              .x(x)
              .y(y)
              .width(Math.max(1, (int) Math.round((right - left) * scale)))
              .height(Math.max(1, (int) Math.round((bottom - top) * scale)))
              .build());
    }
  }
}
