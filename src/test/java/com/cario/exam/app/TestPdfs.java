package com.cario.exam.app;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/** Small PDFs built in memory with PDFBox. */
public final class TestPdfs {

  private TestPdfs() {}

  /** One page per entry, its lines written top down. An empty entry gives a blank page. */
  public static byte[] pages(String[]... pages) {
    try (PDDocument doc = new PDDocument()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (String[] lines : pages) {
        PDPage page = new PDPage();
        doc.addPage(page);
        if (lines.length == 0) {
          continue;
        }
        try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
          cs.beginText();
          cs.setFont(font, 12);
          cs.newLineAtOffset(72, 720);
          for (String line : lines) {
            cs.showText(line);
            cs.newLineAtOffset(0, -18);
          }
          cs.endText();
        }
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      doc.save(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String[] questionPage() {
    return new String[] {
      "1. What is the capital of France?",
      "(a) Paris",
      "(b) London",
      "(c) Rome",
      "(d) Berlin"
    };
  }
}
