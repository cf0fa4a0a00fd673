package com.cario.exam.app.service.pdf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.exam.app.TestImages;
import com.cario.exam.app.TestPdfs;
import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.TextType;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class TextTypeDetectorTest {

  private final PageSourceFactory factory =
      new PageSourceFactory(new PdfTextLayerReader(), new ExtractionProperties.Render());
  private final TextTypeDetector detector = new TextTypeDetector(50);

  private TextType detect(String filename, String extension, byte[] content) {
    ExamDocument doc =
        ExamDocument.builder()
            .id("d")
            .filename(filename)
            .extension(extension)
            .content(content)
            .build();
    try (PageSource pages = factory.open(doc)) {
      return detector.detect(pages);
    }
  }

  @Test
  void pdfWithATextLayerIsSearchable() {
    byte[] pdf = TestPdfs.pages(TestPdfs.questionPage(), TestPdfs.questionPage());

    assertEquals(TextType.SEARCHABLE, detect("paper.pdf", "pdf", pdf));
  }

  @Test
  void oneEmptyPageMakesThePdfScanned() {
    byte[] pdf = TestPdfs.pages(TestPdfs.questionPage(), new String[0]);

    assertEquals(TextType.SCANNED, detect("paper.pdf", "pdf", pdf));
  }

  @Test
  void imagesAreAlwaysScanned() throws IOException {
    ByteArrayOutputStream png = new ByteArrayOutputStream();
    ImageIO.write(TestImages.blank(200, 300), "png", png);

    assertEquals(TextType.SCANNED, detect("scan.png", "png", png.toByteArray()));
  }

  @Test
  void textLayerWordsAreReportedInDetectionPixels() {
    byte[] pdf = TestPdfs.pages(TestPdfs.questionPage());
    ExamDocument doc =
        ExamDocument.builder().id("d").filename("p.pdf").extension("pdf").content(pdf).build();

    try (PageSource pages = factory.open(doc)) {
      assertEquals(1, pages.pageCount());
      assertTrue(pages.pageText(1).contains("capital of France"));
      assertTrue(pages.textLayerWords(1).stream().anyMatch(w -> w.getText().equals("Paris")));
      // 72pt margin at 150 dpi
      assertTrue(pages.textLayerWords(1).stream().allMatch(w -> w.getX() >= 140));
      assertEquals(1275, pages.detectionImage(1).getWidth());
    }
  }
}
