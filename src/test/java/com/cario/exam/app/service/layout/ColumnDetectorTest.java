package com.cario.exam.app.service.layout;

import static com.cario.exam.app.Lines.line;
import static com.cario.exam.app.Lines.word;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.cario.exam.app.model.TextLine;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColumnDetectorTest {

  private final ColumnDetector detector = new ColumnDetector(80, 80);

  private static TextLine wide(int x, int y, int width) {
    return new TextLine(List.of(word("text", x, y, width)));
  }

  @Test
  void detectsTwoColumnsWithTheBreakInTheGap() {
    ColumnLayout layout =
        detector.detect(
            List.of(wide(50, 100, 200), wide(50, 140, 180), wide(400, 100, 200),
                wide(400, 140, 150)));

    assertEquals(2, layout.getColumnCount());
    assertEquals(225, layout.getBreakX());
  }

  @Test
  void indentedOptionsStayInOneColumn() {
    ColumnLayout layout =
        detector.detect(
            List.of(line("1. Question", 50, 100), line("(a) one", 70, 130),
                line("(b) two", 70, 160)));

    assertEquals(1, layout.getColumnCount());
  }

  @Test
  void linesSpanningTheGapKeepASingleColumn() {
    ColumnLayout layout =
        detector.detect(
            List.of(wide(50, 100, 600), wide(50, 140, 600), wide(50, 180, 600),
                wide(400, 220, 100)));

    assertEquals(1, layout.getColumnCount());
  }

  @Test
  void oneLineIsOneColumn() {
    assertEquals(1, detector.detect(List.of(wide(400, 100, 50))).getColumnCount());
  }
}
