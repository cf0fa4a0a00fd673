package com.cario.exam.app.service.layout;

import static com.cario.exam.app.Lines.word;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class LayoutAnalyzerTest {

  private final LayoutAnalyzer analyzer =
      new LayoutAnalyzer(new LineAssembler(30, 80), new ColumnDetector(80, 80));

  @Test
  void readsTheLeftColumnBeforeTheRight() {
    PageLayout layout =
        analyzer.analyze(
            2,
            List.of(
                word("1.", 50, 100, 20),
                word("Left", 75, 100, 60),
                word("5.", 450, 100, 20),
                word("Right", 475, 100, 60),
                word("(a)", 60, 140, 25),
                word("x", 90, 140, 10),
                word("(a)", 460, 140, 25),
                word("y", 490, 140, 10)));

    assertEquals(2, layout.getPageNumber());
    assertEquals(2, layout.getColumns().getColumnCount());
    assertEquals("1. Left\n(a) x\n5. Right\n(a) y", layout.readingOrderText());
  }
}
