package com.cario.exam.app.service.layout;

import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.TextLine;
import java.util.List;
import java.util.Objects;

/** Words to lines to columns for a single page. */
public class LayoutAnalyzer {

  private final LineAssembler lineAssembler;
  private final ColumnDetector columnDetector;

  public LayoutAnalyzer(LineAssembler lineAssembler, ColumnDetector columnDetector) {
    this.lineAssembler = Objects.requireNonNull(lineAssembler, "lineAssembler must not be null");
    this.columnDetector =
        Objects.requireNonNull(columnDetector, "columnDetector must not be null");
  }

  public PageLayout analyze(int pageNumber, List<OcrWord> words) {
    List<TextLine> lines = lineAssembler.assemble(words);
    return new PageLayout(pageNumber, lines, columnDetector.detect(lines));
  }
}
