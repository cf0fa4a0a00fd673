package com.cario.exam.app.service.pdf;

import com.cario.exam.app.model.TextType;
import lombok.extern.log4j.Log4j2;

/**
 * Decides whether a document carries a usable text layer. A document is searchable when every page
 * has at least {@code minCharsPerPage} non-whitespace characters of embedded text; image uploads
 * never are.
 */
@Log4j2
public class TextTypeDetector {

  private final int minCharsPerPage;

  public TextTypeDetector(int minCharsPerPage) {
    this.minCharsPerPage = minCharsPerPage;
  }

  public TextType detect(PageSource pages) {
    int count = pages.pageCount();
    for (int p = 1; p <= count; p++) {
      long chars = pages.pageText(p).chars().filter(c -> !Character.isWhitespace(c)).count();
      if (chars < minCharsPerPage) {
        log.debug("texttype.scanned page={} chars={} min={}", p, chars, minCharsPerPage);
        return TextType.SCANNED;
      }
    }
    return count == 0 ? TextType.SCANNED : TextType.SEARCHABLE;
  }
}
