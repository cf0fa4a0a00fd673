package com.cario.exam.app.service.layout;

import com.cario.exam.app.model.TextLine;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/** Lines of one page together with its column structure. */
@Value
public class PageLayout {

  int pageNumber;
  List<TextLine> lines;
  ColumnLayout columns;

  /** Page text in reading order: each column top to bottom, left column first. */
  public String readingOrderText() {
    return columns.split(lines).stream()
        .flatMap(List::stream)
        .map(TextLine::getText)
        .collect(Collectors.joining("\n"));
  }
}
