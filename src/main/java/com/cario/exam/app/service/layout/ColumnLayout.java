package com.cario.exam.app.service.layout;

import com.cario.exam.app.model.TextLine;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/** One or two columns; with two, lines starting left of {@code breakX} belong to the first. */
@Value
public class ColumnLayout {

  int columnCount;

  /** Meaningful only when {@code columnCount == 2}. */
  int breakX;

  public static ColumnLayout single() {
    return new ColumnLayout(1, Integer.MAX_VALUE);
  }

  public static ColumnLayout twoColumns(int breakX) {
    return new ColumnLayout(2, breakX);
  }

  public int columnOf(TextLine line) {
    return columnCount == 2 && line.getX() >= breakX ? 1 : 0;
  }

  /** Lines split per column, each list keeping the input order. */
  public List<List<TextLine>> split(List<TextLine> lines) {
    List<List<TextLine>> columns = new ArrayList<>();
    for (int i = 0; i < columnCount; i++) {
      columns.add(new ArrayList<>());
    }
    for (TextLine l : lines) {
      columns.get(columnOf(l)).add(l);
    }
    return columns;
  }
}
