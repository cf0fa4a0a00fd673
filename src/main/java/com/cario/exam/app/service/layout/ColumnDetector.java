package com.cario.exam.app.service.layout;

import com.cario.exam.app.model.TextLine;
import java.util.List;
import java.util.TreeSet;
import lombok.extern.log4j.Log4j2;

/**
 * Decides between one and two text columns from where lines start.
 *
 * <p>The distinct line start x values are sorted and the widest gap between neighbours is taken.
 * Two columns are declared when that gap is wider than {@code minGap}, reaches {@code
 * significance}, and the lines on the left mostly end before the right cluster begins. The last
 * check keeps indented option lines under a question from reading as a second column. The break
 * lies in the middle of the gap.
 */
@Log4j2
public class ColumnDetector {

  static final double MAX_CROSSING_FRACTION = 0.2;

  private final int minGap;
  private final int significance;

  public ColumnDetector(int minGap, int significance) {
    this.minGap = minGap;
    this.significance = significance;
  }

  public ColumnLayout detect(List<TextLine> lines) {
    if (lines.size() < 2) {
      return ColumnLayout.single();
    }
    TreeSet<Integer> starts = new TreeSet<>();
    lines.forEach(l -> starts.add(l.getX()));

    int bestGap = 0;
    int gapStart = 0;
    Integer prev = null;
    for (int x : starts) {
      if (prev != null && x - prev > bestGap) {
        bestGap = x - prev;
        gapStart = prev;
      }
      prev = x;
    }
    if (bestGap <= minGap || bestGap < significance) {
      return ColumnLayout.single();
    }

    final int leftEnd = gapStart;
    final int rightStart = gapStart + bestGap;
    long left = lines.stream().filter(l -> l.getX() <= leftEnd).count();
    long crossing =
        lines.stream().filter(l -> l.getX() <= leftEnd && l.getX2() > rightStart).count();
    if (left == 0 || (double) crossing / left > MAX_CROSSING_FRACTION) {
      log.debug("layout.columns.rejected gap={} crossing={} left={}", bestGap, crossing, left);
      return ColumnLayout.single();
    }
    int breakX = leftEnd + bestGap / 2;
    log.debug("layout.columns.two gap={} breakX={}", bestGap, breakX);
    return ColumnLayout.twoColumns(breakX);
  }
}
