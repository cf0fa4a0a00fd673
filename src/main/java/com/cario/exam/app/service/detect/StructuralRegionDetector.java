package com.cario.exam.app.service.detect;

import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.model.AnswerOption;
import com.cario.exam.app.model.BoundingBox;
import com.cario.exam.app.model.QuestionGroup;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.model.TextLine;
import com.cario.exam.app.service.layout.PageLayout;
import com.cario.exam.app.service.parse.QuestionPatterns;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Finds numbered questions and their lettered options in OCR lines, column by column.
 *
 * <p>A question starts at a line such as {@code 114. }, {@code Q.1} or {@code 114) } and takes the
 * following lines until an option line, another question or the continuation limit. Its options
 * are the option lines below it and above the next question in the same column, starting within
 * {@code columnTolerance} pixels of the question's left edge. A group is emitted only when its
 * option letters read a, b, c, d from the start without gaps.
 */
@Log4j2
public class StructuralRegionDetector {

  static final double BASE_CONFIDENCE = 0.95;
  static final double FULL_SET_BOOST = 0.15;
  static final double PARTIAL_SET_BOOST = 0.10;
  static final double MAX_CONFIDENCE = 0.98;

  private final int columnTolerance;
  private final int maxQuestionLines;
  private final int padding;
  private final int minOptions;

  public StructuralRegionDetector(ExtractionProperties.Detection cfg) {
    this.columnTolerance = cfg.getColumnTolerance();
    this.maxQuestionLines = cfg.getMaxContinuationLines();
    this.padding = cfg.getPadding();
    this.minOptions = cfg.getMinOptions();
  }

  public List<QuestionGroup> detect(PageLayout layout) {
    List<QuestionGroup> groups = new ArrayList<>();
    List<List<TextLine>> columns = layout.getColumns().split(layout.getLines());
    int rejected = 0;
    for (int c = 0; c < columns.size(); c++) {
      ColumnScan scan = scanColumn(columns.get(c));
      rejected += group(scan, c, layout.getPageNumber(), groups);
    }
    log.debug(
        "detect.structural page={} columns={} groups={} rejected={}",
        layout.getPageNumber(),
        columns.size(),
        groups.size(),
        rejected);
    return groups;
  }

  // -------------------- SCAN --------------------

  private ColumnScan scanColumn(List<TextLine> column) {
    List<TextLine> lines = new ArrayList<>(column);
    lines.sort(Comparator.comparingInt(TextLine::getY).thenComparingInt(TextLine::getX));
    ColumnScan scan = new ColumnScan();
    QuestionStart current = null;
    for (TextLine line : lines) {
      String text = line.getText();
      if (QuestionPatterns.isOptionLine(text)) {
        scan.options.add(new OptionLine(line, QuestionPatterns.parseOptions(text)));
        current = null;
        continue;
      }
      String number = QuestionPatterns.questionNumber(text);
      if (number != null) {
        current = new QuestionStart(number);
        current.lines.add(line);
        scan.questions.add(current);
      } else if (current != null && current.lines.size() < maxQuestionLines) {
        current.lines.add(line);
      }
    }
    return scan;
  }

  // -------------------- GROUP --------------------

  /** Appends the valid groups of one column; returns how many questions were rejected. */
  private int group(ColumnScan scan, int column, int page, List<QuestionGroup> out) {
    int rejected = 0;
    for (int i = 0; i < scan.questions.size(); i++) {
      QuestionStart q = scan.questions.get(i);
      TextLine first = q.lines.get(0);
      TextLine last = q.lines.get(q.lines.size() - 1);
      int nextStart =
          i + 1 < scan.questions.size()
              ? scan.questions.get(i + 1).lines.get(0).getY()
              : Integer.MAX_VALUE;

      List<OptionLine> owned =
          scan.options.stream()
              .filter(o -> o.line.getY() > last.getY() && o.line.getY() < nextStart)
              .filter(o -> Math.abs(o.line.getX() - first.getX()) < columnTolerance)
              .sorted(Comparator.comparingInt((OptionLine o) -> o.line.getY()))
              .collect(Collectors.toList());

      List<AnswerOption> options = new ArrayList<>();
      owned.forEach(o -> options.addAll(o.options));
      List<String> letters =
          options.stream().map(AnswerOption::getLetter).collect(Collectors.toList());
      if (!QuestionPatterns.isContiguousPrefix(letters, minOptions)) {
        rejected++;
        log.debug(
            "detect.structural.rejected page={} question={} letters={}", page, q.number, letters);
        continue;
      }
      out.add(build(q, owned, options, letters, column, page));
    }
    return rejected;
  }

  private QuestionGroup build(
      QuestionStart q,
      List<OptionLine> owned,
      List<AnswerOption> options,
      List<String> letters,
      int column,
      int page) {
    BoundingBox box = q.lines.get(0).box();
    List<String> texts = new ArrayList<>();
    for (TextLine l : q.lines) {
      box = box.union(l.box());
      texts.add(l.getText());
    }
    for (OptionLine o : owned) {
      box = box.union(o.line.box());
      texts.add(o.line.getText());
    }

    StringBuilder questionText =
        new StringBuilder(QuestionPatterns.stripQuestionNumber(texts.get(0)));
    for (int i = 1; i < q.lines.size(); i++) {
      questionText.append(' ').append(q.lines.get(i).getText().strip());
    }

    boolean complete = options.size() == QuestionPatterns.OPTION_LETTERS.size();
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("detection_method", "structural");
    meta.put("question_number", q.number);
    meta.put("option_count", options.size());
    meta.put("option_labels", letters);
    meta.put("is_complete", complete);
    meta.put("column", column);

    Region region =
        Region.of(
                box.padded(padding),
                page,
                RegionType.QUESTION_GROUP,
                confidenceFor(options.size()),
                String.join("\n", texts))
            .withMetadata(meta);

    return QuestionGroup.builder()
        .region(region)
        .questionNumber(q.number)
        .questionText(questionText.toString().strip())
        .options(options)
        .complete(complete)
        .column(column)
        .build();
  }

  static double confidenceFor(int optionCount) {
    double boost =
        optionCount >= 4 ? FULL_SET_BOOST : (optionCount >= 2 ? PARTIAL_SET_BOOST : 0.0);
    return Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + boost);
  }

  private static final class ColumnScan {
    final List<QuestionStart> questions = new ArrayList<>();
    final List<OptionLine> options = new ArrayList<>();
  }

  private static final class QuestionStart {
    final String number;
    final List<TextLine> lines = new ArrayList<>();

    QuestionStart(String number) {
      this.number = number;
    }
  }

  private static final class OptionLine {
    final TextLine line;
    final List<AnswerOption> options;

    OptionLine(TextLine line, List<AnswerOption> options) {
      this.line = line;
      this.options = options;
    }
  }
}
