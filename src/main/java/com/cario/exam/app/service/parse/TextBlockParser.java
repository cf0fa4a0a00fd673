package com.cario.exam.app.service.parse;

import com.cario.exam.app.model.AnswerOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a block of OCR text into question text and lettered options.
 *
 * <p>Lines that hold option labels contribute options; every other line is question text, joined
 * with single spaces. A leading question number is removed and kept separately. Options come back
 * sorted by letter; when a letter repeats, the first occurrence wins.
 */
public class TextBlockParser {

  public ParsedQuestion parse(String text) {
    if (text == null || text.isBlank()) {
      return new ParsedQuestion(null, "", List.of());
    }
    String number = null;
    List<String> questionLines = new ArrayList<>();
    Map<String, AnswerOption> options = new LinkedHashMap<>();

    for (String raw : text.split("\\R")) {
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      List<AnswerOption> parsed = QuestionPatterns.parseOptions(line);
      if (!parsed.isEmpty()) {
        parsed.forEach(o -> options.putIfAbsent(o.getLetter(), o));
        continue;
      }
      if (questionLines.isEmpty() && QuestionPatterns.isQuestionStart(line)) {
        number = QuestionPatterns.questionNumber(line);
        line = QuestionPatterns.stripQuestionNumber(line);
        if (line.isEmpty()) {
          continue;
        }
      }
      questionLines.add(line);
    }

    List<AnswerOption> sorted = new ArrayList<>(options.values());
    sorted.sort(Comparator.comparing(AnswerOption::getLetter));
    return new ParsedQuestion(number, String.join(" ", questionLines), List.copyOf(sorted));
  }
}
