package com.cario.exam.app.service.parse;

import com.cario.exam.app.model.AnswerOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognizers for numbered question starts and lettered answer options. */
public final class QuestionPatterns {

  /** Option letters in the only order a valid group may use. */
  public static final List<String> OPTION_LETTERS = List.of("a", "b", "c", "d");

  private static final List<Pattern> QUESTION_STARTS =
      List.of(
          Pattern.compile("^\\s*(\\d+)\\.\\s+"),
          Pattern.compile("^\\s*Q\\.?\\s*(\\d+)[:.]?\\s*", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*(\\d+)\\)\\s*"));

  private static final Pattern OPTION_LINE =
      Pattern.compile("^\\s*\\(([a-d])\\)\\s*(.+)", Pattern.CASE_INSENSITIVE);

  /** An option label such as {@code (b)} at the start of the line or after whitespace. */
  private static final Pattern PAREN_LABEL =
      Pattern.compile("(?<!\\S)\\(([a-d])\\)", Pattern.CASE_INSENSITIVE);

  /** An option label such as {@code b)} at the start of the line or after whitespace. */
  private static final Pattern BARE_LABEL =
      Pattern.compile("(?<!\\S)([a-d])\\)", Pattern.CASE_INSENSITIVE);

  private QuestionPatterns() {}

  /** Question number if {@code line} starts a question, otherwise null. */
  public static String questionNumber(String line) {
    if (line == null || isOptionLine(line)) {
      return null;
    }
    for (Pattern p : QUESTION_STARTS) {
      Matcher m = p.matcher(line);
      if (m.find()) {
        return m.group(1);
      }
    }
    return null;
  }

  public static boolean isQuestionStart(String line) {
    return questionNumber(line) != null;
  }

  /** The line with its leading question number removed. */
  public static String stripQuestionNumber(String line) {
    for (Pattern p : QUESTION_STARTS) {
      Matcher m = p.matcher(line);
      if (m.find()) {
        return line.substring(m.end()).strip();
      }
    }
    return line.strip();
  }

  public static boolean isOptionLine(String line) {
    return line != null && OPTION_LINE.matcher(line).find();
  }

  /**
   * All options on one line, handling both {@code (a) x (b) y} and {@code a) x b) y}. Each option
   * runs up to the next label, so its text may hold parentheses of its own, as in {@code (b) f(x)
   * = 2}. Returns an empty list for lines that do not start with an option label.
   */
  public static List<AnswerOption> parseOptions(String line) {
    List<AnswerOption> out = new ArrayList<>();
    if (line == null || line.isBlank()) {
      return out;
    }
    String trimmed = line.strip();
    Matcher m = (trimmed.startsWith("(") ? PAREN_LABEL : BARE_LABEL).matcher(trimmed);
    if (!m.find() || m.start() != 0) {
      return out;
    }
    String letter = m.group(1);
    int textStart = m.end();
    while (m.find()) {
      addOption(out, letter, trimmed.substring(textStart, m.start()));
      letter = m.group(1);
      textStart = m.end();
    }
    addOption(out, letter, trimmed.substring(textStart));
    return out;
  }

  /** Whether {@code letters} equals a prefix of a, b, c, d of at least {@code minOptions}. */
  public static boolean isContiguousPrefix(List<String> letters, int minOptions) {
    if (letters.size() < minOptions || letters.size() > OPTION_LETTERS.size()) {
      return false;
    }
    return letters.equals(OPTION_LETTERS.subList(0, letters.size()));
  }

  private static void addOption(List<AnswerOption> out, String letter, String text) {
    String t = text == null ? "" : text.strip();
    if (!t.isEmpty()) {
      out.add(new AnswerOption(letter.toLowerCase(Locale.ROOT), t));
    }
  }
}
