package com.cario.exam.app.service.parse;

import com.cario.exam.app.model.AnswerOption;
import com.cario.exam.app.model.QuestionType;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores each question type by the cue phrases found in the question text and the shape of its
 * options; the highest score wins. No cue at all yields {@link QuestionType#UNKNOWN}.
 */
public class QuestionTypeClassifier {

  private static final List<Pattern> MULTI_SELECT =
      List.of(
          Pattern.compile("select\\s+all"),
          Pattern.compile("choose\\s+(?:all|multiple)\\s+correct"),
          Pattern.compile("(?:mark|tick|check)\\s+all"),
          Pattern.compile("which\\s+of\\s+the\\s+following\\s+are"));

  private static final List<Pattern> TRUE_FALSE =
      List.of(
          Pattern.compile("true\\s*(?:or|/)\\s*false"),
          Pattern.compile("state\\s+(?:whether\\s+)?true"));

  private static final List<Pattern> FILL_BLANK =
      List.of(
          Pattern.compile("_{2,}"),
          Pattern.compile("\\(\\s{2,}\\)"),
          Pattern.compile("\\.{4,}"),
          Pattern.compile("(?i)fill\\s+in\\s+the\\s+blank"));

  private static final List<Pattern> MCQ =
      List.of(
          Pattern.compile("which\\s+(?:of\\s+)?(?:the\\s+)?following"),
          Pattern.compile("choose\\s+(?:the\\s+)?(?:correct|best)"),
          Pattern.compile("select\\s+(?:the\\s+)?(?:correct|best)"));

  private static final List<Pattern> ESSAY =
      List.of(
          Pattern.compile("\\b(?:explain|describe|discuss|analy[sz]e|evaluate|justify)\\b"),
          Pattern.compile("write\\s+(?:a\\s+)?(?:short\\s+)?(?:note|essay|paragraph)"));

  public QuestionType classify(String questionText, List<AnswerOption> options) {
    if (questionText == null || questionText.isBlank()) {
      return options == null || options.isEmpty() ? QuestionType.UNKNOWN : QuestionType.MCQ;
    }
    String lower = questionText.toLowerCase(Locale.ROOT);
    int optionCount = options == null ? 0 : options.size();
    Map<QuestionType, Double> scores = new EnumMap<>(QuestionType.class);

    add(scores, QuestionType.MULTI_SELECT, 3.0 * count(MULTI_SELECT, lower));
    add(scores, QuestionType.TRUE_FALSE, 2.5 * count(TRUE_FALSE, lower));
    if (optionCount == 2 && isTrueFalsePair(options)) {
      add(scores, QuestionType.TRUE_FALSE, 3.0);
    }
    // blanks are matched on the original text so runs of spaces survive
    add(scores, QuestionType.FILL_BLANK, 2.0 * count(FILL_BLANK, questionText));
    add(scores, QuestionType.MCQ, 1.5 * count(MCQ, lower));
    if (optionCount >= 2) {
      add(scores, QuestionType.MCQ, optionCount >= 4 ? 3.0 : 2.0);
    }
    if (optionCount == 0) {
      add(scores, QuestionType.ESSAY, 1.5 * count(ESSAY, lower));
      if (lower.split("\\s+").length > 20) {
        add(scores, QuestionType.ESSAY, 1.0);
      }
    }

    return scores.entrySet().stream()
        .filter(e -> e.getValue() > 0)
        .max(Map.Entry.comparingByValue())
        .map(Map.Entry::getKey)
        .orElse(QuestionType.UNKNOWN);
  }

  private static boolean isTrueFalsePair(List<AnswerOption> options) {
    String joined =
        (options.get(0).getText() + " " + options.get(1).getText()).toLowerCase(Locale.ROOT);
    return joined.contains("true") && joined.contains("false");
  }

  private static int count(List<Pattern> patterns, String text) {
    int n = 0;
    for (Pattern p : patterns) {
      if (p.matcher(text).find()) {
        n++;
      }
    }
    return n;
  }

  private static void add(Map<QuestionType, Double> scores, QuestionType type, double value) {
    if (value > 0) {
      scores.merge(type, value, Double::sum);
    }
  }
}
