package com.cario.exam.app.service.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads printed answer keys such as {@code Answer: (b)} or {@code Ans. c} out of region text. */
public class AnswerKeyExtractor {

  private static final Pattern ANSWER =
      Pattern.compile("(?i)\\b(?:ans(?:wer)?)\\s*[:.\\-]?\\s*\\(?([a-d])\\)?(?![a-z])");

  /** Distinct answer letters in order of appearance, lower case. */
  public List<String> extract(String text) {
    List<String> letters = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return letters;
    }
    Matcher m = ANSWER.matcher(text);
    while (m.find()) {
      String letter = m.group(1).toLowerCase(Locale.ROOT);
      if (!letters.contains(letter)) {
        letters.add(letter);
      }
    }
    return letters;
  }
}
