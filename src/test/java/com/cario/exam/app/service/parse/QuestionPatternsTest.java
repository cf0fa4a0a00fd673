package com.cario.exam.app.service.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.exam.app.model.AnswerOption;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class QuestionPatternsTest {

  private static List<String> texts(String line) {
    return QuestionPatterns.parseOptions(line).stream()
        .map(o -> o.getLetter() + "=" + o.getText())
        .collect(Collectors.toList());
  }

  @Test
  void optionTextRunsUpToTheNextLabel() {
    assertEquals(List.of("c=5 (approx.)", "d=6"), texts("(c) 5 (approx.) (d) 6"));
    assertEquals(List.of("b=Both (i) and (ii)"), texts("(b) Both (i) and (ii)"));
    assertEquals(List.of("a=f(x) = 1", "b=g(x)"), texts("a) f(x) = 1 b) g(x)"));
  }

  @Test
  void labelsInsideWordsAreNotSplitPoints() {
    List<AnswerOption> options = QuestionPatterns.parseOptions("(a) max(b) is largest");

    assertEquals(1, options.size());
    assertEquals("max(b) is largest", options.get(0).getText());
  }

  @Test
  void linesThatDoNotStartWithALabelHaveNoOptions() {
    assertTrue(QuestionPatterns.parseOptions("Which (a) is it?").isEmpty());
    assertTrue(QuestionPatterns.parseOptions("(e) out of range").isEmpty());
    assertTrue(QuestionPatterns.parseOptions("(a)").isEmpty());
  }
}
