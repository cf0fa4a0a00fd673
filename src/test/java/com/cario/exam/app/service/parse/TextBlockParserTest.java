package com.cario.exam.app.service.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextBlockParserTest {

  private final TextBlockParser parser = new TextBlockParser();

  @Test
  void separatesQuestionTextFromOptions() {
    ParsedQuestion q =
        parser.parse(
            "1. What is the capital\nof France?\n(a) Paris (b) London\n(c) Rome\n(d) Berlin");

    assertEquals("1", q.getQuestionNumber());
    assertEquals("What is the capital of France?", q.getQuestionText());
    assertEquals(List.of("a", "b", "c", "d"), q.letters());
    assertEquals("London", q.getOptions().get(1).getText());
  }

  @Test
  void parsesThePlainFourOptionBlock() {
    ParsedQuestion q =
        parser.parse(
            "What is the capital of France?\n(a) London\n(b) Paris\n(c) Berlin\n(d) Madrid");

    assertNull(q.getQuestionNumber());
    assertEquals("What is the capital of France?", q.getQuestionText());
    assertEquals(List.of("a", "b", "c", "d"), q.letters());
    assertEquals("Paris", q.getOptions().get(1).getText());
    assertEquals("Madrid", q.getOptions().get(3).getText());
  }

  @Test
  void keepsParenthesesInsideOptionText() {
    ParsedQuestion q = parser.parse("What is f?\n(a) f(x) = 1\n(b) f(x) = 2\n(c) 3\n(d) 4");

    assertEquals("What is f?", q.getQuestionText());
    assertEquals(List.of("a", "b", "c", "d"), q.letters());
    assertEquals("f(x) = 1", q.getOptions().get(0).getText());
    assertEquals("f(x) = 2", q.getOptions().get(1).getText());
  }

  @Test
  void readsBareLetterOptions() {
    ParsedQuestion q = parser.parse("Q.12 2 + 2 = ?\na) 3 b) 4");

    assertEquals("12", q.getQuestionNumber());
    assertEquals("2 + 2 = ?", q.getQuestionText());
    assertEquals(List.of("a", "b"), q.letters());
    assertEquals("4", q.getOptions().get(1).getText());
  }

  @Test
  void firstOccurrenceOfALetterWinsAndOptionsAreSorted() {
    ParsedQuestion q = parser.parse("Pick one\n(b) second\n(a) first\n(a) again");

    assertNull(q.getQuestionNumber());
    assertEquals(List.of("a", "b"), q.letters());
    assertEquals("first", q.getOptions().get(0).getText());
  }

  @Test
  void blankTextYieldsAnEmptyQuestion() {
    ParsedQuestion q = parser.parse("  \n ");

    assertNull(q.getQuestionNumber());
    assertEquals("", q.getQuestionText());
    assertTrue(q.getOptions().isEmpty());
  }
}
