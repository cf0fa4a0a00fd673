package com.cario.exam.app.service.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.cario.exam.app.model.AnswerOption;
import com.cario.exam.app.model.QuestionType;
import java.util.List;
import org.junit.jupiter.api.Test;

class QuestionTypeClassifierTest {

  private final QuestionTypeClassifier classifier = new QuestionTypeClassifier();

  private static final List<AnswerOption> FOUR =
      List.of(
          new AnswerOption("a", "2"),
          new AnswerOption("b", "4"),
          new AnswerOption("c", "6"),
          new AnswerOption("d", "9"));

  @Test
  void fourOptionsReadAsMultipleChoice() {
    assertEquals(
        QuestionType.MCQ, classifier.classify("Which of the following is a prime?", FOUR));
  }

  @Test
  void selectAllCueWinsOverAShortOptionList() {
    assertEquals(
        QuestionType.MULTI_SELECT,
        classifier.classify("Select all even numbers.", FOUR.subList(0, 3)));
  }

  @Test
  void trueFalsePairIsRecognized() {
    List<AnswerOption> options =
        List.of(new AnswerOption("a", "True"), new AnswerOption("b", "False"));

    assertEquals(QuestionType.TRUE_FALSE, classifier.classify("The sun is a star.", options));
  }

  @Test
  void blanksAndEssayCuesWithoutOptions() {
    assertEquals(
        QuestionType.FILL_BLANK, classifier.classify("The capital of France is ____.", List.of()));
    assertEquals(
        QuestionType.ESSAY,
        classifier.classify("Explain the causes of the First World War.", List.of()));
  }

  @Test
  void noCueIsUnknownAndOptionsAloneMeanMultipleChoice() {
    assertEquals(QuestionType.UNKNOWN, classifier.classify("Hello there", List.of()));
    assertEquals(QuestionType.MCQ, classifier.classify(null, FOUR));
  }
}
