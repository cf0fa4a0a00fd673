package com.cario.exam.app.service.detect;

import static com.cario.exam.app.Lines.line;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.exam.app.config.ExtractionProperties;
import com.cario.exam.app.model.AnswerOption;
import com.cario.exam.app.model.QuestionGroup;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.model.TextLine;
import com.cario.exam.app.service.layout.ColumnLayout;
import com.cario.exam.app.service.layout.PageLayout;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class StructuralRegionDetectorTest {

  private final StructuralRegionDetector detector =
      new StructuralRegionDetector(new ExtractionProperties.Detection());

  private static PageLayout page(TextLine... lines) {
    return new PageLayout(1, List.of(lines), ColumnLayout.single());
  }

  @Test
  void groupsAQuestionWithItsFourOptions() {
    List<QuestionGroup> groups =
        detector.detect(
            page(
                line("1. What is the capital of France?", 100, 100),
                line("(a) Paris", 120, 130),
                line("(b) London", 120, 160),
                line("(c) Rome", 120, 190),
                line("(d) Berlin", 120, 220)));

    assertEquals(1, groups.size());
    QuestionGroup g = groups.get(0);
    assertEquals("1", g.getQuestionNumber());
    assertEquals("What is the capital of France?", g.getQuestionText());
    assertEquals(
        List.of("a", "b", "c", "d"),
        g.getOptions().stream().map(AnswerOption::getLetter).collect(Collectors.toList()));
    assertEquals("Paris", g.getOptions().get(0).getText());
    assertTrue(g.isComplete());
    assertEquals(RegionType.QUESTION_GROUP, g.getRegion().getRegionType());
    assertEquals(0.98, g.getRegion().getConfidence(), 1e-9);
    assertEquals(true, g.getRegion().metadataValue("is_complete"));
    assertEquals("structural", g.getRegion().metadataValue("detection_method"));
    assertTrue(g.getRegion().getY() <= 100);
    assertTrue(g.getRegion().getY2() >= 240);
  }

  @Test
  void acceptsOptionsWhoseTextHoldsParentheses() {
    List<QuestionGroup> groups =
        detector.detect(
            page(
                line("4. Which statements are true?", 100, 100),
                line("(a) Only (i)", 120, 130),
                line("(b) Both (i) and (ii)", 120, 160),
                line("(c) Only (ii)", 120, 190),
                line("(d) Neither", 120, 220)));

    assertEquals(1, groups.size());
    QuestionGroup g = groups.get(0);
    assertEquals(
        List.of("a", "b", "c", "d"),
        g.getOptions().stream().map(AnswerOption::getLetter).collect(Collectors.toList()));
    assertEquals("Both (i) and (ii)", g.getOptions().get(1).getText());
    assertTrue(g.isComplete());
  }

  @Test
  void rejectsOptionsWithAGap() {
    List<QuestionGroup> groups =
        detector.detect(
            page(
                line("2. Pick one", 100, 100),
                line("(a) first", 120, 130),
                line("(c) third", 120, 160)));

    assertTrue(groups.isEmpty());
  }

  @Test
  void readsInlineOptionsAsAPartialOrFullSet() {
    List<QuestionGroup> groups =
        detector.detect(
            page(
                line("Q.3 2 + 2 = ?", 100, 100),
                line("(a) 3 (b) 4", 110, 130),
                line("7. Which is even?", 100, 300),
                line("(a) 2 (b) 3", 110, 330),
                line("(c) 5 (d) 7", 110, 360)));

    assertEquals(2, groups.size());
    assertEquals("3", groups.get(0).getQuestionNumber());
    assertEquals(2, groups.get(0).getOptions().size());
    assertEquals(false, groups.get(0).isComplete());
    assertEquals(0.98, groups.get(0).getRegion().getConfidence(), 1e-9);
    assertEquals("7", groups.get(1).getQuestionNumber());
    assertEquals(4, groups.get(1).getOptions().size());
  }

  @Test
  void optionsFarFromTheQuestionEdgeAreNotOwned() {
    List<QuestionGroup> groups =
        detector.detect(
            page(
                line("4. Far away options", 100, 100),
                line("(a) one", 400, 130),
                line("(b) two", 400, 160)));

    assertTrue(groups.isEmpty());
  }

  @Test
  void confidenceGrowsWithTheOptionCountAndIsCapped() {
    assertEquals(0.95, StructuralRegionDetector.confidenceFor(1), 1e-9);
    assertEquals(0.98, StructuralRegionDetector.confidenceFor(2), 1e-9);
    assertEquals(0.98, StructuralRegionDetector.confidenceFor(4), 1e-9);
  }
}
