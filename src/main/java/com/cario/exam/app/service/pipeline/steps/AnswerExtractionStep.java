package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.AnswerOption;
import com.cario.exam.app.model.ExtractedQuestion;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.TextLine;
import com.cario.exam.app.service.layout.PageLayout;
import com.cario.exam.app.service.parse.AnswerKeyExtractor;
import com.cario.exam.app.service.parse.QuestionPatterns;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fills {@code correct_answers} from printed keys such as {@code Answer: (b)}. A key is looked for
 * in the question's own region and in the lines right below it, up to the next question.
 */
public class AnswerExtractionStep implements PipelineStep {

  private final AnswerKeyExtractor extractor;

  public AnswerExtractionStep(AnswerKeyExtractor extractor) {
    this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.ANSWER_EXTRACTION;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.QUESTION_DETECTION_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    int answered = 0;
    for (ExtractedQuestion q : context.getQuestions()) {
      if (q.getOptions().isEmpty()) {
        continue;
      }
      Region region = context.getQuestionRegions().get(q.getRegionId());
      PageLayout layout = context.getLayouts().get(q.getPageNumber());
      if (region == null) {
        continue;
      }
      String text = region.getText() + "\n" + trailingText(region, layout, context);
      Set<String> letters =
          q.getOptions().stream().map(AnswerOption::getLetter).collect(Collectors.toSet());
      List<String> answers =
          extractor.extract(text).stream().filter(letters::contains).collect(Collectors.toList());
      if (!answers.isEmpty()) {
        q.setCorrectAnswers(answers);
        answered++;
      }
    }
    return StepOutcome.ok(
        Map.of("questions", context.getQuestions().size(), "with_answers", answered));
  }

  /** Lines below {@code region} in its column, stopping at the next question. */
  private static String trailingText(Region region, PageLayout layout, ProcessingContext context) {
    if (layout == null) {
      return "";
    }
    int limit =
        context.getQuestionRegions().values().stream()
            .filter(r -> r.getPageNumber() == region.getPageNumber() && r != region)
            .filter(r -> r.getY() >= region.getY2() && overlapsHorizontally(r, region))
            .mapToInt(Region::getY)
            .min()
            .orElse(Integer.MAX_VALUE);

    List<TextLine> below =
        layout.getLines().stream()
            .filter(l -> l.getY() >= region.getY2() && l.getY() < limit)
            .filter(l -> l.getX() >= region.getX() && l.getX() < region.getX2())
            .sorted(Comparator.comparingInt(TextLine::getY))
            .collect(Collectors.toList());
    List<String> texts = new ArrayList<>();
    for (TextLine l : below) {
      if (QuestionPatterns.isQuestionStart(l.getText())) {
        break;
      }
      texts.add(l.getText());
    }
    return String.join("\n", texts);
  }

  private static boolean overlapsHorizontally(Region a, Region b) {
    return Math.min(a.getX2(), b.getX2()) > Math.max(a.getX(), b.getX());
  }
}
