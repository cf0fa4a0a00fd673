package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.AnswerOption;
import com.cario.exam.app.model.ExtractedQuestion;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.model.QuestionGroup;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.model.RegionType;
import com.cario.exam.app.model.TextLine;
import com.cario.exam.app.repository.RegionStore;
import com.cario.exam.app.service.detect.DetectionResult;
import com.cario.exam.app.service.detect.RegionDetector;
import com.cario.exam.app.service.layout.PageLayout;
import com.cario.exam.app.service.parse.ParsedQuestion;
import com.cario.exam.app.service.parse.QuestionPatterns;
import com.cario.exam.app.service.parse.QuestionTypeClassifier;
import com.cario.exam.app.service.parse.TextBlockParser;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Detects regions on every page, saves them and turns them into draft questions.
 *
 * <p>Structural groups become questions directly. On pages where only geometric regions were
 * found, each region's text is taken from the layout lines it contains and parsed as a text block;
 * blocks with a question number or a valid option run become questions.
 */
@Log4j2
public class QaDetectionStep implements PipelineStep {

  private final RegionDetector detector;
  private final RegionStore regionStore;
  private final TextBlockParser parser;
  private final QuestionTypeClassifier classifier;
  private final int minOptions;

  public QaDetectionStep(
      RegionDetector detector,
      RegionStore regionStore,
      TextBlockParser parser,
      QuestionTypeClassifier classifier,
      int minOptions) {
    this.detector = Objects.requireNonNull(detector, "detector must not be null");
    this.regionStore = Objects.requireNonNull(regionStore, "regionStore must not be null");
    this.parser = Objects.requireNonNull(parser, "parser must not be null");
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    this.minOptions = minOptions;
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.QA_DETECTION;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.QUESTION_DETECTION_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    int structuralPages = 0;
    for (Map.Entry<Integer, PageLayout> e : context.getLayouts().entrySet()) {
      int page = e.getKey();
      PageLayout layout = e.getValue();
      BufferedImage image = context.requirePages().detectionImage(page);
      DetectionResult result = detector.detect(image, page, layout);

      List<Region> regions = new ArrayList<>();
      for (Region r : result.getRegions()) {
        regions.add(r.getText().isBlank() ? r.toBuilder().text(textInside(r, layout)).build() : r);
      }

      if (result.getTier() == DetectionResult.Tier.STRUCTURAL) {
        structuralPages++;
        for (QuestionGroup g : result.getGroups()) {
          addQuestion(
              context, g.getRegion(), g.getQuestionNumber(), g.getQuestionText(), g.getOptions());
        }
      } else {
        List<Region> typed = new ArrayList<>(regions.size());
        for (Region r : regions) {
          typed.add(parseRegion(context, r));
        }
        regions = typed;
      }

      regionStore.replacePage(context.documentId(), page, regions);
      context.getRegions().put(page, regions);
      log.debug(
          "qa.page docId={} page={} tier={} regions={} questions={}",
          context.documentId(),
          page,
          result.getTier(),
          regions.size(),
          context.getQuestions().size());
    }

    return StepOutcome.ok(
        Map.of(
            "regions", context.regionCount(),
            "questions", context.getQuestions().size(),
            "structural_pages", structuralPages));
  }

  /** Parses a geometric region; returns it retyped when it holds a question. */
  private Region parseRegion(ProcessingContext context, Region region) {
    ParsedQuestion parsed = parser.parse(region.getText());
    boolean validOptions = QuestionPatterns.isContiguousPrefix(parsed.letters(), minOptions);
    boolean numbered = parsed.getQuestionNumber() != null;
    if (parsed.getQuestionText().isBlank() || !(validOptions || numbered)) {
      return region;
    }
    Region typed =
        region.toBuilder()
            .regionType(validOptions ? RegionType.QUESTION_GROUP : RegionType.QUESTION)
            .build();
    addQuestion(
        context,
        typed,
        parsed.getQuestionNumber(),
        parsed.getQuestionText(),
        validOptions ? parsed.getOptions() : List.of());
    return typed;
  }

  private void addQuestion(
      ProcessingContext context,
      Region region,
      String number,
      String text,
      List<AnswerOption> options) {
    ExtractedQuestion q =
        ExtractedQuestion.builder()
            .id(UUID.randomUUID().toString())
            .documentId(context.documentId())
            .regionId(region.getId())
            .pageNumber(region.getPageNumber())
            .questionNumber(number)
            .questionText(text)
            .questionType(classifier.classify(text, options))
            .options(new ArrayList<>(options))
            .build();
    context.getQuestions().add(q);
    context.getQuestionRegions().put(region.getId(), region);
  }

  static String textInside(Region region, PageLayout layout) {
    if (layout == null) {
      return "";
    }
    return layout.getLines().stream()
        .filter(l -> contains(region, l))
        .map(TextLine::getText)
        .collect(Collectors.joining("\n"));
  }

  private static boolean contains(Region r, TextLine l) {
    double cx = l.getX() + l.getWidth() / 2.0;
    double cy = l.getY() + l.getHeight() / 2.0;
    return cx >= r.getX() && cx <= r.getX2() && cy >= r.getY() && cy <= r.getY2();
  }
}
