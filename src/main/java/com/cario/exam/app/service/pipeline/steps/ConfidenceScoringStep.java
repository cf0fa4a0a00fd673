package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.ExtractedQuestion;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.model.Region;
import com.cario.exam.app.service.diagnostics.ProcessingLogger;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import com.cario.exam.app.service.stats.ConfidenceScorer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Scores every question from its region confidence and the OCR confidence of the words inside the
 * region, falling back to the page's OCR confidence when no word lies inside.
 */
public class ConfidenceScoringStep implements PipelineStep {

  private final ConfidenceScorer scorer;
  private final ProcessingLogger processingLog;

  public ConfidenceScoringStep(ConfidenceScorer scorer, ProcessingLogger processingLog) {
    this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
    this.processingLog = Objects.requireNonNull(processingLog, "processingLog must not be null");
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.CONFIDENCE_SCORING;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.QUESTION_DETECTION_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    for (ExtractedQuestion q : context.getQuestions()) {
      Region region = context.getQuestionRegions().get(q.getRegionId());
      OcrResult ocr = context.getOcrResults().get(q.getPageNumber());
      double ocrConfidence = ocrConfidence(region, ocr);
      double regionConfidence = region == null ? 0.0 : region.getConfidence();
      q.scored(scorer.score(regionConfidence, ocrConfidence));
    }

    Map<Integer, List<ExtractedQuestion>> byPage =
        context.getQuestions().stream()
            .collect(
                Collectors.groupingBy(
                    ExtractedQuestion::getPageNumber, TreeMap::new, Collectors.toList()));
    byPage.forEach(
        (page, list) ->
            processingLog.extractionResult(
                context.jobId(),
                context.documentId(),
                page,
                list.size(),
                list.stream()
                    .mapToDouble(ExtractedQuestion::getConfidenceScore)
                    .average()
                    .orElse(0.0)));
    return StepOutcome.ok(Map.of("scored", context.getQuestions().size()));
  }

  static double ocrConfidence(Region region, OcrResult ocr) {
    if (ocr == null) {
      return 0.0;
    }
    if (region != null) {
      OptionalDouble inside =
          ocr.getWords().stream()
              .filter(w -> centreInside(w, region))
              .mapToDouble(OcrWord::getConfidence)
              .average();
      if (inside.isPresent()) {
        return inside.getAsDouble();
      }
    }
    return ocr.getConfidence();
  }

  private static boolean centreInside(OcrWord w, Region r) {
    double cx = w.getX() + w.getWidth() / 2.0;
    double cy = w.getCenterY();
    return cx >= r.getX() && cx <= r.getX2() && cy >= r.getY() && cy <= r.getY2();
  }
}
