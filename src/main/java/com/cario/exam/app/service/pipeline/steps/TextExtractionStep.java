package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.exception.TextExtractionException;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.service.layout.PageLayout;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import java.util.Map;

/** Builds each page's text in reading order. A document without any text fails here. */
public class TextExtractionStep implements PipelineStep {

  @Override
  public ProcessingStep step() {
    return ProcessingStep.TEXT_EXTRACTION;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.TEXT_EXTRACTION_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    long chars = 0;
    for (Map.Entry<Integer, PageLayout> e : context.getLayouts().entrySet()) {
      String text = e.getValue().readingOrderText();
      context.getPageTexts().put(e.getKey(), text);
      chars += text.strip().length();
    }
    if (chars == 0) {
      return StepOutcome.failed(
          new TextExtractionException(
              "No text could be extracted from the document",
              Map.of("pages", context.getLayouts().size()),
              null));
    }
    return StepOutcome.ok(Map.of("pages", context.getPageTexts().size(), "characters", chars));
  }
}
