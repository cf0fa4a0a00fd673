package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.service.layout.LayoutAnalyzer;
import com.cario.exam.app.service.layout.PageLayout;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import java.util.Map;
import java.util.Objects;

public class LayoutAnalysisStep implements PipelineStep {

  private final LayoutAnalyzer analyzer;

  public LayoutAnalysisStep(LayoutAnalyzer analyzer) {
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.LAYOUT_ANALYSIS;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.LAYOUT_ANALYSIS_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    int lines = 0;
    int twoColumnPages = 0;
    for (Map.Entry<Integer, OcrResult> e : context.getOcrResults().entrySet()) {
      PageLayout layout = analyzer.analyze(e.getKey(), e.getValue().getWords());
      context.getLayouts().put(e.getKey(), layout);
      lines += layout.getLines().size();
      if (layout.getColumns().getColumnCount() == 2) {
        twoColumnPages++;
      }
    }
    return StepOutcome.ok(
        Map.of(
            "pages", context.getLayouts().size(),
            "lines", lines,
            "two_column_pages", twoColumnPages));
  }
}
