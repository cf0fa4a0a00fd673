package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.DocumentStatistics;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.repository.DocumentStore;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import com.cario.exam.app.service.stats.StatisticsAggregator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Saves the questions and computes the document statistics. */
public class FinalizationStep implements PipelineStep {

  private final DocumentStore documents;
  private final StatisticsAggregator aggregator;

  public FinalizationStep(DocumentStore documents, StatisticsAggregator aggregator) {
    this.documents = Objects.requireNonNull(documents, "documents must not be null");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.FINALIZATION;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.TEXT_EXTRACTION_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    documents.saveQuestions(context.documentId(), context.getQuestions());
    DocumentStatistics stats = aggregator.aggregate(context.getQuestions());
    context.setStatistics(stats);

    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("questions", stats.getTotal());
    summary.put("average_confidence", stats.getAverageConfidence());
    summary.put("needs_review", stats.getNeedsReviewCount());
    return StepOutcome.ok(summary);
  }
}
