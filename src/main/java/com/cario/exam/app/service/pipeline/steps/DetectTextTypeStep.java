package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.model.TextType;
import com.cario.exam.app.service.pdf.PageSource;
import com.cario.exam.app.service.pdf.PageSourceFactory;
import com.cario.exam.app.service.pdf.TextTypeDetector;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import java.util.Map;
import java.util.Objects;

/** Opens the document's pages and decides between text-layer reading and OCR. */
public class DetectTextTypeStep implements PipelineStep {

  private final PageSourceFactory pageSources;
  private final TextTypeDetector detector;

  public DetectTextTypeStep(PageSourceFactory pageSources, TextTypeDetector detector) {
    this.pageSources = Objects.requireNonNull(pageSources, "pageSources must not be null");
    this.detector = Objects.requireNonNull(detector, "detector must not be null");
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.DETECT_TEXT_TYPE;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.TEXT_EXTRACTION_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    ExamDocument doc = context.getDocument();
    context.setPages(pageSources.open(doc));
    PageSource pages = context.requirePages();
    TextType type = doc.isPdf() ? detector.detect(pages) : TextType.SCANNED;
    doc.setTextType(type);
    doc.setPageCount(pages.pageCount());
    return StepOutcome.ok(Map.of("text_type", type.value(), "pages", pages.pageCount()));
  }
}
