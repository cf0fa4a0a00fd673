package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.model.OcrResult;
import com.cario.exam.app.model.OcrWord;
import com.cario.exam.app.model.PageImage;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.model.TextType;
import com.cario.exam.app.service.diagnostics.ProcessingLogger;
import com.cario.exam.app.service.ocr.OcrEnsemble;
import com.cario.exam.app.service.pdf.PageSource;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Produces words for every page, in detection-image pixels.
 *
 * <p>Searchable PDFs are read from their text layer. Other pages go through the OCR ensemble at the
 * OCR resolution and are scaled back down. A page whose engines all fail is recorded as a warning
 * with an empty result; the step fails only when no page could be read.
 */
@Log4j2
public class OcrProcessingStep implements PipelineStep {

  public static final String TEXT_LAYER_ENGINE = "pdf-text-layer";

  private final OcrEnsemble ensemble;
  private final ProcessingLogger processingLog;

  public OcrProcessingStep(OcrEnsemble ensemble, ProcessingLogger processingLog) {
    this.ensemble = Objects.requireNonNull(ensemble, "ensemble must not be null");
    this.processingLog = Objects.requireNonNull(processingLog, "processingLog must not be null");
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.OCR_PROCESSING;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.OCR_PROCESSING_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    PageSource pages = context.requirePages();
    boolean searchable = context.getDocument().getTextType() == TextType.SEARCHABLE;
    List<Integer> failedPages = new ArrayList<>();

    for (int p = 1; p <= pages.pageCount(); p++) {
      OcrResult result;
      if (searchable) {
        long t0 = System.nanoTime();
        List<OcrWord> words = pages.textLayerWords(p);
        result = OcrResult.fromWords(TEXT_LAYER_ENGINE, words, (System.nanoTime() - t0) / 1e9);
      } else {
        try {
          PageImage page = pages.page(p);
          result = ensemble.extract(page.getOcrImage()).scaled(1.0 / page.ocrScale());
        } catch (OcrProcessingException e) {
          failedPages.add(p);
          processingLog.warning(
              context.jobId(),
              context.documentId(),
              "OCR failed for page " + p,
              Map.of("page", p, "error", String.valueOf(e.getMessage())));
          result = OcrResult.empty("none");
        }
      }
      context.getOcrResults().put(p, result);
      log.debug(
          "ocr.page docId={} page={} engine={} words={} confidence={}",
          context.documentId(),
          p,
          result.getEngineId(),
          result.getWords().size(),
          result.getConfidence());
    }

    if (!failedPages.isEmpty() && failedPages.size() == pages.pageCount()) {
      return StepOutcome.failed(
          new OcrProcessingException(
              "OCR failed on every page", Map.of("pages", failedPages), null));
    }
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("pages", pages.pageCount());
    summary.put("source", searchable ? TEXT_LAYER_ENGINE : "ocr");
    summary.put("failed_pages", failedPages);
    return StepOutcome.ok(summary);
  }
}
