package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.exception.ExtractionException;
import com.cario.exam.app.exception.FileSecurityException;
import com.cario.exam.app.exception.LayoutAnalysisException;
import com.cario.exam.app.exception.OcrProcessingException;
import com.cario.exam.app.exception.QuestionDetectionException;
import com.cario.exam.app.exception.TextExtractionException;
import java.util.Map;

/** Wraps unexpected step failures into the typed exception of the step's error kind. */
final class StepErrors {

  private StepErrors() {}

  static ExtractionException wrap(ErrorCode code, String step, Throwable cause) {
    if (cause instanceof ExtractionException) {
      return (ExtractionException) cause;
    }
    String message = step + " failed: " + cause.getMessage();
    Map<String, Object> details = Map.of("step", step, "cause", cause.getClass().getName());
    switch (code) {
      case FILE_SECURITY_ERROR:
        return new FileSecurityException(message, details, cause);
      case OCR_PROCESSING_ERROR:
        return new OcrProcessingException(message, details, cause);
      case LAYOUT_ANALYSIS_ERROR:
        return new LayoutAnalysisException(message, details, cause);
      case QUESTION_DETECTION_ERROR:
        return new QuestionDetectionException(message, details, cause);
      default:
        return new TextExtractionException(message, details, cause);
    }
  }
}
