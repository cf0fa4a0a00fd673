package com.cario.exam.app.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.exception.ExtractionException;
import com.cario.exam.app.exception.FileSecurityException;
import com.cario.exam.app.exception.QuestionDetectionException;
import com.cario.exam.app.exception.TextExtractionException;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class StepErrorsTest {

  @Test
  void typedErrorsPassThrough() {
    FileSecurityException original = new FileSecurityException("bad magic");

    assertSame(original, StepErrors.wrap(ErrorCode.OCR_PROCESSING_ERROR, "ocr", original));
  }

  @Test
  void otherFailuresTakeTheStepCode() {
    ExtractionException detection =
        StepErrors.wrap(
            ErrorCode.QUESTION_DETECTION_ERROR, "qa_detection", new IOException("disk"));
    ExtractionException fallback =
        StepErrors.wrap(ErrorCode.TEXT_EXTRACTION_ERROR, "text_extraction", new Error("boom"));

    assertTrue(detection instanceof QuestionDetectionException);
    assertEquals("qa_detection failed: disk", detection.getMessage());
    assertEquals("java.io.IOException", detection.getDetails().get("cause"));
    assertFalse(detection.isCritical());
    assertTrue(fallback instanceof TextExtractionException);
  }

  @Test
  void securityFailuresAreCritical() {
    assertTrue(
        StepErrors.wrap(ErrorCode.FILE_SECURITY_ERROR, "validate_upload", new RuntimeException("x"))
            .isCritical());
  }
}
