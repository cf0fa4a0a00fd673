package com.cario.exam.app.service.pipeline.steps;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.ExamDocument;
import com.cario.exam.app.model.ProcessingStep;
import com.cario.exam.app.service.pdf.FileSecurityValidator;
import com.cario.exam.app.service.pipeline.PipelineStep;
import com.cario.exam.app.service.pipeline.ProcessingContext;
import com.cario.exam.app.service.pipeline.StepOutcome;
import java.util.Map;
import java.util.Objects;

public class ValidateUploadStep implements PipelineStep {

  private final FileSecurityValidator validator;

  public ValidateUploadStep(FileSecurityValidator validator) {
    this.validator = Objects.requireNonNull(validator, "validator must not be null");
  }

  @Override
  public ProcessingStep step() {
    return ProcessingStep.VALIDATE_UPLOAD;
  }

  @Override
  public ErrorCode errorCode() {
    return ErrorCode.FILE_SECURITY_ERROR;
  }

  @Override
  public StepOutcome execute(ProcessingContext context) {
    ExamDocument doc = context.getDocument();
    FileSecurityValidator.Validated v = validator.validate(doc.getFilename(), doc.getContent());
    doc.setExtension(v.getExtension());
    doc.setPageCount(v.getPageCount());
    return StepOutcome.ok(Map.of("extension", v.getExtension(), "pages", v.getPageCount()));
  }
}
