package com.cario.exam.app.service.pipeline;

import com.cario.exam.app.exception.ErrorCode;
import com.cario.exam.app.model.ProcessingStep;

/**
 * One stage of the extraction pipeline. Steps report expected failures as {@link
 * StepOutcome#failed}; anything they throw is wrapped into {@link #errorCode()}'s exception type.
 */
public interface PipelineStep {

  ProcessingStep step();

  /** Error kind used for unexpected exceptions thrown by {@link #execute}. */
  ErrorCode errorCode();

  StepOutcome execute(ProcessingContext context) throws Exception;
}
