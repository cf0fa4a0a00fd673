package com.cario.exam.app.exception;

import java.util.Map;

/** A step ran past its wall-clock budget; the job is aborted. */
public class ProcessingTimeoutException extends ExtractionException {

  public ProcessingTimeoutException(String step, long budgetSeconds) {
    super(
        ErrorCode.PROCESSING_TIMEOUT,
        "Step " + step + " exceeded the " + budgetSeconds + "s processing budget",
        Map.of("step", step, "budget_seconds", budgetSeconds),
        null);
  }
}
