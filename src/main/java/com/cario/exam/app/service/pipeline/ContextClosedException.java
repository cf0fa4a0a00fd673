package com.cario.exam.app.service.pipeline;

import java.util.concurrent.CancellationException;

/**
 * Thrown to a step that still touches its job's pages after the run has ended, typically a step
 * that overran its time budget. The job has already been failed, so nothing records this.
 */
public class ContextClosedException extends CancellationException {

  public ContextClosedException(String jobId) {
    super("job " + jobId + " has already finished");
  }
}
