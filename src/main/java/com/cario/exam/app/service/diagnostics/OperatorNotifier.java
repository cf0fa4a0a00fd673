package com.cario.exam.app.service.diagnostics;

import com.cario.exam.app.model.ErrorDetails;
import com.cario.exam.app.model.ProcessingJob;

/** Out-of-band channel for failures that need a person to look at them. */
public interface OperatorNotifier {

  void notifyCritical(ProcessingJob job, ErrorDetails details);
}
