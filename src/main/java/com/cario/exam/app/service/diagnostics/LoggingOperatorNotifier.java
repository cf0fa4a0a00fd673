package com.cario.exam.app.service.diagnostics;

import com.cario.exam.app.model.ErrorDetails;
import com.cario.exam.app.model.ProcessingJob;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Raises critical failures on the {@code OPERATOR_ALERT} marker. The errors appender keeps every
 * marked event, so alerting can be wired to that file without touching the pipeline.
 */
@Log4j2
public class LoggingOperatorNotifier implements OperatorNotifier {

  public static final Marker OPERATOR_ALERT = MarkerManager.getMarker("OPERATOR_ALERT");

  @Override
  public void notifyCritical(ProcessingJob job, ErrorDetails details) {
    log.error(
        OPERATOR_ALERT,
        "operator.alert jobId={} docId={} type={} code={} step={} msg={}",
        job.getId(),
        job.getDocumentId(),
        details.getErrorType(),
        details.getErrorCode(),
        details.getStep(),
        details.getError());
  }
}
