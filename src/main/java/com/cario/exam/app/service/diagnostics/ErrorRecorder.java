package com.cario.exam.app.service.diagnostics;

import com.cario.exam.app.exception.ExtractionException;
import com.cario.exam.app.model.ErrorDetails;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

/** Logs pipeline failures and keeps the most recent ones in memory for diagnostics. */
@Log4j2
public class ErrorRecorder {

  public static final int DEFAULT_CAPACITY = 100;

  @Value
  public static class Entry {
    Instant timestamp;
    String errorType;
    String errorCode;
    String errorMessage;
    String step;
    Map<String, Object> context;
  }

  private final int capacity;
  private final Deque<Entry> recent = new ArrayDeque<>();

  public ErrorRecorder() {
    this(DEFAULT_CAPACITY);
  }

  public ErrorRecorder(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    this.capacity = capacity;
  }

  /** Records {@code error} against {@code step} and returns the details to store on the job. */
  public ErrorDetails record(Throwable error, String step, Map<String, Object> context) {
    Instant now = Instant.now();
    String type = errorType(error);
    String code =
        error instanceof ExtractionException
            ? ((ExtractionException) error).getErrorCode().name()
            : null;
    String message = String.valueOf(error.getMessage());

    Entry entry = new Entry(now, type, code, message, step, context == null ? Map.of() : context);
    synchronized (recent) {
      recent.addLast(entry);
      while (recent.size() > capacity) {
        recent.removeFirst();
      }
    }
    log.error(
        "pipeline.error type={} code={} step={} context={} msg={}",
        type,
        code,
        step,
        entry.getContext(),
        message,
        error);

    return ErrorDetails.builder()
        .error(message)
        .errorType(type)
        .errorCode(code)
        .step(step)
        .timestamp(now)
        .traceback(truncatedTrace(error))
        .build();
  }

  /** Newest last; at most {@code limit} entries. */
  public List<Entry> recent(int limit) {
    synchronized (recent) {
      List<Entry> all = new ArrayList<>(recent);
      return all.subList(Math.max(0, all.size() - limit), all.size());
    }
  }

  public void clear() {
    synchronized (recent) {
      recent.clear();
    }
  }

  static String truncatedTrace(Throwable error) {
    StringWriter sw = new StringWriter();
    error.printStackTrace(new PrintWriter(sw));
    String trace = sw.toString();
    return trace.length() <= ErrorDetails.MAX_TRACE_LENGTH
        ? trace
        : trace.substring(0, ErrorDetails.MAX_TRACE_LENGTH);
  }

  private static String errorType(Throwable error) {
    return error instanceof ExtractionException
        ? ((ExtractionException) error).getErrorType()
        : error.getClass().getSimpleName();
  }
}
