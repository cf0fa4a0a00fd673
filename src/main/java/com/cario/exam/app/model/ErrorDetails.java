package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** What went wrong in a failed job: message, typed code, failing step and a short trace. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorDetails {

  public static final int MAX_TRACE_LENGTH = 500;

  private String error;
  private String errorType;
  private String errorCode;
  private String step;
  private Instant timestamp;
  private String traceback;
}
