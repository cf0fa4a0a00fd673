package com.cario.exam.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** An uploaded exam paper: raw bytes plus what the pipeline learned about it. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExamDocument {

  private String id;
  private String filename;
  private String contentType;

  /** pdf, png, jpg, jpeg, tif or tiff. */
  private String extension;

  @ToString.Exclude private byte[] content;

  private Integer pageCount;
  private TextType textType;

  /** S3 location when the document arrived through the ingest sweep. */
  private String sourceUri;

  /** PENDING | PROCESSING | COMPLETED | FAILED. */
  private String status;

  private String errorMessage;
  private Instant createdAt;
  private Instant updatedAt;

  public boolean isPdf() {
    return "pdf".equalsIgnoreCase(extension);
  }
}
