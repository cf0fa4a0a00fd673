package com.cario.exam.app.model;

import java.util.Arrays;

/**
 * The ordered extraction steps and their progress weights. The weights add up to exactly 100, so
 * the cumulative weight after the last step is the completed progress.
 */
public enum ProcessingStep {
  VALIDATE_UPLOAD("validate_upload", "Validating Upload", 5),
  DETECT_TEXT_TYPE("detect_text_type", "Detecting Text Type", 10),
  OCR_PROCESSING("ocr_processing", "OCR Processing", 30),
  LAYOUT_ANALYSIS("layout_analysis", "Layout Analysis", 15),
  TEXT_EXTRACTION("text_extraction", "Text Extraction", 20),
  QA_DETECTION("qa_detection", "Question/Answer Detection", 15),
  ANSWER_EXTRACTION("answer_extraction", "Answer Extraction", 3),
  CONFIDENCE_SCORING("confidence_scoring", "Confidence Scoring", 2),
  FINALIZATION("finalization", "Finalization", 5);

  public static final String COMPLETED_STEP = "completed";
  public static final String COMPLETED_DISPLAY = "Completed";

  private final String key;
  private final String displayName;
  private final int weight;

  ProcessingStep(String key, String displayName, int weight) {
    this.key = key;
    this.displayName = displayName;
    this.weight = weight;
  }

  public String key() {
    return key;
  }

  public String displayName() {
    return displayName;
  }

  public int weight() {
    return weight;
  }

  /** Sum of the weights of this step and every step before it. */
  public int cumulativeWeight() {
    return Arrays.stream(values())
        .filter(s -> s.ordinal() <= ordinal())
        .mapToInt(ProcessingStep::weight)
        .sum();
  }

  public static int totalWeight() {
    return Arrays.stream(values()).mapToInt(ProcessingStep::weight).sum();
  }
}
