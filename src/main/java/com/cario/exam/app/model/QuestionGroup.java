package com.cario.exam.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A question start grouped with the lettered options that follow it in the same column. The
 * backing {@link #region} is of type {@link RegionType#QUESTION_GROUP}.
 */
@Value
@Builder
public class QuestionGroup {

  Region region;

  /** Number printed before the question, null when the question was not numbered. */
  String questionNumber;

  String questionText;

  @Singular List<AnswerOption> options;

  /** True when all four options a-d were found. */
  boolean complete;

  /** Zero-based column index the group was found in. */
  int column;
}
