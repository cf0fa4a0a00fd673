package com.cario.exam.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/** A lettered answer choice such as {@code (b) Paris}. Letters are stored lower case. */
@Value
public class AnswerOption {

  String letter;
  String text;

  @JsonCreator
  public AnswerOption(@JsonProperty("letter") String letter, @JsonProperty("text") String text) {
    this.letter = letter == null ? "" : letter.toLowerCase(java.util.Locale.ROOT);
    this.text = text == null ? "" : text.strip();
  }
}
