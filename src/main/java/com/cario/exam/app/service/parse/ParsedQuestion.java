package com.cario.exam.app.service.parse;

import com.cario.exam.app.model.AnswerOption;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/** Question text and options read out of one block of text. */
@Value
public class ParsedQuestion {

  String questionNumber;
  String questionText;
  List<AnswerOption> options;

  public List<String> letters() {
    return options.stream().map(AnswerOption::getLetter).collect(Collectors.toList());
  }
}
