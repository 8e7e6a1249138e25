package com.example.datalake.docqa.validation;

import org.springframework.stereotype.Component;

/** Rejects null or blank questions and trims surrounding whitespace. */
@Component
public class NotBlankQuestionValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.PRE_EMBEDDING;
  }

  @Override
  public void validate(ValidationContext context) {
    String raw = context.getRawQuestion();
    if (raw == null || raw.trim().isEmpty()) {
      throw new ValidationException("Question must not be blank.");
    }
    context.setProcessedQuestion(raw.trim());
  }
}
