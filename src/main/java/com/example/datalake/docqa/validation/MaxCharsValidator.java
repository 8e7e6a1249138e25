package com.example.datalake.docqa.validation;

import com.example.datalake.docqa.config.RagProperties;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Rejects questions longer than the configured limit. */
@Component
public class MaxCharsValidator implements Validator {

  private final int maxChars;

  @Autowired
  public MaxCharsValidator(RagProperties properties) {
    this(properties.getAnswer().getMaxQuestionChars());
  }

  public MaxCharsValidator(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.PRE_RETRIEVAL;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedQuestion(), "");
    if (processed.length() > maxChars) {
      throw new ValidationException(
          String.format("Question exceeds the %d character limit (%d given).", maxChars, processed.length()));
    }
  }
}
