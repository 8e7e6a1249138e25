package com.example.datalake.docqa.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NotBlankQuestionValidatorTest {

  private final NotBlankQuestionValidator validator = new NotBlankQuestionValidator();

  @Test
  void shouldRejectBlankQuestion() {
    ValidationContext context = new ValidationContext(" \t ");

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("must not be blank");
  }

  @Test
  void shouldRejectNullQuestion() {
    assertThatThrownBy(() -> validator.validate(new ValidationContext(null)))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldTrimQuestion() {
    ValidationContext context = new ValidationContext("  When do you open?  ");

    validator.validate(context);

    assertThat(context.getProcessedQuestion()).isEqualTo("When do you open?");
    assertThat(context.getRawQuestion()).isEqualTo("  When do you open?  ");
  }
}
