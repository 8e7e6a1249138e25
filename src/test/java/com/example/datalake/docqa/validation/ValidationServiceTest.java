package com.example.datalake.docqa.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationServiceTest {

  @Test
  void shouldRunValidatorsInStageOrder() {
    // registered out of order; trimming must happen before the length check
    ValidationService service = new ValidationService(List.of(
        new MaxCharsValidator(5),
        new NotBlankQuestionValidator()));

    ValidationContext context = service.validate("   hours   ");

    assertThat(context.getProcessedQuestion()).isEqualTo("hours");
  }

  @Test
  void shouldStopAtFirstFailure() {
    ValidationService service = new ValidationService(List.of(
        new NotBlankQuestionValidator(),
        new MaxCharsValidator(5)));

    assertThatThrownBy(() -> service.validate(""))
        .isInstanceOf(ValidationException.class)
        .satisfies(e -> assertThat(((ValidationException) e).getReasons())
            .containsExactly("Question must not be blank."));
  }

  @Test
  void shouldAcceptAnyQuestionWithoutValidators() {
    ValidationService service = new ValidationService(null);

    assertThat(service.validate("anything").getProcessedQuestion()).isEqualTo("anything");
  }
}
