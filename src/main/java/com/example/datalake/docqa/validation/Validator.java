package com.example.datalake.docqa.validation;

/** One check applied to an incoming question. */
public interface Validator {

  ValidationStage stage();

  /** Throws {@link ValidationException} on rejection; may rewrite the processed question. */
  void validate(ValidationContext context);
}
