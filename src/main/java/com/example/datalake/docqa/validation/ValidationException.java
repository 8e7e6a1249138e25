package com.example.datalake.docqa.validation;

import com.example.datalake.docqa.exception.DocQaException;
import com.example.datalake.docqa.exception.ErrorCode;

import java.util.List;
import java.util.Objects;

/** Rejected input; nothing has been persisted when this is thrown. */
public class ValidationException extends DocQaException {

  private static final long serialVersionUID = 1L;

  private final List<String> reasons;

  public ValidationException(String message) {
    super(ErrorCode.VALIDATION_ERROR, Objects.requireNonNull(message, "message"));
    this.reasons = List.of(message);
  }

  public ValidationException(List<String> reasons) {
    super(ErrorCode.VALIDATION_ERROR, formatMessage(reasons));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static String formatMessage(List<String> reasons) {
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("reasons must not be empty");
    }
    if (reasons.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("reasons must not contain null entries");
    }
    return String.join("; ", reasons);
  }
}
