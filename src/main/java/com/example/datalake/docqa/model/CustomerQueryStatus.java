package com.example.datalake.docqa.model;

import java.util.Arrays;
import java.util.Locale;

public enum CustomerQueryStatus {
  PENDING("pending"),
  RESPONDED("responded"),
  ARCHIVED("archived");

  private final String code;

  CustomerQueryStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static CustomerQueryStatus fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("status must not be blank");
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(s -> s.code.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown customer query status: " + code));
  }
}
