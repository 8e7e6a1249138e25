package com.example.datalake.docqa.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Caller category controlling which documents are visible and which cache partition is used.
 * The {@link #code()} is what gets persisted.
 */
public enum RoleTag {
  OWNER("business_owner"),
  STAFF("employee"),
  EXTERNAL("customer");

  private final String code;

  RoleTag(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Accepts either the persisted code ("customer") or the enum name ("EXTERNAL"). */
  public static RoleTag fromCode(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("role must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(r -> r.code.equals(normalized) || r.name().toLowerCase(Locale.ROOT).equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
  }
}
