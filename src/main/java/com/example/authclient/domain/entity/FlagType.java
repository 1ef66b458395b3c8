package com.example.authclient.domain.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Declared type of a feature flag, encoded as a single letter in the {@code t} field.
 */
public enum FlagType {
  STRING("s", "string"),
  INTEGER("i", "integer"),
  BOOLEAN("b", "boolean");

  private final String code;
  private final String description;

  FlagType(String code, String description) {
    this.code = code;
    this.description = description;
  }

  public String code() {
    return code;
  }

  public String description() {
    return description;
  }

  public static Optional<FlagType> fromCode(String code) {
    return Arrays.stream(values())
        .filter(type -> type.code.equals(code))
        .findFirst();
  }
}
