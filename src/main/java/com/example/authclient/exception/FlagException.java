package com.example.authclient.exception;

import lombok.Getter;

/**
 * Typed feature flag lookup failure.
 */
@Getter
public class FlagException extends RuntimeException {

  public enum Reason {
    /** The flag code is not present and no default was supplied. */
    NOT_FOUND,
    /** The flag's declared type differs from the requested one. */
    INCORRECT_TYPE,
    /** The feature_flags claim itself is missing or not a mapping. */
    UNKNOWN
  }

  private final Reason reason;

  public FlagException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public static FlagException notFound(String code) {
    return new FlagException(Reason.NOT_FOUND, "Flag \"" + code + "\" not found");
  }

  public static FlagException unknown() {
    return new FlagException(Reason.UNKNOWN, "No feature flags available in token claims");
  }
}
