package com.example.authclient.exception;

import lombok.Getter;

/**
 * Failure talking to the remote entitlements API.
 * A non-200 response is an application-level {@link Kind#SERVER_ERROR}, not a transport failure.
 */
@Getter
public class EntitlementsApiException extends RuntimeException {

  public enum Kind {
    INVALID_URL,
    INVALID_RESPONSE,
    SERVER_ERROR,
    DECODING_ERROR
  }

  private final Kind kind;
  private final int status;

  public EntitlementsApiException(Kind kind, String message) {
    this(kind, 0, message, null);
  }

  public EntitlementsApiException(Kind kind, String message, Throwable cause) {
    this(kind, 0, message, cause);
  }

  private EntitlementsApiException(Kind kind, int status, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.status = status;
  }

  public static EntitlementsApiException serverError(int status) {
    return new EntitlementsApiException(Kind.SERVER_ERROR, status,
        "Entitlements API returned status " + status, null);
  }
}
