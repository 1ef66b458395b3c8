package com.example.authclient.exception;

import lombok.Getter;

/**
 * Token endpoint failure. {@code authorizationError} is set when the provider rejected the
 * grant (e.g. invalid_grant), as opposed to a transport or server-side failure.
 */
@Getter
public class TokenEndpointException extends RuntimeException {

  private final boolean authorizationError;
  private final String errorCode;

  public TokenEndpointException(String message, Throwable cause) {
    super(message, cause);
    this.authorizationError = false;
    this.errorCode = null;
  }

  public TokenEndpointException(String message, boolean authorizationError, String errorCode) {
    super(message);
    this.authorizationError = authorizationError;
    this.errorCode = errorCode;
  }
}
