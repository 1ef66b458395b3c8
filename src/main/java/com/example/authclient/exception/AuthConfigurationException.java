package com.example.authclient.exception;

/**
 * Missing or malformed issuer, redirect URL or discovery result.
 */
public class AuthConfigurationException extends RuntimeException {
  public AuthConfigurationException(String message) {
    super(message);
  }

  public AuthConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
