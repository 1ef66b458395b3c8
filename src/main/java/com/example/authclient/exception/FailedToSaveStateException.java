package com.example.authclient.exception;

/**
 * Durable persistence failed after a logically successful flow or refresh.
 * The in-memory session is still updated.
 */
public class FailedToSaveStateException extends RuntimeException {
  public FailedToSaveStateException(String message) {
    super(message);
  }

  public FailedToSaveStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
