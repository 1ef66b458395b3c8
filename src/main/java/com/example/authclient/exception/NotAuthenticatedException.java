package com.example.authclient.exception;

/**
 * No valid session is available; the interactive flow has to be restarted.
 */
public class NotAuthenticatedException extends RuntimeException {
  public NotAuthenticatedException(String message) {
    super(message);
  }

  public NotAuthenticatedException(String message, Throwable cause) {
    super(message, cause);
  }
}
