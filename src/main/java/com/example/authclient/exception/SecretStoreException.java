package com.example.authclient.exception;

public class SecretStoreException extends RuntimeException {
  public SecretStoreException(String message) {
    super(message);
  }

  public SecretStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
