package com.example.authclient.exception;

import lombok.Getter;

/**
 * Terminal failure of the interactive authorization flow.
 * The error code is either one of the constants below or the provider's OAuth error code.
 */
@Getter
public class AuthorizationFlowException extends RuntimeException {

  public static final String USER_CANCELLED = "user_cancelled";
  public static final String FLOW_IN_PROGRESS = "flow_in_progress";
  public static final String STATE_MISMATCH = "state_mismatch";
  public static final String NONCE_MISMATCH = "nonce_mismatch";

  private final String errorCode;

  public AuthorizationFlowException(String errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public AuthorizationFlowException(String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public static AuthorizationFlowException userCancelled() {
    return new AuthorizationFlowException(USER_CANCELLED, "User cancelled the authorization flow");
  }

  public boolean isUserCancellation() {
    return USER_CANCELLED.equals(errorCode);
  }
}
