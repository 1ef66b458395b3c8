package com.example.authclient.adapter.presenter;

import com.example.authclient.domain.entity.AuthorizationRequest;

/**
 * The user-agent surface that shows the authorization page and captures the redirect.
 * <p>
 * Implementations report a user backing out with
 * {@link com.example.authclient.exception.AuthorizationFlowException#userCancelled()}.
 */
public interface AuthorizationPresenter {

  /**
   * Presents the request and invokes the callback once, from any thread, when the flow ends.
   *
   * @param request   the request to present; {@link AuthorizationRequest#toUri()} is the page to open
   * @param ephemeral if set, no browser session or cookies are shared with other presentations
   * @param callback  receives the redirect parameters or the failure
   */
  void present(AuthorizationRequest request, boolean ephemeral, AuthorizationCallback callback);
}
