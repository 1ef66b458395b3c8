package com.example.authclient.adapter.presenter;

import com.example.authclient.domain.entity.AuthorizationResponse;

/**
 * Terminal result of a presentation. Exactly one of the arguments is non-null, or both are null
 * when the surface closed without a result.
 */
@FunctionalInterface
public interface AuthorizationCallback {

  void onComplete(AuthorizationResponse response, Throwable error);
}
