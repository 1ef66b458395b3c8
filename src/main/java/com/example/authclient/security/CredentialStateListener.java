package com.example.authclient.security;

import com.example.authclient.domain.entity.CredentialState;

/**
 * Receives credential states produced outside the interactive flow, such as a token refresh.
 */
@FunctionalInterface
public interface CredentialStateListener {

  /**
   * @param state the new state, already complete
   * @throws com.example.authclient.exception.SecretStoreException if the state could not be persisted
   */
  void onCredentialStateChanged(CredentialState state);
}
