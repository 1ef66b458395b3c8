package com.example.authclient.service;

import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.domain.entity.TokenPair;
import com.example.authclient.domain.entity.TokenType;
import com.example.authclient.exception.AuthConfigurationException;
import com.example.authclient.exception.FailedToSaveStateException;
import com.example.authclient.exception.NotAuthenticatedException;
import com.example.authclient.exception.SecretStoreException;
import com.example.authclient.exception.TokenEndpointException;
import com.example.authclient.properties.AuthClientProperties;
import com.example.authclient.security.TokenRefresher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Hands out valid tokens, refreshing transparently.
 * Callers see either a fresh token or {@link NotAuthenticatedException}; the only remedy for the
 * latter is a new interactive login.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenLifecycleManager {

  static final String SDK_PARAMETER = "Kinde-SDK";

  private final CredentialRepository credentialRepository;
  private final TokenRefresher tokenRefresher;
  private final AuthClientProperties properties;

  /**
   * @throws NotAuthenticatedException  if no valid token can be obtained
   * @throws FailedToSaveStateException if a refresh succeeded but could not be persisted
   */
  public String getToken(TokenType type) {
    return getTokens().get(type)
        .orElseThrow(() -> new NotAuthenticatedException("No " + type + " available for the current session"));
  }

  /**
   * @throws NotAuthenticatedException  if no valid token can be obtained
   * @throws FailedToSaveStateException if a refresh succeeded but could not be persisted
   */
  public TokenPair getTokens() {
    try {
      CredentialState state = tokenRefresher.freshTokens(
          credentialRepository::current, Map.of(SDK_PARAMETER, properties.sdkIdentifier()));
      return new TokenPair(state.accessToken(), state.idToken());

    } catch (TokenEndpointException e) {
      if (e.isAuthorizationError()) {
        log.warn("Session can no longer be refreshed ({}), clearing credentials", e.getErrorCode());
        clearQuietly();
      } else {
        log.warn("Token refresh failed, keeping current credentials: {}", e.getMessage());
      }
      throw new NotAuthenticatedException("Unable to obtain a valid access token", e);

    } catch (AuthConfigurationException e) {
      log.error("Token endpoint could not be resolved", e);
      throw new NotAuthenticatedException("Unable to obtain a valid access token", e);

    } catch (SecretStoreException e) {
      log.warn("Refreshed credentials could not be persisted", e);
      throw new FailedToSaveStateException("Refreshed credentials could not be persisted", e);
    }
  }

  private void clearQuietly() {
    try {
      credentialRepository.clear();
    } catch (SecretStoreException e) {
      log.error("Failed to clear stored credentials", e);
    }
  }
}
