package com.example.authclient.security;

import com.example.authclient.adapter.discovery.client.OidcDiscoveryClient;
import com.example.authclient.adapter.discovery.dto.ProviderMetadata;
import com.example.authclient.adapter.token.client.TokenEndpointClient;
import com.example.authclient.adapter.token.dto.TokenEndpointResponse;
import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.exception.AuthConfigurationException;
import com.example.authclient.exception.NotAuthenticatedException;
import com.example.authclient.exception.TokenEndpointException;
import com.example.authclient.properties.AuthClientProperties;
import com.example.authclient.util.JwtClaimsUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Refresh-on-demand for the single credential slot.
 * <p>
 * At most one refresh round-trip is in flight at a time. Callers arriving while one is running
 * wait for it and receive the same result. Each refreshed state is handed to the registered
 * {@link CredentialStateListener} before any waiter is released.
 */
@Slf4j
@Component
public class TokenRefresher {

  private static final String MISSING_REFRESH_TOKEN = "missing_refresh_token";

  private final TokenEndpointClient tokenEndpointClient;
  private final OidcDiscoveryClient discoveryClient;
  private final AuthClientProperties properties;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  // guarded by lock
  private CompletableFuture<CredentialState> inFlight;
  private volatile CredentialStateListener listener;

  public TokenRefresher(TokenEndpointClient tokenEndpointClient,
                        OidcDiscoveryClient discoveryClient,
                        AuthClientProperties properties,
                        Clock clock) {
    this.tokenEndpointClient = tokenEndpointClient;
    this.discoveryClient = discoveryClient;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Registers the single consumer of refreshed states.
   *
   * @throws IllegalStateException if a listener is already registered
   */
  public void registerListener(CredentialStateListener stateListener) {
    lock.lock();
    try {
      if (this.listener != null) {
        throw new IllegalStateException("A credential state listener is already registered");
      }
      this.listener = stateListener;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a state whose access token is valid beyond the refresh threshold, refreshing if needed.
   *
   * @param currentState         reads the current state; consulted under the refresh lock
   * @param additionalParameters extra form fields sent with the refresh grant
   * @return the current state, or a freshly refreshed one
   * @throws NotAuthenticatedException  if there is no authorized session
   * @throws TokenEndpointException     if the refresh round-trip failed
   * @throws AuthConfigurationException if the token endpoint could not be discovered
   */
  public CredentialState freshTokens(Supplier<Optional<CredentialState>> currentState,
                                     Map<String, String> additionalParameters) {
    CompletableFuture<CredentialState> refresh;
    CredentialState snapshot = null;

    lock.lock();
    try {
      if (inFlight != null) {
        log.debug("Joining refresh already in progress");
        refresh = inFlight;
      } else {
        snapshot = currentState.get()
            .filter(CredentialState::authorized)
            .orElseThrow(() -> new NotAuthenticatedException("No authorized session"));

        if (snapshot.isAccessTokenValid(clock.instant(), refreshThreshold())) {
          return snapshot;
        }
        if (!snapshot.hasRefreshToken()) {
          throw new TokenEndpointException("Access token expired and no refresh token is available",
                                           true, MISSING_REFRESH_TOKEN);
        }
        refresh = new CompletableFuture<>();
        inFlight = refresh;
      }
    } finally {
      lock.unlock();
    }

    if (snapshot != null) {
      runRefresh(snapshot, additionalParameters, refresh);
    }
    return await(refresh);
  }

  private void runRefresh(CredentialState previous,
                          Map<String, String> additionalParameters,
                          CompletableFuture<CredentialState> refresh) {
    log.info("Access token expired or about to expire, refreshing");
    try {
      TokenEndpointResponse response = tokenEndpointClient.refresh(
          resolveTokenEndpoint(), previous.refreshToken(), additionalParameters);
      CredentialState refreshed = merge(previous, response);

      CredentialStateListener stateListener = this.listener;
      if (stateListener != null) {
        stateListener.onCredentialStateChanged(refreshed);
      } else {
        log.warn("Refreshed credential state has no registered listener and will not be persisted");
      }

      release(refresh);
      refresh.complete(refreshed);
      log.info("Access token refreshed");
    } catch (RuntimeException e) {
      log.warn("Token refresh failed: {}", e.getMessage());
      release(refresh);
      refresh.completeExceptionally(e);
    }
  }

  private void release(CompletableFuture<CredentialState> refresh) {
    lock.lock();
    try {
      if (inFlight == refresh) {
        inFlight = null;
      }
    } finally {
      lock.unlock();
    }
  }

  private CredentialState merge(CredentialState previous, TokenEndpointResponse response) {
    String idToken = response.hasIdToken() ? response.idToken() : previous.idToken();
    String refreshToken = response.refreshToken() != null && !response.refreshToken().isBlank()
        ? response.refreshToken()
        : previous.refreshToken();

    Instant expiry = JwtClaimsUtils.resolveExpiry(response.accessToken(), response.expiresIn(), clock.instant());
    if (expiry == null) {
      log.warn("Refreshed access token has no expires_in and no readable exp; every token request will refresh");
    }
    return new CredentialState(response.accessToken(), idToken, expiry, refreshToken, true);
  }

  private URI resolveTokenEndpoint() {
    URI issuer = properties.getIssuerUrl()
        .orElseThrow(() -> new AuthConfigurationException("Issuer URL is missing or malformed"));
    ProviderMetadata metadata = discoveryClient.discover(issuer);
    if (!metadata.hasTokenEndpoint()) {
      throw new AuthConfigurationException("Discovery document has no token endpoint");
    }
    return URI.create(metadata.tokenEndpoint());
  }

  private Duration refreshThreshold() {
    return properties.token().refreshThreshold();
  }

  private static CredentialState await(CompletableFuture<CredentialState> refresh) {
    try {
      return refresh.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }
}
