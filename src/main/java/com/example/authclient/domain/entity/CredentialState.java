package com.example.authclient.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of the current credential state.
 * Replaced wholesale on interactive authorization or refresh, never mutated in place.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialState(

    @JsonProperty("access_token")
    String accessToken,

    @JsonProperty("id_token")
    String idToken,

    // Absolute expiry of the access token; null when the provider did not report one.
    @JsonProperty("access_token_expiry")
    Instant accessTokenExpiry,

    @JsonProperty("refresh_token")
    String refreshToken,

    // Set after at least one successful authorization round-trip. Says nothing about expiry.
    @JsonProperty("authorized")
    boolean authorized
) {

  /**
   * Checks whether the access token is present and will still be valid {@code threshold} from now.
   *
   * @param now       the current instant
   * @param threshold how long the token must remain valid
   * @return {@code true} if the token can be handed out without a refresh
   */
  public boolean isAccessTokenValid(Instant now, Duration threshold) {
    return accessToken != null
        && accessTokenExpiry != null
        && accessTokenExpiry.isAfter(now.plus(threshold));
  }

  /**
   * Authorized, with an access token whose expiry is strictly after {@code now}.
   */
  public boolean isAuthenticated(Instant now) {
    return authorized && isAccessTokenValid(now, Duration.ZERO);
  }

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }
}
