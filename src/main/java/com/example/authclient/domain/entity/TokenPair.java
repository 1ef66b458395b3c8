package com.example.authclient.domain.entity;

import java.util.Optional;

/**
 * A fresh access token and its companion ID token, treated as an immutable snapshot once returned.
 */
public record TokenPair(String accessToken, String idToken) {

  public Optional<String> findIdToken() {
    return Optional.ofNullable(idToken);
  }

  public Optional<String> get(TokenType type) {
    return type == TokenType.ACCESS_TOKEN ? Optional.ofNullable(accessToken) : findIdToken();
  }
}
