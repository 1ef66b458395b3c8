package com.example.authclient.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Centralized configuration for the authentication client.
 * Loaded once at startup; the URL accessors return empty for missing or malformed values.
 */
@Validated
@ConfigurationProperties(prefix = "auth")
public record AuthClientProperties(
    @NotBlank String issuer,
    @NotBlank String clientId,
    @NotBlank String redirectUri,
    String postLogoutRedirectUri,
    @DefaultValue("offline openid") @NotBlank String scope,
    String audience,
    @DefaultValue("false") boolean privateSession,
    String entitlementsBaseUrl,
    @DefaultValue("Java/1.0.0") @NotBlank String sdkIdentifier,
    @NotNull @Valid @DefaultValue TokenProperties token,
    @NotNull @Valid @DefaultValue DiscoveryProperties discovery,
    @NotNull @Valid @DefaultValue HttpProperties http,
    @NotNull @Valid @DefaultValue StoreProperties store
) {

  /**
   * Access token refresh behaviour
   */
  public record TokenProperties(
      @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration refreshThreshold
  ) {}

  /**
   * OIDC discovery document caching
   */
  public record DiscoveryProperties(
      @DefaultValue("1h") Duration cacheTtl,
      @DefaultValue("16") @Positive int cacheMaxSize
  ) {}

  /**
   * OkHttp client timeouts
   */
  public record HttpProperties(
      @DefaultValue("5s") Duration connectTimeout,
      @DefaultValue("10s") Duration readTimeout
  ) {}

  /**
   * Secure credential store selection and key material
   */
  public record StoreProperties(
      @DefaultValue("file") @Pattern(regexp = "memory|file|redis") String type,
      @DefaultValue("auth-state") @NotBlank String key,
      String filePath,
      String encryptionKey,
      @DefaultValue("auth:credential:") String redisKeyPrefix
  ) {}

  /**
   * Get the configured issuer URL, or empty if it is missing or malformed
   */
  public Optional<URI> getIssuerUrl() {
    return parseAbsolute(issuer);
  }

  /**
   * Get the configured redirect URL, or empty if it is missing or malformed
   */
  public Optional<URI> getRedirectUrl() {
    return parseAbsolute(redirectUri);
  }

  /**
   * Get the configured post-logout redirect URL, or empty if it is missing or malformed
   */
  public Optional<URI> getPostLogoutRedirectUrl() {
    return parseAbsolute(postLogoutRedirectUri);
  }

  /**
   * Base URL for the account API; falls back to the issuer.
   */
  public Optional<URI> getEntitlementsBaseUrl() {
    if (entitlementsBaseUrl == null || entitlementsBaseUrl.isBlank()) {
      return getIssuerUrl();
    }
    return parseAbsolute(entitlementsBaseUrl);
  }

  private static Optional<URI> parseAbsolute(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      URI uri = new URI(value.trim());
      if (uri.getScheme() == null || (uri.getHost() == null && uri.getSchemeSpecificPart().isEmpty())) {
        return Optional.empty();
      }
      return Optional.of(uri);
    } catch (URISyntaxException e) {
      return Optional.empty();
    }
  }
}
