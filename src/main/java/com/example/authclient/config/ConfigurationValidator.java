package com.example.authclient.config;

import com.example.authclient.properties.AuthClientProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Configuration validator that enforces business rules beyond basic JSR-303 validation.
 * Collects every violation and fails startup once with all of them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is missing or invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String SCHEME_HTTPS = "https";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String SCOPE_OPENID = "openid";
  private static final String STORE_MEMORY = "memory";
  private static final int ENCRYPTION_KEY_BYTES = 32;

  private final AuthClientProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating auth client configuration...");
    List<String> errors = new ArrayList<>();

    validateIssuer(errors);
    validateRedirects(errors);
    validateScope(errors);
    validateStore(errors);
    validateToken(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Auth client configuration validated successfully.");
  }

  private void validateIssuer(List<String> errors) {
    Optional<URI> issuer = properties.getIssuerUrl();
    if (issuer.isEmpty()) {
      errors.add(ERROR_INVALID_URL.formatted("Issuer URL", properties.issuer()));
      return;
    }
    validateHttpsRequired(issuer.get(), "Issuer URL", errors);

    if (properties.entitlementsBaseUrl() != null && !properties.entitlementsBaseUrl().isBlank()
        && properties.getEntitlementsBaseUrl().isEmpty()) {
      errors.add(ERROR_INVALID_URL.formatted("Entitlements base URL", properties.entitlementsBaseUrl()));
    }
  }

  private void validateRedirects(List<String> errors) {
    if (properties.getRedirectUrl().isEmpty()) {
      errors.add(ERROR_INVALID_URL.formatted("Redirect URI", properties.redirectUri()));
    }
    String postLogout = properties.postLogoutRedirectUri();
    if (postLogout != null && !postLogout.isBlank() && properties.getPostLogoutRedirectUrl().isEmpty()) {
      errors.add(ERROR_INVALID_URL.formatted("Post-logout redirect URI", postLogout));
    }
  }

  private void validateScope(List<String> errors) {
    boolean hasOpenId = Arrays.asList(properties.scope().trim().split("\\s+")).contains(SCOPE_OPENID);
    if (!hasOpenId) {
      errors.add("Scope must include '" + SCOPE_OPENID + "': " + properties.scope());
    }
  }

  private void validateStore(List<String> errors) {
    AuthClientProperties.StoreProperties store = properties.store();
    if (STORE_MEMORY.equals(store.type())) {
      return;
    }
    String key = store.encryptionKey();
    if (key == null || key.isBlank()) {
      errors.add("An encryption key is required for the '" + store.type() + "' secret store.");
      return;
    }
    try {
      if (Base64.getDecoder().decode(key.trim()).length != ENCRYPTION_KEY_BYTES) {
        errors.add("Encryption key must be a Base64-encoded 256-bit key.");
      }
    } catch (IllegalArgumentException e) {
      errors.add("Encryption key is not valid Base64.");
    }
  }

  private void validateToken(List<String> errors) {
    if (properties.token().refreshThreshold().isNegative()) {
      errors.add("Token refresh threshold cannot be negative.");
    }
  }

  private void validateHttpsRequired(URI uri, String fieldName, List<String> errors) {
    String host = uri.getHost();
    boolean local = HOST_LOCALHOST.equalsIgnoreCase(host) || HOST_LOOPBACK.equals(host);
    if (!SCHEME_HTTPS.equalsIgnoreCase(uri.getScheme()) && !local) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, uri));
    }
  }
}
