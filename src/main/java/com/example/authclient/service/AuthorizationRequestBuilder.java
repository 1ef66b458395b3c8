package com.example.authclient.service;

import com.example.authclient.adapter.discovery.client.OidcDiscoveryClient;
import com.example.authclient.adapter.discovery.dto.ProviderMetadata;
import com.example.authclient.domain.entity.AuthorizationIntent;
import com.example.authclient.domain.entity.AuthorizationRequest;
import com.example.authclient.exception.AuthConfigurationException;
import com.example.authclient.properties.AuthClientProperties;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeChallenge;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import com.nimbusds.openid.connect.sdk.Nonce;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one authorization request per flow attempt: PKCE pair, state, optional nonce and
 * the intent-specific query parameters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationRequestBuilder {

  private static final int RANDOM_BYTES = 32;

  private final OidcDiscoveryClient discoveryClient;
  private final AuthClientProperties properties;

  /**
   * Discovers the provider configuration and builds the request.
   *
   * @throws AuthConfigurationException if discovery fails or the configuration is unusable
   */
  public AuthorizationRequest build(AuthorizationIntent intent) {
    URI issuer = properties.getIssuerUrl()
        .orElseThrow(() -> new AuthConfigurationException("Issuer URL is missing or malformed"));
    return build(intent, discoveryClient.discover(issuer));
  }

  /**
   * Builds the request against already discovered provider metadata.
   *
   * @throws AuthConfigurationException if the metadata or redirect URL is unusable
   */
  public AuthorizationRequest build(AuthorizationIntent intent, ProviderMetadata metadata) {
    if (metadata == null || !metadata.hasAuthorizationEndpoint()) {
      log.error("Failed to discover OpenID configuration");
      throw new AuthConfigurationException("Provider metadata has no authorization endpoint");
    }
    if (!metadata.hasTokenEndpoint()) {
      throw new AuthConfigurationException("Provider metadata has no token endpoint");
    }
    URI redirectUri = properties.getRedirectUrl().orElseThrow(() -> {
      log.error("Failed to get redirect URL");
      return new AuthConfigurationException("Redirect URL is missing or malformed");
    });

    String verifier = null;
    String challenge = null;
    String challengeMethod = null;
    if (intent.usePkce()) {
      CodeVerifier codeVerifier = new CodeVerifier();
      verifier = codeVerifier.getValue();
      challenge = CodeChallenge.compute(CodeChallengeMethod.S256, codeVerifier).getValue();
      challengeMethod = CodeChallengeMethod.S256.getValue();
    }
    String nonce = intent.useNonce() ? new Nonce(RANDOM_BYTES).getValue() : null;

    return new AuthorizationRequest(
        toUri(metadata.authorizationEndpoint()),
        toUri(metadata.tokenEndpoint()),
        properties.clientId(),
        redirectUri,
        properties.scope(),
        new State(RANDOM_BYTES).getValue(),
        nonce,
        verifier,
        challenge,
        challengeMethod,
        additionalParameters(intent));
  }

  private Map<String, String> additionalParameters(AuthorizationIntent intent) {
    Map<String, String> parameters = new LinkedHashMap<>();
    parameters.put("start_page", intent.signUp() ? "registration" : "login");
    // Force fresh login
    parameters.put("prompt", "login");

    if (intent.createOrg()) {
      parameters.put("is_create_org", "true");
    }
    putIfPresent(parameters, "audience", properties.audience());
    putIfPresent(parameters, "org_code", intent.orgCode());
    putIfPresent(parameters, "org_name", intent.orgName());
    putIfPresent(parameters, "login_hint", intent.loginHint());
    putIfPresent(parameters, "plan_interest", intent.planInterest());
    putIfPresent(parameters, "pricing_table_key", intent.pricingTableKey());
    return parameters;
  }

  private static void putIfPresent(Map<String, String> parameters, String name, String value) {
    if (value != null && !value.isEmpty()) {
      parameters.put(name, value);
    }
  }

  private static URI toUri(String endpoint) {
    try {
      return URI.create(endpoint);
    } catch (IllegalArgumentException e) {
      throw new AuthConfigurationException("Provider endpoint is not a valid URI: " + endpoint, e);
    }
  }
}
