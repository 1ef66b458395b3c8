package com.example.authclient.domain.entity;

import okhttp3.HttpUrl;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One authorization attempt. Ephemeral: destroyed once the flow resolves and never persisted.
 * The code verifier stays local; only the challenge is sent.
 */
public record AuthorizationRequest(
    URI authorizationEndpoint,
    URI tokenEndpoint,
    String clientId,
    URI redirectUri,
    String scope,
    String state,
    String nonce,
    String codeVerifier,
    String codeChallenge,
    String codeChallengeMethod,
    Map<String, String> additionalParameters
) {

  public AuthorizationRequest {
    if ((codeVerifier == null) != (codeChallenge == null)) {
      throw new IllegalArgumentException("PKCE verifier and challenge must be both present or both absent");
    }
    additionalParameters = Collections.unmodifiableMap(new LinkedHashMap<>(additionalParameters));
  }

  public boolean usesPkce() {
    return codeVerifier != null;
  }

  /**
   * Renders the full authorization URL handed to the presentation surface.
   */
  public URI toUri() {
    HttpUrl endpoint = HttpUrl.get(authorizationEndpoint.toString());
    HttpUrl.Builder builder = endpoint.newBuilder()
        .addQueryParameter("response_type", "code")
        .addQueryParameter("client_id", clientId)
        .addQueryParameter("redirect_uri", redirectUri.toString())
        .addQueryParameter("scope", scope)
        .addQueryParameter("state", state);

    if (nonce != null) {
      builder.addQueryParameter("nonce", nonce);
    }
    if (codeChallenge != null) {
      builder.addQueryParameter("code_challenge", codeChallenge)
          .addQueryParameter("code_challenge_method", codeChallengeMethod);
    }
    additionalParameters.forEach(builder::addQueryParameter);

    return builder.build().uri();
  }

  @Override
  public String toString() {
    // keeps the verifier out of logs
    return "AuthorizationRequest[endpoint=" + authorizationEndpoint + ", clientId=" + clientId
        + ", scope=" + scope + ", pkce=" + usesPkce() + ", nonce=" + (nonce != null)
        + ", parameters=" + additionalParameters + "]";
  }
}
