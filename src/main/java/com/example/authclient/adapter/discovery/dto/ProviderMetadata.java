package com.example.authclient.adapter.discovery.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of the OIDC discovery document the client relies on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderMetadata(
    @JsonProperty("issuer")
    String issuer,
    @JsonProperty("authorization_endpoint")
    String authorizationEndpoint,
    @JsonProperty("token_endpoint")
    String tokenEndpoint,
    @JsonProperty("end_session_endpoint")
    String endSessionEndpoint,
    @JsonProperty("userinfo_endpoint")
    String userinfoEndpoint,
    @JsonProperty("jwks_uri")
    String jwksUri
) {

  public boolean hasAuthorizationEndpoint() {
    return authorizationEndpoint != null && !authorizationEndpoint.isBlank();
  }

  public boolean hasTokenEndpoint() {
    return tokenEndpoint != null && !tokenEndpoint.isBlank();
  }
}
