package com.example.authclient.adapter.token.client;

import com.example.authclient.adapter.token.dto.TokenEndpointResponse;
import com.example.authclient.exception.TokenEndpointException;
import com.example.authclient.properties.AuthClientProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Public-client token endpoint calls: authorization code exchange (PKCE) and refresh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenEndpointClient {

  private static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
  private static final String GRANT_REFRESH_TOKEN = "refresh_token";

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final AuthClientProperties properties;

  /**
   * Exchanges an authorization code for tokens.
   */
  public TokenEndpointResponse exchangeAuthorizationCode(URI tokenEndpoint, String code,
                                                         URI redirectUri, String codeVerifier) {
    log.debug("Exchanging authorization code for tokens");

    FormBody.Builder form = new FormBody.Builder()
        .add("grant_type", GRANT_AUTHORIZATION_CODE)
        .add("client_id", properties.clientId())
        .add("code", code)
        .add("redirect_uri", redirectUri.toString());
    if (codeVerifier != null) {
      form.add("code_verifier", codeVerifier);
    }
    return execute(tokenEndpoint, form.build());
  }

  /**
   * Refreshes the access token. Additional parameters are sent as extra form fields.
   */
  public TokenEndpointResponse refresh(URI tokenEndpoint, String refreshToken,
                                       Map<String, String> additionalParameters) {
    log.debug("Refreshing access token");

    FormBody.Builder form = new FormBody.Builder()
        .add("grant_type", GRANT_REFRESH_TOKEN)
        .add("client_id", properties.clientId())
        .add("refresh_token", refreshToken);
    additionalParameters.forEach(form::add);
    return execute(tokenEndpoint, form.build());
  }

  private TokenEndpointResponse execute(URI tokenEndpoint, FormBody formBody) {
    Request request = new Request.Builder()
        .url(tokenEndpoint.toString())
        .header("Accept", "application/json")
        .post(formBody)
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String payload = body != null ? body.string() : "";

      if (!response.isSuccessful()) {
        throw toFailure(response.code(), payload);
      }

      TokenEndpointResponse tokenResponse = objectMapper.readValue(payload, TokenEndpointResponse.class);
      if (tokenResponse == null || !tokenResponse.hasAccessToken()) {
        throw new TokenEndpointException("Token endpoint response carried no access token", false, null);
      }
      return tokenResponse;

    } catch (IOException e) {
      throw new TokenEndpointException("Token request failed due to network or decoding error", e);
    }
  }

  private TokenEndpointException toFailure(int status, String payload) {
    String error = null;
    try {
      if (!payload.isBlank()) {
        error = objectMapper.readValue(payload, TokenEndpointResponse.class).error();
      }
    } catch (IOException e) {
      log.debug("Token endpoint error body was not JSON (status {})", status);
    }

    boolean rejected = (status == 400 || status == 401) && error != null;
    log.warn("Token endpoint returned status {} (error: {})", status, error);
    return new TokenEndpointException("Token endpoint returned status " + status, rejected, error);
  }
}
