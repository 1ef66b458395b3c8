package com.example.authclient.adapter.entitlements.client;

import com.example.authclient.adapter.entitlements.dto.Entitlement;
import com.example.authclient.adapter.entitlements.dto.EntitlementResponse;
import com.example.authclient.adapter.entitlements.dto.EntitlementsResponse;
import com.example.authclient.domain.entity.TokenType;
import com.example.authclient.exception.EntitlementsApiException;
import com.example.authclient.exception.NotAuthenticatedException;
import com.example.authclient.properties.AuthClientProperties;
import com.example.authclient.service.ClaimsResolver;
import com.example.authclient.service.TokenLifecycleManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Account API client for server-side entitlements.
 * Every call requires an authenticated session and sends the current access token as a bearer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntitlementsApiClient {

  private static final String ENTITLEMENTS_PATH = "account_api/v1/entitlements";
  private static final String ENTITLEMENT_PATH = "account_api/v1/entitlement";

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final AuthClientProperties properties;
  private final ClaimsResolver claimsResolver;
  private final TokenLifecycleManager tokenLifecycleManager;

  /**
   * Fetches one page of entitlements.
   *
   * @param pageSize      page size, or null for the server default
   * @param startingAfter cursor from the previous page, or null for the first page
   * @throws NotAuthenticatedException if there is no authenticated session
   * @throws EntitlementsApiException  on a non-200 status, transport failure or malformed body
   */
  public EntitlementsResponse fetchPage(Integer pageSize, String startingAfter) {
    HttpUrl.Builder url = baseUrl().newBuilder().addPathSegments(ENTITLEMENTS_PATH);
    if (pageSize != null) {
      url.addQueryParameter("page_size", String.valueOf(pageSize));
    }
    if (startingAfter != null) {
      url.addQueryParameter("starting_after", startingAfter);
    }

    EntitlementsResponse response = get(url.build(), EntitlementsResponse.class);
    if (response.data() == null || response.data().entitlements() == null || response.metadata() == null) {
      log.error("Entitlements response is missing data or metadata");
      throw new EntitlementsApiException(EntitlementsApiException.Kind.DECODING_ERROR,
                                         "Entitlements response is missing data or metadata");
    }
    return response;
  }

  /**
   * Fetches the single entitlement record for the current user.
   */
  public EntitlementResponse fetchEntitlement() {
    HttpUrl url = baseUrl().newBuilder().addPathSegments(ENTITLEMENT_PATH).build();

    EntitlementResponse response = get(url, EntitlementResponse.class);
    if (response.data() == null) {
      log.error("Entitlement response is missing data");
      throw new EntitlementsApiException(EntitlementsApiException.Kind.DECODING_ERROR,
                                         "Entitlement response is missing data");
    }
    return response;
  }

  /**
   * Follows the pagination cursor until the server reports no further page.
   * A failure on any page aborts the whole aggregation.
   */
  public List<Entitlement> fetchAll() {
    List<Entitlement> all = new ArrayList<>();
    String cursor = null;
    EntitlementsResponse page;
    do {
      page = fetchPage(null, cursor);
      all.addAll(page.data().entitlements());
      cursor = page.metadata().nextPageStartingAfter();
    } while (page.metadata().hasMore() && cursor != null);

    log.debug("Fetched {} entitlements", all.size());
    return all;
  }

  private <T> T get(HttpUrl url, Class<T> type) {
    if (!claimsResolver.isAuthenticated()) {
      throw new NotAuthenticatedException("Entitlements require an authenticated session");
    }
    String accessToken = tokenLifecycleManager.getToken(TokenType.ACCESS_TOKEN);

    Request request = new Request.Builder()
        .url(url)
        .header("Authorization", "Bearer " + accessToken)
        .header("Accept", "application/json")
        .get()
        .build();

    String payload;
    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() != 200) {
        log.error("Failed to fetch entitlements. Status: {}", response.code());
        throw EntitlementsApiException.serverError(response.code());
      }
      ResponseBody body = response.body();
      payload = body != null ? body.string() : "";
    } catch (IOException e) {
      log.error("Entitlements request to {} failed", url.encodedPath(), e);
      throw new EntitlementsApiException(EntitlementsApiException.Kind.INVALID_RESPONSE,
                                         "Entitlements request failed", e);
    }

    try {
      T decoded = objectMapper.readValue(payload, type);
      if (decoded == null) {
        throw new EntitlementsApiException(EntitlementsApiException.Kind.DECODING_ERROR,
                                           "Entitlements response body is empty");
      }
      return decoded;
    } catch (JsonProcessingException e) {
      log.error("Failed to decode entitlements response: {}", e.getOriginalMessage());
      throw new EntitlementsApiException(EntitlementsApiException.Kind.DECODING_ERROR,
                                         "Failed to decode entitlements response", e);
    }
  }

  private HttpUrl baseUrl() {
    URI base = properties.getEntitlementsBaseUrl()
        .orElseThrow(() -> new EntitlementsApiException(EntitlementsApiException.Kind.INVALID_URL,
                                                        "Entitlements base URL is missing or malformed"));
    HttpUrl url = HttpUrl.parse(base.toString());
    if (url == null) {
      throw new EntitlementsApiException(EntitlementsApiException.Kind.INVALID_URL,
                                         "Entitlements base URL is not an http(s) URL: " + base);
    }
    return url;
  }
}
