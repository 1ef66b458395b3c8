package com.example.authclient.adapter.entitlements.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.authclient.AuthTestFixtures;
import com.example.authclient.adapter.entitlements.dto.Entitlement;
import com.example.authclient.adapter.entitlements.dto.EntitlementResponse;
import com.example.authclient.adapter.entitlements.dto.EntitlementsResponse;
import com.example.authclient.domain.entity.TokenType;
import com.example.authclient.exception.EntitlementsApiException;
import com.example.authclient.exception.NotAuthenticatedException;
import com.example.authclient.service.ClaimsResolver;
import com.example.authclient.service.TokenLifecycleManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EntitlementsApiClientTest {

  @Mock private ClaimsResolver claimsResolver;
  @Mock private TokenLifecycleManager tokenLifecycleManager;

  private MockWebServer server;
  private EntitlementsApiClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    client = clientFor(server.url("/").toString());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private EntitlementsApiClient clientFor(String baseUrl) {
    return new EntitlementsApiClient(new OkHttpClient(), new ObjectMapper(),
                                     AuthTestFixtures.properties(AuthTestFixtures.ISSUER, baseUrl),
                                     claimsResolver, tokenLifecycleManager);
  }

  @Test
  void unauthenticatedSessionSendsNoRequest() {
    when(claimsResolver.isAuthenticated()).thenReturn(false);

    assertThatThrownBy(() -> client.fetchPage(null, null)).isInstanceOf(NotAuthenticatedException.class);
    assertThat(server.getRequestCount()).isZero();
    verifyNoInteractions(tokenLifecycleManager);
  }

  @Test
  void nonHttpBaseUrlIsInvalid() {
    EntitlementsApiClient misconfigured = clientFor("mailto:billing@example.com");

    assertThatThrownBy(misconfigured::fetchEntitlement)
        .isInstanceOfSatisfying(EntitlementsApiException.class,
                                e -> assertThat(e.getKind()).isEqualTo(EntitlementsApiException.Kind.INVALID_URL));
  }

  @Nested
  class Authenticated {

    @BeforeEach
    void signIn() {
      when(claimsResolver.isAuthenticated()).thenReturn(true);
      when(tokenLifecycleManager.getToken(TokenType.ACCESS_TOKEN)).thenReturn("access-1");
    }

    @Test
    void sendsBearerTokenAndPageParameters() throws InterruptedException {
      server.enqueue(json(200, page("[]", false, null)));

      EntitlementsResponse response = client.fetchPage(10, "cursor-1");

      RecordedRequest request = server.takeRequest();
      assertThat(request.getHeader("Authorization")).isEqualTo("Bearer access-1");
      assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/account_api/v1/entitlements");
      assertThat(request.getRequestUrl().queryParameter("page_size")).isEqualTo("10");
      assertThat(request.getRequestUrl().queryParameter("starting_after")).isEqualTo("cursor-1");
      assertThat(response.data().orgCode()).isEqualTo("org_123");
      assertThat(response.metadata().hasMore()).isFalse();
    }

    @Test
    void fetchAllFollowsTheCursor() throws InterruptedException {
      server.enqueue(json(200, page("[{\"key\":\"seats\",\"value\":5,\"type\":\"integer\"}]", true, "abc")));
      server.enqueue(json(200, page("[{\"key\":\"sso\",\"value\":true,\"type\":\"boolean\"}]", false, null)));

      List<Entitlement> all = client.fetchAll();

      assertThat(all).extracting(Entitlement::key).containsExactly("seats", "sso");
      assertThat(all.get(0).value().asInteger()).contains(5);
      assertThat(server.takeRequest().getRequestUrl().queryParameter("starting_after")).isNull();
      assertThat(server.takeRequest().getRequestUrl().queryParameter("starting_after")).isEqualTo("abc");
      assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void fetchAllStopsWhenHasMoreIsFalseEvenWithACursor() {
      server.enqueue(json(200, page("[]", false, "abc")));

      assertThat(client.fetchAll()).isEmpty();
      assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void fetchesTheSingleEntitlement() throws InterruptedException {
      server.enqueue(json(200, "{\"data\":{\"key\":\"seats\",\"value\":10,\"type\":\"integer\"}}"));

      EntitlementResponse response = client.fetchEntitlement();

      assertThat(server.takeRequest().getPath()).isEqualTo("/account_api/v1/entitlement");
      assertThat(response.data().key()).isEqualTo("seats");
    }

    @Test
    void serverErrorCarriesTheStatus() {
      server.enqueue(new MockResponse().setResponseCode(500));

      assertThatThrownBy(() -> client.fetchPage(null, null))
          .isInstanceOfSatisfying(EntitlementsApiException.class, e -> {
            assertThat(e.getKind()).isEqualTo(EntitlementsApiException.Kind.SERVER_ERROR);
            assertThat(e.getStatus()).isEqualTo(500);
          });
    }

    @Test
    void malformedBodyIsADecodingError() {
      server.enqueue(json(200, "{not json"));

      assertThatThrownBy(() -> client.fetchPage(null, null))
          .isInstanceOfSatisfying(EntitlementsApiException.class,
                                  e -> assertThat(e.getKind()).isEqualTo(EntitlementsApiException.Kind.DECODING_ERROR));
    }

    @Test
    void missingMetadataIsADecodingError() {
      server.enqueue(json(200, "{\"data\":{\"org_code\":\"org_123\",\"entitlements\":[]}}"));

      assertThatThrownBy(() -> client.fetchPage(null, null))
          .isInstanceOfSatisfying(EntitlementsApiException.class,
                                  e -> assertThat(e.getKind()).isEqualTo(EntitlementsApiException.Kind.DECODING_ERROR));
    }

    @Test
    void failureOnALaterPageAbortsTheAggregation() {
      server.enqueue(json(200, page("[{\"key\":\"seats\",\"value\":5}]", true, "abc")));
      server.enqueue(new MockResponse().setResponseCode(503));

      assertThatThrownBy(() -> client.fetchAll())
          .isInstanceOfSatisfying(EntitlementsApiException.class,
                                  e -> assertThat(e.getStatus()).isEqualTo(503));
    }
  }

  private static String page(String entitlements, boolean hasMore, String cursor) {
    String next = cursor == null ? "null" : "\"" + cursor + "\"";
    return "{\"data\":{\"org_code\":\"org_123\",\"plans\":[],\"entitlements\":" + entitlements + "},"
        + "\"metadata\":{\"has_more\":" + hasMore + ",\"next_page_starting_after\":" + next + "}}";
  }

  private static MockResponse json(int status, String body) {
    return new MockResponse()
        .setResponseCode(status)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }
}
