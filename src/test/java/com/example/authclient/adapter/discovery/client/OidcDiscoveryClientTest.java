package com.example.authclient.adapter.discovery.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.authclient.AuthTestFixtures;
import com.example.authclient.adapter.discovery.dto.ProviderMetadata;
import com.example.authclient.exception.AuthConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OidcDiscoveryClientTest {

  private MockWebServer server;
  private OidcDiscoveryClient discoveryClient;
  private URI issuer;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    issuer = server.url("/").uri();
    OkHttpClient httpClient = new OkHttpClient.Builder()
        .connectTimeout(1, TimeUnit.SECONDS)
        .readTimeout(1, TimeUnit.SECONDS)
        .build();
    discoveryClient = new OidcDiscoveryClient(httpClient, new ObjectMapper(),
                                              AuthTestFixtures.properties(issuer.toString(), null));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void fetchesTheWellKnownDocument() throws InterruptedException {
    server.enqueue(discoveryDocument());

    ProviderMetadata metadata = discoveryClient.discover(issuer);

    RecordedRequest request = server.takeRequest();
    assertThat(request.getPath()).isEqualTo("/.well-known/openid-configuration");
    assertThat(metadata.authorizationEndpoint()).isEqualTo("https://auth.example.com/oauth2/auth");
    assertThat(metadata.tokenEndpoint()).isEqualTo("https://auth.example.com/oauth2/token");
    assertThat(metadata.endSessionEndpoint()).isEqualTo("https://auth.example.com/logout");
  }

  @Test
  void cachesPerIssuerUntilEvicted() {
    server.enqueue(discoveryDocument());
    server.enqueue(discoveryDocument());

    discoveryClient.discover(issuer);
    discoveryClient.discover(issuer);
    assertThat(server.getRequestCount()).isEqualTo(1);

    discoveryClient.evict(issuer);
    discoveryClient.discover(issuer);
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void nonSuccessStatusIsAConfigurationError() {
    server.enqueue(new MockResponse().setResponseCode(404));

    assertThatThrownBy(() -> discoveryClient.discover(issuer))
        .isInstanceOf(AuthConfigurationException.class)
        .hasMessageContaining("404");
  }

  @Test
  void documentWithoutAuthorizationEndpointIsAConfigurationError() {
    server.enqueue(new MockResponse()
                       .setHeader("Content-Type", "application/json")
                       .setBody("{\"issuer\":\"https://auth.example.com\"}"));

    assertThatThrownBy(() -> discoveryClient.discover(issuer))
        .isInstanceOf(AuthConfigurationException.class);
  }

  @Test
  void networkFailureIsAConfigurationError() throws IOException {
    server.shutdown();

    assertThatThrownBy(() -> discoveryClient.discover(issuer))
        .isInstanceOf(AuthConfigurationException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void fallbackKeepsConfigurationErrorsAndWrapsOthers() {
    AuthConfigurationException original = new AuthConfigurationException("bad document");

    assertThatThrownBy(() -> discoveryClient.discoverFallback(issuer, original)).isSameAs(original);
    assertThatThrownBy(() -> discoveryClient.discoverFallback(issuer, new IllegalStateException("open")))
        .isInstanceOf(AuthConfigurationException.class)
        .hasMessageContaining("temporarily unavailable");
  }

  private static MockResponse discoveryDocument() {
    return new MockResponse()
        .setHeader("Content-Type", "application/json")
        .setBody("""
            {
              "issuer": "https://auth.example.com",
              "authorization_endpoint": "https://auth.example.com/oauth2/auth",
              "token_endpoint": "https://auth.example.com/oauth2/token",
              "end_session_endpoint": "https://auth.example.com/logout",
              "jwks_uri": "https://auth.example.com/.well-known/jwks.json",
              "response_types_supported": ["code"]
            }
            """);
  }
}
