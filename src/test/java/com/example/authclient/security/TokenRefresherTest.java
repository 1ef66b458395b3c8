package com.example.authclient.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.authclient.AuthTestFixtures;
import com.example.authclient.adapter.discovery.client.OidcDiscoveryClient;
import com.example.authclient.adapter.discovery.dto.ProviderMetadata;
import com.example.authclient.adapter.token.client.TokenEndpointClient;
import com.example.authclient.adapter.token.dto.TokenEndpointResponse;
import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.exception.AuthConfigurationException;
import com.example.authclient.exception.NotAuthenticatedException;
import com.example.authclient.exception.TokenEndpointException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TokenRefresherTest {

  private static final URI TOKEN_ENDPOINT = URI.create("https://auth.example.com/oauth2/token");
  private static final ProviderMetadata METADATA = new ProviderMetadata(
      AuthTestFixtures.ISSUER, "https://auth.example.com/oauth2/auth", TOKEN_ENDPOINT.toString(),
      null, null, null);

  @Mock private TokenEndpointClient tokenEndpointClient;
  @Mock private OidcDiscoveryClient discoveryClient;
  @Mock private CredentialStateListener listener;

  private TokenRefresher refresher;

  @BeforeEach
  void setUp() {
    refresher = new TokenRefresher(tokenEndpointClient, discoveryClient,
                                   AuthTestFixtures.properties(), AuthTestFixtures.CLOCK);
    refresher.registerListener(listener);
  }

  @Test
  void validStateIsReturnedWithoutARoundTrip() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.plusSeconds(3600));

    CredentialState result = refresher.freshTokens(() -> Optional.of(state), Map.of());

    assertThat(result).isSameAs(state);
    verifyNoInteractions(tokenEndpointClient, discoveryClient, listener);
  }

  @Test
  void tokenInsideTheThresholdIsRefreshed() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.plusSeconds(30));
    when(discoveryClient.discover(any())).thenReturn(METADATA);
    when(tokenEndpointClient.refresh(eq(TOKEN_ENDPOINT), eq("refresh-access-1"), anyMap()))
        .thenReturn(tokenResponse("access-2", 3600L, null, null));

    CredentialState result = refresher.freshTokens(() -> Optional.of(state), Map.of("Kinde-SDK", "Java/1.0.0"));

    assertThat(result.accessToken()).isEqualTo("access-2");
    assertThat(result.accessTokenExpiry()).isEqualTo(AuthTestFixtures.NOW.plusSeconds(3600));
    assertThat(result.authorized()).isTrue();
    verify(tokenEndpointClient).refresh(TOKEN_ENDPOINT, "refresh-access-1", Map.of("Kinde-SDK", "Java/1.0.0"));
  }

  @Test
  void mergeKeepsPreviousIdAndRefreshTokensWhenNotRotated() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.minusSeconds(10));
    when(discoveryClient.discover(any())).thenReturn(METADATA);
    when(tokenEndpointClient.refresh(any(), anyString(), anyMap()))
        .thenReturn(tokenResponse("access-2", 3600L, null, null));

    CredentialState result = refresher.freshTokens(() -> Optional.of(state), Map.of());

    assertThat(result.idToken()).isEqualTo(state.idToken());
    assertThat(result.refreshToken()).isEqualTo(state.refreshToken());
  }

  @Test
  void mergeTakesRotatedTokens() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.minusSeconds(10));
    String newIdToken = AuthTestFixtures.idTokenFor("user@example.com");
    when(discoveryClient.discover(any())).thenReturn(METADATA);
    when(tokenEndpointClient.refresh(any(), anyString(), anyMap()))
        .thenReturn(tokenResponse("access-2", 3600L, "refresh-rotated", newIdToken));

    CredentialState result = refresher.freshTokens(() -> Optional.of(state), Map.of());

    assertThat(result.refreshToken()).isEqualTo("refresh-rotated");
    assertThat(result.idToken()).isEqualTo(newIdToken);
  }

  @Test
  void listenerReceivesTheRefreshedState() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.minusSeconds(10));
    when(discoveryClient.discover(any())).thenReturn(METADATA);
    when(tokenEndpointClient.refresh(any(), anyString(), anyMap()))
        .thenReturn(tokenResponse("access-2", 3600L, null, null));

    CredentialState result = refresher.freshTokens(() -> Optional.of(state), Map.of());

    ArgumentCaptor<CredentialState> captor = ArgumentCaptor.forClass(CredentialState.class);
    verify(listener).onCredentialStateChanged(captor.capture());
    assertThat(captor.getValue()).isEqualTo(result);
  }

  @Test
  void opaqueTokenWithoutExpiresInIsRefreshedOnEveryRequest() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.minusSeconds(10));
    when(discoveryClient.discover(any())).thenReturn(METADATA);
    when(tokenEndpointClient.refresh(any(), anyString(), anyMap()))
        .thenReturn(tokenResponse("opaque-access", null, null, null));

    CredentialState refreshed = refresher.freshTokens(() -> Optional.of(state), Map.of());
    assertThat(refreshed.accessTokenExpiry()).isNull();

    refresher.freshTokens(() -> Optional.of(refreshed), Map.of());
    verify(tokenEndpointClient, times(2)).refresh(any(), anyString(), anyMap());
  }

  @Test
  void noStateIsNotAuthenticated() {
    assertThatThrownBy(() -> refresher.freshTokens(Optional::empty, Map.of()))
        .isInstanceOf(NotAuthenticatedException.class);
  }

  @Test
  void unauthorizedStateIsNotAuthenticated() {
    CredentialState state = new CredentialState("access-1", null, AuthTestFixtures.NOW.plusSeconds(3600), null, false);

    assertThatThrownBy(() -> refresher.freshTokens(() -> Optional.of(state), Map.of()))
        .isInstanceOf(NotAuthenticatedException.class);
  }

  @Test
  void expiredWithoutRefreshTokenIsAnAuthorizationError() {
    CredentialState state = new CredentialState(
        "access-1", null, AuthTestFixtures.NOW.minusSeconds(10), null, true);

    assertThatThrownBy(() -> refresher.freshTokens(() -> Optional.of(state), Map.of()))
        .isInstanceOfSatisfying(TokenEndpointException.class, e -> {
          assertThat(e.isAuthorizationError()).isTrue();
          assertThat(e.getErrorCode()).isEqualTo("missing_refresh_token");
        });
    verifyNoInteractions(tokenEndpointClient);
  }

  @Test
  void failedRefreshPropagatesAndDoesNotNotify() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.minusSeconds(10));
    when(discoveryClient.discover(any())).thenReturn(METADATA);
    when(tokenEndpointClient.refresh(any(), anyString(), anyMap()))
        .thenThrow(new TokenEndpointException("rejected", true, "invalid_grant"));

    assertThatThrownBy(() -> refresher.freshTokens(() -> Optional.of(state), Map.of()))
        .isInstanceOf(TokenEndpointException.class);
    verify(listener, never()).onCredentialStateChanged(any());
  }

  @Test
  void failedRefreshDoesNotBlockTheNextAttempt() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.minusSeconds(10));
    when(discoveryClient.discover(any())).thenReturn(METADATA);
    when(tokenEndpointClient.refresh(any(), anyString(), anyMap()))
        .thenThrow(new TokenEndpointException("unavailable", false, null))
        .thenReturn(tokenResponse("access-2", 3600L, null, null));

    assertThatThrownBy(() -> refresher.freshTokens(() -> Optional.of(state), Map.of()))
        .isInstanceOf(TokenEndpointException.class);

    assertThat(refresher.freshTokens(() -> Optional.of(state), Map.of()).accessToken()).isEqualTo("access-2");
  }

  @Test
  void missingTokenEndpointIsAConfigurationError() {
    CredentialState state = AuthTestFixtures.stateFor(
        "user@example.com", "access-1", AuthTestFixtures.NOW.minusSeconds(10));
    when(discoveryClient.discover(any())).thenReturn(new ProviderMetadata(
        AuthTestFixtures.ISSUER, "https://auth.example.com/oauth2/auth", null, null, null, null));

    assertThatThrownBy(() -> refresher.freshTokens(() -> Optional.of(state), Map.of()))
        .isInstanceOf(AuthConfigurationException.class);
  }

  @Test
  void secondListenerIsRejected() {
    assertThatThrownBy(() -> refresher.registerListener(mock(CredentialStateListener.class)))
        .isInstanceOf(IllegalStateException.class);
  }

  private static TokenEndpointResponse tokenResponse(String accessToken, Long expiresIn,
                                                     String refreshToken, String idToken) {
    return new TokenEndpointResponse(accessToken, "bearer", expiresIn, refreshToken, idToken, null, null, null);
  }
}
