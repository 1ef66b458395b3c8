package com.example.authclient.service;

import com.example.authclient.adapter.presenter.AuthorizationPresenter;
import com.example.authclient.adapter.token.client.TokenEndpointClient;
import com.example.authclient.adapter.token.dto.TokenEndpointResponse;
import com.example.authclient.domain.entity.AuthorizationRequest;
import com.example.authclient.domain.entity.AuthorizationResponse;
import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.domain.entity.FlowState;
import com.example.authclient.exception.AuthorizationFlowException;
import com.example.authclient.exception.FailedToSaveStateException;
import com.example.authclient.exception.NotAuthenticatedException;
import com.example.authclient.exception.SecretStoreException;
import com.example.authclient.util.JwtClaimsUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the interactive authorization flow: {@code IDLE -> AWAITING_CALLBACK -> SUCCEEDED | CANCELLED | FAILED}.
 * <p>
 * Only one flow may be outstanding process-wide. Starting another while one awaits its callback is
 * rejected; the outstanding flow is not cancelled. Every failure clears the credential repository.
 */
@Slf4j
@Service
public class AuthorizationFlowController {

  private final TokenEndpointClient tokenEndpointClient;
  private final CredentialRepository credentialRepository;
  private final Clock clock;

  private final AtomicReference<PendingFlow> pending = new AtomicReference<>();
  private volatile FlowState flowState = FlowState.IDLE;

  private record PendingFlow(AuthorizationRequest request, CompletableFuture<Void> result) {}

  public AuthorizationFlowController(TokenEndpointClient tokenEndpointClient,
                                     CredentialRepository credentialRepository,
                                     Clock clock) {
    this.tokenEndpointClient = tokenEndpointClient;
    this.credentialRepository = credentialRepository;
    this.clock = clock;
  }

  /**
   * Presents the request and resolves once the callback has been fully handled.
   *
   * @return completes normally once credentials are stored, exceptionally with the flow's failure
   */
  public CompletableFuture<Void> start(AuthorizationRequest request,
                                       AuthorizationPresenter presenter,
                                       boolean ephemeral) {
    PendingFlow flow = new PendingFlow(request, new CompletableFuture<>());
    if (!pending.compareAndSet(null, flow)) {
      log.warn("Rejected authorization flow: another flow is awaiting its callback");
      return CompletableFuture.failedFuture(new AuthorizationFlowException(
          AuthorizationFlowException.FLOW_IN_PROGRESS, "An authorization flow is already in progress"));
    }

    flowState = FlowState.AWAITING_CALLBACK;
    log.info("Presenting {}", request);
    try {
      presenter.present(request, ephemeral, (response, error) -> onCallback(flow, response, error));
    } catch (RuntimeException e) {
      onCallback(flow, null, e);
    }
    return flow.result();
  }

  public FlowState state() {
    return flowState;
  }

  public boolean isFlowInProgress() {
    return pending.get() != null;
  }

  private void onCallback(PendingFlow flow, AuthorizationResponse response, Throwable error) {
    if (pending.get() != flow) {
      log.warn("Ignoring callback for an authorization flow that is no longer outstanding");
      return;
    }

    if (error != null) {
      Throwable cause = unwrap(error);
      boolean cancelled = cause instanceof AuthorizationFlowException flowException
          && flowException.isUserCancellation();
      if (cancelled) {
        log.info("User cancelled the authorization flow");
      } else {
        log.error("Authorization flow failed", cause);
      }
      fail(flow, cancelled ? FlowState.CANCELLED : FlowState.FAILED, cause);
      return;
    }

    if (response == null) {
      log.error("Authorization flow ended without a result");
      fail(flow, FlowState.FAILED, new NotAuthenticatedException("Authorization flow returned no result"));
      return;
    }

    try {
      handleSuccess(flow.request(), response);
      finish(flow, FlowState.SUCCEEDED);
      flow.result().complete(null);
    } catch (FailedToSaveStateException e) {
      log.error("Authorization succeeded but credentials could not be saved", e);
      finish(flow, FlowState.FAILED);
      flow.result().completeExceptionally(e);
    } catch (RuntimeException e) {
      log.error("Failed to complete authorization flow", e);
      fail(flow, FlowState.FAILED, e);
    }
  }

  private void handleSuccess(AuthorizationRequest request, AuthorizationResponse response) {
    if (!Objects.equals(request.state(), response.state())) {
      throw new AuthorizationFlowException(AuthorizationFlowException.STATE_MISMATCH,
                                           "Authorization response state does not match the request");
    }

    TokenEndpointResponse tokens = tokenEndpointClient.exchangeAuthorizationCode(
        request.tokenEndpoint(), response.code(), request.redirectUri(), request.codeVerifier());

    if (request.nonce() != null) {
      String returnedNonce = JwtClaimsUtils.extractNonce(tokens.idToken()).orElse(null);
      if (!request.nonce().equals(returnedNonce)) {
        throw new AuthorizationFlowException(AuthorizationFlowException.NONCE_MISMATCH,
                                             "ID token nonce does not match the request");
      }
    }

    Instant now = clock.instant();
    CredentialState received = new CredentialState(
        tokens.accessToken(),
        tokens.idToken(),
        JwtClaimsUtils.resolveExpiry(tokens.accessToken(), tokens.expiresIn(), now),
        tokens.refreshToken(),
        true);

    Optional<CredentialState> current = credentialRepository.current();
    if (current.isPresent() && current.get().isAuthenticated(now) && isSameUser(current.get(), received)) {
      log.info("Session for the same user is still valid, keeping existing credentials");
      return;
    }

    try {
      credentialRepository.replace(received);
    } catch (SecretStoreException e) {
      throw new FailedToSaveStateException("Failed to save credentials after authorization", e);
    }
    log.info("Authorization flow completed, credentials stored");
  }

  private static boolean isSameUser(CredentialState current, CredentialState received) {
    Optional<String> currentEmail = JwtClaimsUtils.extractEmail(current.idToken());
    Optional<String> receivedEmail = JwtClaimsUtils.extractEmail(received.idToken());
    return currentEmail.isPresent() && currentEmail.equals(receivedEmail);
  }

  private void fail(PendingFlow flow, FlowState terminalState, Throwable cause) {
    try {
      credentialRepository.clear();
    } catch (SecretStoreException e) {
      log.error("Failed to clear credentials after a failed authorization flow", e);
    }
    finish(flow, terminalState);
    flow.result().completeExceptionally(cause);
  }

  private void finish(PendingFlow flow, FlowState terminalState) {
    flowState = terminalState;
    pending.compareAndSet(flow, null);
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
