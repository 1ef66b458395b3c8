package com.example.authclient;

import com.example.authclient.adapter.presenter.AuthorizationPresenter;
import com.example.authclient.domain.entity.AuthorizationIntent;
import com.example.authclient.domain.entity.Claim;
import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.domain.entity.Flag;
import com.example.authclient.domain.entity.FlagType;
import com.example.authclient.domain.entity.Organization;
import com.example.authclient.domain.entity.Permission;
import com.example.authclient.domain.entity.Permissions;
import com.example.authclient.domain.entity.TokenPair;
import com.example.authclient.domain.entity.TokenType;
import com.example.authclient.domain.entity.UserOrganizations;
import com.example.authclient.domain.entity.UserProfile;
import com.example.authclient.exception.AuthorizationFlowException;
import com.example.authclient.exception.NotAuthenticatedException;
import com.example.authclient.exception.SecretStoreException;
import com.example.authclient.properties.AuthClientProperties;
import com.example.authclient.service.AuthorizationFlowController;
import com.example.authclient.service.AuthorizationRequestBuilder;
import com.example.authclient.service.ClaimsResolver;
import com.example.authclient.service.CredentialRepository;
import com.example.authclient.service.EntitlementsService;
import com.example.authclient.service.FeatureFlagsService;
import com.example.authclient.service.TokenLifecycleManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for applications: interactive login, token access and claim-derived authorization facts.
 */
@Slf4j
@Service
public class AuthClient {

  private final AuthorizationRequestBuilder requestBuilder;
  private final AuthorizationFlowController flowController;
  private final ObjectProvider<AuthorizationPresenter> presenterProvider;
  private final CredentialRepository credentialRepository;
  private final TokenLifecycleManager tokenLifecycleManager;
  private final ClaimsResolver claimsResolver;
  private final EntitlementsService entitlementsService;
  private final FeatureFlagsService featureFlagsService;
  private final Executor executor;

  private volatile boolean privateAuthSession;

  public AuthClient(AuthorizationRequestBuilder requestBuilder,
                    AuthorizationFlowController flowController,
                    ObjectProvider<AuthorizationPresenter> presenterProvider,
                    CredentialRepository credentialRepository,
                    TokenLifecycleManager tokenLifecycleManager,
                    ClaimsResolver claimsResolver,
                    EntitlementsService entitlementsService,
                    FeatureFlagsService featureFlagsService,
                    @Qualifier("authClientExecutor") Executor executor,
                    AuthClientProperties properties) {
    this.requestBuilder = requestBuilder;
    this.flowController = flowController;
    this.presenterProvider = presenterProvider;
    this.credentialRepository = credentialRepository;
    this.tokenLifecycleManager = tokenLifecycleManager;
    this.claimsResolver = claimsResolver;
    this.entitlementsService = entitlementsService;
    this.featureFlagsService = featureFlagsService;
    this.executor = executor;
    this.privateAuthSession = properties.privateSession();
  }

  // --- Interactive flow ---

  public CompletableFuture<Void> login() {
    return login("", "");
  }

  public CompletableFuture<Void> login(String orgCode, String loginHint) {
    return authorize(AuthorizationIntent.login(orgCode, loginHint));
  }

  public CompletableFuture<Void> register() {
    return register("", "", "", "");
  }

  public CompletableFuture<Void> register(String orgCode, String loginHint,
                                          String planInterest, String pricingTableKey) {
    return authorize(AuthorizationIntent.register(orgCode, loginHint, planInterest, pricingTableKey));
  }

  public CompletableFuture<Void> createOrg() {
    return createOrg("");
  }

  public CompletableFuture<Void> createOrg(String orgName) {
    return authorize(AuthorizationIntent.createOrg(orgName));
  }

  /**
   * Runs the interactive flow for an arbitrary intent, e.g. one with nonce binding enabled.
   * Discovery and request building run on the client executor.
   */
  public CompletableFuture<Void> authorize(AuthorizationIntent intent) {
    return CompletableFuture
        .supplyAsync(() -> requestBuilder.build(intent), executor)
        .thenCompose(request -> flowController.start(request, presenter(), privateAuthSession));
  }

  /**
   * Forgets the local session.
   *
   * @return {@code false} if the stored credentials could not be removed
   */
  public boolean logout() {
    try {
      credentialRepository.clear();
      log.info("Logged out, credentials cleared");
      return true;
    } catch (SecretStoreException e) {
      log.error("Failed to clear credentials on logout", e);
      return false;
    }
  }

  /**
   * Suppresses browser session and cookie reuse across presentations.
   */
  public void enablePrivateAuthSession(boolean enable) {
    this.privateAuthSession = enable;
  }

  /**
   * Whether the failure is the user backing out of the flow, as opposed to a genuine error.
   */
  public boolean isUserCancellation(Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    return cause instanceof AuthorizationFlowException flowException && flowException.isUserCancellation();
  }

  // --- Tokens ---

  public String getToken() {
    return tokenLifecycleManager.getToken(TokenType.ACCESS_TOKEN);
  }

  public String getToken(TokenType tokenType) {
    return tokenLifecycleManager.getToken(tokenType);
  }

  public TokenPair getTokens() {
    return tokenLifecycleManager.getTokens();
  }

  /**
   * The last stored credential state, without refreshing.
   */
  public Optional<CredentialState> currentCredentials() {
    return credentialRepository.current();
  }

  // --- Claims ---

  public boolean isAuthorized() {
    return claimsResolver.isAuthorized();
  }

  public boolean isAuthenticated() {
    return claimsResolver.isAuthenticated();
  }

  public Optional<UserProfile> getUserDetails() {
    return claimsResolver.getUserDetails();
  }

  public Optional<Claim> getClaim(String key) {
    return claimsResolver.getClaim(key);
  }

  public Optional<Claim> getClaim(String key, TokenType tokenType) {
    return claimsResolver.getClaim(key, tokenType);
  }

  public Optional<Permissions> getPermissions() {
    return claimsResolver.getPermissions();
  }

  public Optional<Permission> getPermission(String name) {
    return claimsResolver.getPermission(name);
  }

  public Optional<Organization> getOrganization() {
    return claimsResolver.getOrganization();
  }

  public Optional<UserOrganizations> getUserOrganizations() {
    return claimsResolver.getUserOrganizations();
  }

  public Flag getFlag(String code, Object defaultValue, FlagType flagType) {
    return claimsResolver.getFlag(code, defaultValue, flagType);
  }

  public boolean getBooleanFlag(String code, Boolean defaultValue) {
    return claimsResolver.getBooleanFlag(code, defaultValue);
  }

  public String getStringFlag(String code, String defaultValue) {
    return claimsResolver.getStringFlag(code, defaultValue);
  }

  public int getIntegerFlag(String code, Integer defaultValue) {
    return claimsResolver.getIntegerFlag(code, defaultValue);
  }

  public ClaimsResolver claims() {
    return claimsResolver;
  }

  public EntitlementsService entitlements() {
    return entitlementsService;
  }

  public FeatureFlagsService featureFlags() {
    return featureFlagsService;
  }

  private AuthorizationPresenter presenter() {
    AuthorizationPresenter presenter = presenterProvider.getIfAvailable();
    if (presenter == null) {
      throw new NotAuthenticatedException("No authorization presenter is available to show the login page");
    }
    return presenter;
  }
}
