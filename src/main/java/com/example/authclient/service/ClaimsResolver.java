package com.example.authclient.service;

import com.example.authclient.domain.entity.Claim;
import com.example.authclient.domain.entity.ClaimValue;
import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.domain.entity.Flag;
import com.example.authclient.domain.entity.FlagType;
import com.example.authclient.domain.entity.Organization;
import com.example.authclient.domain.entity.Permission;
import com.example.authclient.domain.entity.Permissions;
import com.example.authclient.domain.entity.TokenType;
import com.example.authclient.domain.entity.UserOrganizations;
import com.example.authclient.domain.entity.UserProfile;
import com.example.authclient.exception.FlagException;
import com.example.authclient.util.JwtClaimsUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the cached tokens into authorization facts.
 * <p>
 * Claims are parsed from the current token on every call and never cached, so lookups always
 * reflect the latest refresh. Presence queries fail soft to empty; typed flag lookups throw
 * {@link FlagException}.
 */
@Slf4j
@Service
public class ClaimsResolver {

  public static final String CLAIM_PERMISSIONS = "permissions";
  public static final String CLAIM_ORG_CODE = "org_code";
  public static final String CLAIM_ORG_CODES = "org_codes";
  public static final String CLAIM_FEATURE_FLAGS = "feature_flags";

  private static final String FLAG_TYPE_KEY = "t";
  private static final String FLAG_VALUE_KEY = "v";

  private final CredentialRepository credentialRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ClaimsResolver(CredentialRepository credentialRepository, ObjectMapper objectMapper, Clock clock) {
    this.credentialRepository = credentialRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Whether an authorization round-trip has succeeded, regardless of token expiry.
   */
  public boolean isAuthorized() {
    return credentialRepository.current().map(CredentialState::authorized).orElse(false);
  }

  /**
   * Whether the session is authorized and the access token has not expired at this instant.
   * Does not refresh.
   */
  public boolean isAuthenticated() {
    return credentialRepository.current()
        .map(state -> state.isAuthenticated(clock.instant()))
        .orElse(false);
  }

  public Optional<UserProfile> getUserDetails() {
    Optional<Map<String, Object>> claims = tokenClaims(TokenType.ID_TOKEN);
    if (claims.isEmpty()) {
      return Optional.empty();
    }
    Map<String, Object> idClaims = claims.get();
    if (!(idClaims.get("sub") instanceof String id) || !(idClaims.get("email") instanceof String email)) {
      return Optional.empty();
    }
    return Optional.of(new UserProfile(
        id,
        email,
        stringOrNull(idClaims.get("family_name")),
        stringOrNull(idClaims.get("given_name")),
        stringOrNull(idClaims.get("picture"))));
  }

  public Optional<Claim> getClaim(String key) {
    return getClaim(key, TokenType.ACCESS_TOKEN);
  }

  /**
   * @return the claim if the chosen token carries the key with a non-null value
   */
  public Optional<Claim> getClaim(String key, TokenType tokenType) {
    return tokenClaims(tokenType)
        .map(claims -> claims.get(key))
        .map(value -> new Claim(key, ClaimValue.of(value)));
  }

  public Optional<Permissions> getPermissions() {
    return permissionNames().flatMap(names ->
        getOrganization().map(organization -> new Permissions(organization, names)));
  }

  public Optional<Permission> getPermission(String name) {
    return permissionNames().flatMap(names ->
        getOrganization().map(organization -> new Permission(organization, names.contains(name))));
  }

  /**
   * Grant status of one permission; not granted when the claims are unavailable.
   */
  public boolean isPermissionGranted(String name) {
    return getPermission(name).map(Permission::isGranted).orElse(false);
  }

  public Optional<Organization> getOrganization() {
    return getClaim(CLAIM_ORG_CODE)
        .flatMap(claim -> claim.value().asString())
        .map(Organization::new);
  }

  public Optional<UserOrganizations> getUserOrganizations() {
    return getClaim(CLAIM_ORG_CODES, TokenType.ID_TOKEN)
        .flatMap(claim -> claim.value().asStringList())
        .map(codes -> new UserOrganizations(codes.stream().map(Organization::new).toList()));
  }

  // --- Feature flags ---

  public Flag getFlag(String code) {
    return getFlag(code, null, null);
  }

  public Flag getFlag(String code, Object defaultValue) {
    return getFlag(code, defaultValue, null);
  }

  /**
   * Resolves a flag from the {@code feature_flags} claim.
   *
   * @param code         the flag code
   * @param defaultValue returned, marked as default, when the code is absent; may be null
   * @param expectedType if set, the flag's declared type must match
   * @throws FlagException {@code UNKNOWN} if the claim is missing, {@code INCORRECT_TYPE} on a type
   *                       mismatch, {@code NOT_FOUND} if absent without a default
   */
  public Flag getFlag(String code, Object defaultValue, FlagType expectedType) {
    Map<String, ClaimValue> flags = getClaim(CLAIM_FEATURE_FLAGS)
        .flatMap(claim -> claim.value().asMap())
        .orElseThrow(FlagException::unknown);

    Optional<Map<String, ClaimValue>> flagData = Optional.ofNullable(flags.get(code)).flatMap(ClaimValue::asMap);
    Optional<FlagType> declaredType = flagData
        .flatMap(data -> Optional.ofNullable(data.get(FLAG_TYPE_KEY)))
        .flatMap(ClaimValue::asString)
        .flatMap(FlagType::fromCode);

    if (declaredType.isPresent() && flagData.get().containsKey(FLAG_VALUE_KEY)) {
      FlagType actualType = declaredType.get();
      if (expectedType != null && expectedType != actualType) {
        throw new FlagException(FlagException.Reason.INCORRECT_TYPE,
            "Flag \"%s\" is type %s - requested type %s".formatted(
                code, actualType.description(), expectedType.description()));
      }
      return Flag.fromClaim(code, actualType, flagData.get().get(FLAG_VALUE_KEY));
    }

    if (defaultValue != null) {
      return Flag.withDefault(code, defaultValue);
    }
    throw FlagException.notFound(code);
  }

  public boolean getBooleanFlag(String code) {
    return getBooleanFlag(code, null);
  }

  public boolean getBooleanFlag(String code, Boolean defaultValue) {
    return getFlag(code, defaultValue, FlagType.BOOLEAN).value().asBoolean()
        .or(() -> Optional.ofNullable(defaultValue))
        .orElseThrow(() -> FlagException.notFound(code));
  }

  public String getStringFlag(String code) {
    return getStringFlag(code, null);
  }

  public String getStringFlag(String code, String defaultValue) {
    return getFlag(code, defaultValue, FlagType.STRING).value().asString()
        .or(() -> Optional.ofNullable(defaultValue))
        .orElseThrow(() -> FlagException.notFound(code));
  }

  public int getIntegerFlag(String code) {
    return getIntegerFlag(code, null);
  }

  public int getIntegerFlag(String code, Integer defaultValue) {
    return getFlag(code, defaultValue, FlagType.INTEGER).value().asInteger()
        .or(() -> Optional.ofNullable(defaultValue))
        .orElseThrow(() -> FlagException.notFound(code));
  }

  /**
   * Reads a claim that may hold a mapping either directly or as a JSON-encoded string.
   *
   * @return the mapping, or an empty map if the claim is absent or in neither form
   */
  public Map<String, ClaimValue> getClaimDictionary(String key) {
    Optional<ClaimValue> value = getClaim(key).map(Claim::value);
    if (value.isEmpty()) {
      return Map.of();
    }

    Optional<String> encoded = value.get().asString();
    if (encoded.isPresent()) {
      try {
        return ClaimValue.fromJson(objectMapper.readTree(encoded.get())).asMap().orElse(Map.of());
      } catch (JsonProcessingException e) {
        log.error("Failed to parse {} claim as JSON: {}", key, e.getOriginalMessage());
      }
    }
    return value.get().asMap().orElse(Map.of());
  }

  private Optional<List<String>> permissionNames() {
    return getClaim(CLAIM_PERMISSIONS).flatMap(claim -> claim.value().asStringList());
  }

  private Optional<Map<String, Object>> tokenClaims(TokenType tokenType) {
    return credentialRepository.current()
        .map(state -> tokenType == TokenType.ACCESS_TOKEN ? state.accessToken() : state.idToken())
        .flatMap(JwtClaimsUtils::parseClaims);
  }

  private static String stringOrNull(Object value) {
    return value instanceof String s ? s : null;
  }
}
