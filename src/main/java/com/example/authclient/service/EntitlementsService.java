package com.example.authclient.service;

import com.example.authclient.adapter.entitlements.client.EntitlementsApiClient;
import com.example.authclient.adapter.entitlements.dto.Entitlement;
import com.example.authclient.adapter.entitlements.dto.EntitlementResponse;
import com.example.authclient.adapter.entitlements.dto.EntitlementsResponse;
import com.example.authclient.domain.entity.ClaimValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entitlements from two sources: the {@code entitlements} claim of the access token, and the
 * account API. Claim lookups never fail; hard checks fall back to the caller's default.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntitlementsService {

  public static final String CLAIM_ENTITLEMENTS = "entitlements";

  private final ClaimsResolver claimsResolver;
  private final EntitlementsApiClient entitlementsApiClient;

  /**
   * All entitlements carried by the access token, or an empty map.
   */
  public Map<String, ClaimValue> getEntitlements() {
    return claimsResolver.getClaimDictionary(CLAIM_ENTITLEMENTS);
  }

  public Optional<ClaimValue> getEntitlement(String featureKey) {
    return Optional.ofNullable(getEntitlements().get(featureKey));
  }

  public boolean hasEntitlement(String featureKey) {
    return getEntitlement(featureKey).isPresent();
  }

  // --- Account API ---

  public EntitlementsResponse fetchEntitlements(Integer pageSize, String startingAfter) {
    return entitlementsApiClient.fetchPage(pageSize, startingAfter);
  }

  public EntitlementResponse fetchEntitlement() {
    return entitlementsApiClient.fetchEntitlement();
  }

  public List<Entitlement> getAllEntitlements() {
    return entitlementsApiClient.fetchAll();
  }

  /**
   * All server-side entitlements keyed by entitlement key. Later pages win on duplicate keys.
   */
  public Map<String, ClaimValue> getEntitlementsDictionary() {
    Map<String, ClaimValue> dictionary = new LinkedHashMap<>();
    for (Entitlement entitlement : getAllEntitlements()) {
      dictionary.put(entitlement.key(),
                     entitlement.value() != null ? entitlement.value() : ClaimValue.NullValue.INSTANCE);
    }
    return dictionary;
  }

  // --- Hard checks ---

  public boolean getBooleanEntitlement(String featureKey, boolean defaultValue) {
    return getEntitlement(featureKey).flatMap(ClaimValue::coerceBoolean).orElse(defaultValue);
  }

  public String getStringEntitlement(String featureKey, String defaultValue) {
    return getEntitlement(featureKey)
        .map(value -> value.asString().orElseGet(value::render))
        .orElse(defaultValue);
  }

  public int getNumericEntitlement(String featureKey, int defaultValue) {
    return getEntitlement(featureKey).flatMap(ClaimValue::coerceInteger).orElse(defaultValue);
  }

  /**
   * Runs a validation and falls back when it yields nothing.
   *
   * @param checkName     used in the log line when the fallback is taken
   * @param validation    returns the checked value, or null if the check did not pass
   * @param fallbackValue returned when the validation yields null
   */
  public <T> T performHardCheck(String checkName, Supplier<T> validation, T fallbackValue) {
    T result = validation.get();
    if (result != null) {
      return result;
    }
    log.error("Hard check '{}' failed, using fallback: {}", checkName, fallbackValue);
    return fallbackValue;
  }
}
