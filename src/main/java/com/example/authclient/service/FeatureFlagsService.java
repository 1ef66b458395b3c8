package com.example.authclient.service;

import com.example.authclient.domain.entity.ClaimValue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Lenient, dictionary-style view of the {@code feature_flags} claim.
 * Use {@link ClaimsResolver#getFlag} for type-checked lookups.
 */
@Service
@RequiredArgsConstructor
public class FeatureFlagsService {

  private static final String FLAG_VALUE_KEY = "v";

  private final ClaimsResolver claimsResolver;

  public Map<String, ClaimValue> getFeatureFlags() {
    return claimsResolver.getClaimDictionary(ClaimsResolver.CLAIM_FEATURE_FLAGS);
  }

  public Optional<ClaimValue> getFeatureFlag(String code) {
    return Optional.ofNullable(getFeatureFlags().get(code));
  }

  /**
   * Boolean state of a flag. Accepts a bare value or the {@code {"t": .., "v": ..}} envelope, and
   * the strings {@code "true"}/{@code "false"}; anything else yields the default.
   */
  public boolean isFeatureEnabled(String code, boolean defaultValue) {
    return getFeatureFlag(code)
        .map(FeatureFlagsService::unwrapEnvelope)
        .flatMap(ClaimValue::coerceBoolean)
        .orElse(defaultValue);
  }

  public boolean isFeatureEnabled(String code) {
    return isFeatureEnabled(code, false);
  }

  private static ClaimValue unwrapEnvelope(ClaimValue flag) {
    return flag.asMap()
        .map(envelope -> envelope.get(FLAG_VALUE_KEY))
        .orElse(flag);
  }
}
