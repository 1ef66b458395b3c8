package com.example.authclient.domain.entity;

import java.util.Optional;

/**
 * A feature flag resolved from the {@code feature_flags} claim.
 * Default-valued flags carry no type.
 */
public record Flag(String code, FlagType type, ClaimValue value, boolean isDefault) {

  public static Flag fromClaim(String code, FlagType type, ClaimValue value) {
    return new Flag(code, type, value, false);
  }

  public static Flag withDefault(String code, Object defaultValue) {
    return new Flag(code, null, ClaimValue.of(defaultValue), true);
  }

  public Optional<FlagType> findType() {
    return Optional.ofNullable(type);
  }
}
