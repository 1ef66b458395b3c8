package com.example.authclient.util;

import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Optional;

/**
 * Utility class for reading JWT payloads without signature verification.
 * Tokens arrive straight from the token endpoint over TLS; this is claim extraction, not validation.
 */
@Slf4j
@UtilityClass
public class JwtClaimsUtils {

  public static final String CLAIM_EMAIL = "email";
  public static final String CLAIM_NONCE = "nonce";

  /**
   * Parses the payload of a compact JWT.
   *
   * @param token the serialized token, may be null
   * @return the claims, or empty if the token is absent or unparseable
   */
  public static Optional<Map<String, Object>> parseClaims(String token) {
    return parseClaimsSet(token).map(JWTClaimsSet::getClaims);
  }

  public static Optional<String> extractEmail(String token) {
    return parseClaimsSet(token).flatMap(claims -> stringClaim(claims, CLAIM_EMAIL));
  }

  public static Optional<String> extractNonce(String token) {
    return parseClaimsSet(token).flatMap(claims -> stringClaim(claims, CLAIM_NONCE));
  }

  public static Optional<Instant> extractExpiry(String token) {
    return parseClaimsSet(token)
        .map(JWTClaimsSet::getExpirationTime)
        .map(Date::toInstant);
  }

  /**
   * Absolute expiry from the token response's {@code expires_in}, falling back to the access token's {@code exp}.
   * <p>
   * Returns null for an opaque token without {@code expires_in}. Such a token is never considered
   * valid, so each token request triggers a refresh.
   */
  public static Instant resolveExpiry(String accessToken, Long expiresIn, Instant now) {
    if (expiresIn != null) {
      return now.plusSeconds(expiresIn);
    }
    return extractExpiry(accessToken).orElse(null);
  }

  private static Optional<JWTClaimsSet> parseClaimsSet(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      JWT jwt = JWTParser.parse(token);
      return Optional.ofNullable(jwt.getJWTClaimsSet());
    } catch (ParseException e) {
      log.debug("Token payload could not be parsed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<String> stringClaim(JWTClaimsSet claims, String name) {
    try {
      return Optional.ofNullable(claims.getStringClaim(name));
    } catch (ParseException e) {
      return Optional.empty();
    }
  }
}
