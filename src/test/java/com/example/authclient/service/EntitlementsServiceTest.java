package com.example.authclient.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.authclient.adapter.entitlements.client.EntitlementsApiClient;
import com.example.authclient.adapter.entitlements.dto.Entitlement;
import com.example.authclient.domain.entity.ClaimValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EntitlementsServiceTest {

  @Mock private ClaimsResolver claimsResolver;
  @Mock private EntitlementsApiClient entitlementsApiClient;
  @InjectMocks private EntitlementsService entitlementsService;

  private void tokenEntitlements(Map<String, ClaimValue> entitlements) {
    when(claimsResolver.getClaimDictionary("entitlements")).thenReturn(entitlements);
  }

  @Nested
  class FromTheAccessToken {

    @Test
    void presenceChecks() {
      tokenEntitlements(Map.of("sso", ClaimValue.of(true)));

      assertThat(entitlementsService.hasEntitlement("sso")).isTrue();
      assertThat(entitlementsService.hasEntitlement("audit_log")).isFalse();
    }

    @Test
    void booleanCoercion() {
      tokenEntitlements(Map.of(
          "sso", ClaimValue.of(true),
          "audit_log", ClaimValue.of("false"),
          "seats", ClaimValue.of(10)));

      assertThat(entitlementsService.getBooleanEntitlement("sso", false)).isTrue();
      assertThat(entitlementsService.getBooleanEntitlement("audit_log", true)).isFalse();
      assertThat(entitlementsService.getBooleanEntitlement("seats", true)).isTrue();
      assertThat(entitlementsService.getBooleanEntitlement("missing", false)).isFalse();
    }

    @Test
    void numericCoercion() {
      tokenEntitlements(Map.of(
          "seats", ClaimValue.of(10),
          "projects", ClaimValue.of("25"),
          "tier", ClaimValue.of("gold")));

      assertThat(entitlementsService.getNumericEntitlement("seats", 1)).isEqualTo(10);
      assertThat(entitlementsService.getNumericEntitlement("projects", 1)).isEqualTo(25);
      assertThat(entitlementsService.getNumericEntitlement("tier", 1)).isEqualTo(1);
    }

    @Test
    void stringRendering() {
      tokenEntitlements(Map.of("tier", ClaimValue.of("gold"), "seats", ClaimValue.of(10)));

      assertThat(entitlementsService.getStringEntitlement("tier", "free")).isEqualTo("gold");
      assertThat(entitlementsService.getStringEntitlement("seats", "none")).isEqualTo("10");
      assertThat(entitlementsService.getStringEntitlement("missing", "free")).isEqualTo("free");
    }
  }

  @Nested
  class FromTheAccountApi {

    @Test
    void dictionaryIsKeyedByEntitlementKey() {
      when(entitlementsApiClient.fetchAll()).thenReturn(List.of(
          new Entitlement("seats", ClaimValue.of(5), "integer"),
          new Entitlement("sso", ClaimValue.of(true), "boolean"),
          new Entitlement("seats", ClaimValue.of(10), "integer"),
          new Entitlement("beta", null, "boolean")));

      Map<String, ClaimValue> dictionary = entitlementsService.getEntitlementsDictionary();

      assertThat(dictionary).containsOnlyKeys("seats", "sso", "beta");
      assertThat(dictionary.get("seats").asInteger()).contains(10);
      assertThat(dictionary.get("beta").isNull()).isTrue();
    }
  }

  @Test
  void hardCheckFallsBackWhenValidationYieldsNothing() {
    assertThat(entitlementsService.performHardCheck("seats", () -> 7, 1)).isEqualTo(7);
    assertThat(entitlementsService.performHardCheck("seats", () -> null, 1)).isEqualTo(1);
  }
}
