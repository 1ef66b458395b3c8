package com.example.authclient.adapter.entitlements.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The {@code data} section of one entitlements page
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntitlementsPage(
    @JsonProperty("org_code")
    String orgCode,
    @JsonProperty("plans")
    List<EntitlementPlan> plans,
    @JsonProperty("entitlements")
    List<Entitlement> entitlements
) {}
