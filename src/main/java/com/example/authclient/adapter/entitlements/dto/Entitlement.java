package com.example.authclient.adapter.entitlements.dto;

import com.example.authclient.domain.entity.ClaimValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single server-side entitlement
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Entitlement(
    @JsonProperty("key")
    String key,
    @JsonProperty("value")
    ClaimValue value,
    @JsonProperty("type")
    String type
) {}
