package com.example.authclient.adapter.entitlements.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EntitlementPlan(
    @JsonProperty("code")
    String code,
    @JsonProperty("name")
    String name,
    @JsonProperty("description")
    String description
) {}
