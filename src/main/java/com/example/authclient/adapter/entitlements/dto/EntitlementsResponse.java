package com.example.authclient.adapter.entitlements.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EntitlementsResponse(
    @JsonProperty("data")
    EntitlementsPage data,
    @JsonProperty("metadata")
    EntitlementsMetadata metadata
) {}
