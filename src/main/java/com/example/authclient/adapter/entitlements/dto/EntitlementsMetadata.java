package com.example.authclient.adapter.entitlements.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pagination cursor returned with each entitlements page
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntitlementsMetadata(
    @JsonProperty("has_more")
    boolean hasMore,
    @JsonProperty("next_page_starting_after")
    String nextPageStartingAfter
) {}
