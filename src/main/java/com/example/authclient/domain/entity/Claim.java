package com.example.authclient.domain.entity;

/**
 * A named value from a token payload. Derived fresh on every lookup, never cached.
 */
public record Claim(String name, ClaimValue value) {}
