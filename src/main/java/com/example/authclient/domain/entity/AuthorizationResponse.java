package com.example.authclient.domain.entity;

/**
 * Redirect parameters returned by the provider after a successful presentation.
 */
public record AuthorizationResponse(String code, String state) {}
