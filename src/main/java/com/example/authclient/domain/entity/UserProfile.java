package com.example.authclient.domain.entity;

/**
 * User details read from the ID token
 */
public record UserProfile(
    String id,
    String email,
    String lastName,
    String firstName,
    String picture
) {}
