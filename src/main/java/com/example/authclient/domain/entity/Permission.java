package com.example.authclient.domain.entity;

/**
 * Grant status of a single permission within an organization
 */
public record Permission(Organization organization, boolean isGranted) {}
