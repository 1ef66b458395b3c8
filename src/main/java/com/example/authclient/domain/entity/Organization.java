package com.example.authclient.domain.entity;

public record Organization(String code) {}
