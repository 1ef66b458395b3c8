package com.example.authclient.domain.entity;

/**
 * Which token of the credential state a caller wants.
 */
public enum TokenType {
  ACCESS_TOKEN,
  ID_TOKEN
}
