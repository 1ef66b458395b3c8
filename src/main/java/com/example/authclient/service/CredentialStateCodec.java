package com.example.authclient.service;

import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.exception.SecretStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON encoding of {@link CredentialState} for the secret store.
 */
@Slf4j
@Component
public class CredentialStateCodec {

  private final ObjectMapper objectMapper;

  public CredentialStateCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public byte[] encode(CredentialState state) {
    try {
      return objectMapper.writeValueAsBytes(state);
    } catch (JsonProcessingException e) {
      throw new SecretStoreException("Failed to encode credential state", e);
    }
  }

  /**
   * Decodes a stored blob. A blob that cannot be read is reported as absent.
   */
  public Optional<CredentialState> decode(byte[] blob) {
    try {
      return Optional.ofNullable(objectMapper.readValue(blob, CredentialState.class));
    } catch (IOException e) {
      log.warn("Stored credential state could not be decoded, ignoring it: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
