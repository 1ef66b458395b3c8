package com.example.authclient.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.authclient.domain.entity.CredentialState;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CredentialStateCodecTest {

  private final CredentialStateCodec codec = new CredentialStateCodec(new ObjectMapper());

  @Test
  void writesSnakeCaseFieldsAndIsoExpiry() {
    CredentialState state = new CredentialState(
        "access", "id", Instant.parse("2026-01-17T00:00:00Z"), "refresh", true);

    String json = new String(codec.encode(state), StandardCharsets.UTF_8);

    assertThat(json)
        .contains("\"access_token\":\"access\"")
        .contains("\"access_token_expiry\":\"2026-01-17T00:00:00Z\"")
        .contains("\"authorized\":true");
    assertThat(codec.decode(json.getBytes(StandardCharsets.UTF_8))).contains(state);
  }

  @Test
  void toleratesUnknownFieldsAndMissingOptionals() {
    byte[] blob = "{\"access_token\":\"a\",\"authorized\":true,\"extra\":1}".getBytes(StandardCharsets.UTF_8);

    assertThat(codec.decode(blob))
        .contains(new CredentialState("a", null, null, null, true));
  }
}
