package com.example.authclient.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.authclient.AuthTestFixtures;
import com.example.authclient.exception.EncryptionException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class EncryptionServiceTest {

  private final EncryptionService encryptionService = new EncryptionService(AuthTestFixtures.ENCRYPTION_KEY);

  @Test
  void decryptsWhatItEncrypted() {
    byte[] plaintext = "{\"access_token\":\"abc\"}".getBytes(StandardCharsets.UTF_8);

    String encrypted = encryptionService.encrypt(plaintext);

    assertThat(encrypted).doesNotContain("access_token");
    assertThat(encryptionService.decrypt(encrypted)).isEqualTo(plaintext);
  }

  @Test
  void usesAFreshIvForEveryEncryption() {
    byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

    assertThat(encryptionService.encrypt(plaintext)).isNotEqualTo(encryptionService.encrypt(plaintext));
  }

  @Test
  void rejectsTamperedCiphertext() {
    byte[] combined = Base64.getDecoder().decode(encryptionService.encrypt(new byte[] {1, 2, 3}));
    combined[combined.length - 1] ^= 0x01;

    assertThatThrownBy(() -> encryptionService.decrypt(Base64.getEncoder().encodeToString(combined)))
        .isInstanceOf(EncryptionException.class);
  }

  @Test
  void rejectsKeysOfTheWrongLength() {
    assertThatThrownBy(() -> new EncryptionService("c2hvcnQ="))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("256 bits");
    assertThatThrownBy(() -> new EncryptionService(null))
        .isInstanceOf(EncryptionException.class);
  }
}
