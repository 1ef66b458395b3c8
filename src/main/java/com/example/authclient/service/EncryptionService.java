package com.example.authclient.service;

import com.example.authclient.exception.EncryptionException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for credential blobs at rest.
 * Output layout: Base64(IV || ciphertext+tag).
 */
@Slf4j
public class EncryptionService {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final int KEY_LENGTH_BYTES = 32;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final SecretKey key;

  public EncryptionService(String keyBase64) {
    this.key = loadEncryptionKey(keyBase64);
  }

  /**
   * Encrypt data using AES-256-GCM
   */
  public String encrypt(byte[] plaintext) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] encrypted = cipher.doFinal(plaintext);

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Base64.getEncoder().encodeToString(combined);

    } catch (Exception e) {
      log.error("Encryption failed", e);
      throw new EncryptionException("Failed to encrypt data", e);
    }
  }

  /**
   * Decrypt data using AES-256-GCM
   */
  public byte[] decrypt(String encryptedData) {
    try {
      byte[] combined = Base64.getDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        throw new EncryptionException("Encrypted payload is too short");
      }

      byte[] iv = new byte[GCM_IV_LENGTH];
      byte[] encrypted = new byte[combined.length - GCM_IV_LENGTH];
      System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH);
      System.arraycopy(combined, GCM_IV_LENGTH, encrypted, 0, encrypted.length);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return cipher.doFinal(encrypted);

    } catch (EncryptionException e) {
      throw e;
    } catch (Exception e) {
      log.error("Decryption failed", e);
      throw new EncryptionException("Failed to decrypt data", e);
    }
  }

  private static SecretKey loadEncryptionKey(String keyBase64) {
    if (keyBase64 == null || keyBase64.isBlank()) {
      throw new EncryptionException("No encryption key configured");
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(keyBase64.trim());
    } catch (IllegalArgumentException e) {
      throw new EncryptionException("Encryption key is not valid Base64", e);
    }
    if (keyBytes.length != KEY_LENGTH_BYTES) {
      throw new EncryptionException("Invalid key length: expected 256 bits");
    }
    return new SecretKeySpec(keyBytes, "AES");
  }
}
