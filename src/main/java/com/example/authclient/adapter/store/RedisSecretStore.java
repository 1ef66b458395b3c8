package com.example.authclient.adapter.store;

import com.example.authclient.exception.EncryptionException;
import com.example.authclient.exception.SecretStoreException;
import com.example.authclient.service.EncryptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.Optional;

/**
 * Credential blobs encrypted with AES-GCM and kept as plain string values in Redis.
 */
@Slf4j
public class RedisSecretStore implements SecretStore {

  private final RedisTemplate<String, String> redisTemplate;
  private final EncryptionService encryptionService;
  private final String keyPrefix;

  public RedisSecretStore(RedisTemplate<String, String> redisTemplate,
                          EncryptionService encryptionService,
                          String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.encryptionService = encryptionService;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public Optional<byte[]> get(String key) {
    try {
      String encrypted = redisTemplate.opsForValue().get(keyPrefix + key);
      if (encrypted == null) {
        return Optional.empty();
      }
      return Optional.of(encryptionService.decrypt(encrypted));
    } catch (DataAccessException | EncryptionException e) {
      throw new SecretStoreException("Failed to read secret from Redis: " + key, e);
    }
  }

  @Override
  public boolean put(String key, byte[] blob) {
    try {
      redisTemplate.opsForValue().set(keyPrefix + key, encryptionService.encrypt(blob));
      return true;
    } catch (DataAccessException | EncryptionException e) {
      log.error("Failed to write secret {} to Redis", key, e);
      return false;
    }
  }

  @Override
  public boolean delete(String key) {
    try {
      redisTemplate.delete(keyPrefix + key);
      return true;
    } catch (DataAccessException e) {
      log.error("Failed to delete secret {} from Redis", key, e);
      return false;
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      return Boolean.TRUE.equals(redisTemplate.hasKey(keyPrefix + key));
    } catch (DataAccessException e) {
      throw new SecretStoreException("Failed to check secret in Redis: " + key, e);
    }
  }
}
