package com.example.authclient.adapter.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Nothing survives a restart.
 */
public class InMemorySecretStore implements SecretStore {

  private final ConcurrentHashMap<String, byte[]> secrets = new ConcurrentHashMap<>();

  @Override
  public Optional<byte[]> get(String key) {
    return Optional.ofNullable(secrets.get(key)).map(byte[]::clone);
  }

  @Override
  public boolean put(String key, byte[] blob) {
    secrets.put(key, blob.clone());
    return true;
  }

  @Override
  public boolean delete(String key) {
    secrets.remove(key);
    return true;
  }

  @Override
  public boolean exists(String key) {
    return secrets.containsKey(key);
  }
}
