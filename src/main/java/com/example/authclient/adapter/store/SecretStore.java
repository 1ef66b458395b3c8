package com.example.authclient.adapter.store;

import java.util.Optional;

/**
 * Opaque secure key-value persistence for the serialized credential blob.
 * Implementations report failure through the boolean results and may throw
 * {@link com.example.authclient.exception.SecretStoreException} on backend errors.
 */
public interface SecretStore {

  Optional<byte[]> get(String key);

  boolean put(String key, byte[] blob);

  boolean delete(String key);

  boolean exists(String key);
}
