package com.example.authclient.service;

import com.example.authclient.adapter.store.SecretStore;
import com.example.authclient.domain.entity.CredentialState;
import com.example.authclient.exception.SecretStoreException;
import com.example.authclient.properties.AuthClientProperties;
import com.example.authclient.security.CredentialStateListener;
import com.example.authclient.security.TokenRefresher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of the credential slot: an in-memory snapshot backed by the secret store.
 * <p>
 * The store is read at most once per process. After that the cache is the source of truth and
 * every mutation updates it before touching the store, so a failed write never hides a new state
 * from readers.
 */
@Slf4j
@Service
public class CredentialRepository implements CredentialStateListener {

  private final SecretStore secretStore;
  private final CredentialStateCodec codec;
  private final String storeKey;
  private final ReentrantLock writeLock = new ReentrantLock();

  // null until hydrated; Optional.empty() means "no session"
  private volatile Optional<CredentialState> cache;

  public CredentialRepository(SecretStore secretStore,
                              CredentialStateCodec codec,
                              TokenRefresher tokenRefresher,
                              AuthClientProperties properties) {
    this.secretStore = secretStore;
    this.codec = codec;
    this.storeKey = properties.store().key();
    tokenRefresher.registerListener(this);
  }

  /**
   * Returns the cached state, hydrating it from the secret store on first access.
   */
  public Optional<CredentialState> current() {
    Optional<CredentialState> snapshot = cache;
    if (snapshot != null) {
      return snapshot;
    }

    writeLock.lock();
    try {
      if (cache == null) {
        cache = hydrate();
      }
      return cache;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Replaces the current state. The cache is updated even if persistence fails.
   *
   * @throws SecretStoreException if the state could not be written to the secret store
   */
  public void replace(CredentialState state) {
    writeLock.lock();
    try {
      cache = Optional.of(state);
      if (!secretStore.put(storeKey, codec.encode(state))) {
        throw new SecretStoreException("Failed to persist credential state");
      }
      log.debug("Credential state persisted");
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Drops the cached and stored state. Clearing an empty repository succeeds.
   *
   * @throws SecretStoreException if an existing record could not be deleted
   */
  public void clear() {
    writeLock.lock();
    try {
      cache = Optional.empty();
      if (!secretStore.delete(storeKey)) {
        throw new SecretStoreException("Failed to delete stored credential state");
      }
      log.debug("Credential state cleared");
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public void onCredentialStateChanged(CredentialState state) {
    log.debug("Persisting externally refreshed credential state");
    replace(state);
  }

  private Optional<CredentialState> hydrate() {
    try {
      Optional<CredentialState> stored = secretStore.get(storeKey).flatMap(codec::decode);
      log.debug("Hydrated credential cache from secret store (present: {})", stored.isPresent());
      return stored;
    } catch (SecretStoreException e) {
      log.error("Failed to read credential state, starting unauthenticated", e);
      return Optional.empty();
    }
  }
}
