package com.example.authclient.adapter.store;

import com.example.authclient.exception.EncryptionException;
import com.example.authclient.exception.SecretStoreException;
import com.example.authclient.service.EncryptionService;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One AES-GCM encrypted file per key under a private directory.
 * Writes go through a temp file and an atomic move so a crash never leaves a torn record.
 */
@Slf4j
public class EncryptedFileSecretStore implements SecretStore {

  private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9._-]+");
  private static final String FILE_SUFFIX = ".secret";

  private final Path directory;
  private final EncryptionService encryptionService;

  public EncryptedFileSecretStore(Path directory, EncryptionService encryptionService) {
    this.directory = directory;
    this.encryptionService = encryptionService;
  }

  @Override
  public Optional<byte[]> get(String key) {
    Path file = resolve(key);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      String encrypted = Files.readString(file, StandardCharsets.US_ASCII);
      return Optional.of(encryptionService.decrypt(encrypted.trim()));
    } catch (IOException | EncryptionException e) {
      throw new SecretStoreException("Failed to read secret: " + key, e);
    }
  }

  @Override
  public boolean put(String key, byte[] blob) {
    Path file = resolve(key);
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, key, ".tmp");
      Files.writeString(temp, encryptionService.encrypt(blob), StandardCharsets.US_ASCII);
      moveIntoPlace(temp, file);
      return true;
    } catch (IOException | EncryptionException e) {
      log.error("Failed to write secret {} to {}", key, directory, e);
      discard(temp);
      return false;
    }
  }

  // a failed write must not leave the encrypted blob behind
  private static void discard(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.error("Failed to remove temporary secret file {}", temp, e);
    }
  }

  @Override
  public boolean delete(String key) {
    try {
      Files.deleteIfExists(resolve(key));
      return true;
    } catch (IOException e) {
      log.error("Failed to delete secret {} from {}", key, directory, e);
      return false;
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.exists(resolve(key));
  }

  private Path resolve(String key) {
    if (!SAFE_KEY.matcher(key).matches()) {
      throw new SecretStoreException("Illegal secret key: " + key);
    }
    return directory.resolve(key + FILE_SUFFIX);
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
