package tech.yump.credstore.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.credstore.provider.ProviderRegistry;
import tech.yump.credstore.storage.prefs.PreferenceStore;

import java.util.Optional;

/**
 * Stores each secret as an independent, unencrypted entry of the preference store.
 * The preference store has no transactional guarantee, so every mutation is read back before returning.
 */
@Slf4j
public class PlainSecretBackend implements SecretBackend {

  private final PreferenceStore preferenceStore;
  private final ProviderRegistry providerRegistry;

  public PlainSecretBackend(final PreferenceStore preferenceStore, final ProviderRegistry providerRegistry) {
    this.preferenceStore = preferenceStore;
    this.providerRegistry = providerRegistry;
  }

  @Override
  public BackendKind kind() {
    return BackendKind.PLAIN;
  }

  @Override
  public Optional<String> get(String key) throws StorageException {
    validateKey(key);
    try {
      Optional<String> value = preferenceStore.get(key);
      log.debug("Plain lookup for key '{}': {}", key, value.isPresent() ? "found" : "not found");
      return value;
    } catch (StorageException e) {
      log.error("Failed to read plain entry for key '{}': {}", key, e.getMessage());
      throw new StorageException(kind(), "Failed to read plain entry for key: " + key, e);
    }
  }

  @Override
  public void put(String key, String value) throws StorageException {
    validateKey(key);
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null for put operation.");
    }
    try {
      preferenceStore.put(key, value);
    } catch (StorageException e) {
      log.error("Failed to write plain entry for key '{}': {}", key, e.getMessage());
      throw new StorageWriteException(kind(), "Failed to write plain entry for key: " + key, e);
    }

    if (!value.equals(get(key).orElse(null))) {
      log.error("Plain entry for key '{}' does not match the written value", key);
      throw new StorageVerificationException(kind(), "Verification failed after writing key: " + key);
    }
    log.info("Successfully stored plain entry for key '{}'", key);
  }

  @Override
  public void remove(String key) throws StorageException {
    validateKey(key);
    try {
      preferenceStore.remove(key);
    } catch (StorageException e) {
      log.error("Failed to remove plain entry for key '{}': {}", key, e.getMessage());
      throw new StorageWriteException(kind(), "Failed to remove plain entry for key: " + key, e);
    }

    if (get(key).isPresent()) {
      log.error("Plain entry for key '{}' still present after removal", key);
      throw new StorageVerificationException(kind(), "Verification failed after removing key: " + key);
    }
    log.info("Successfully removed plain entry for key '{}'", key);
  }

  /**
   * Removes the entries of the configured providers only; other preferences are left alone.
   */
  @Override
  public void clear() throws StorageException {
    log.warn("Clearing all provider entries from the plain backend");
    for (String key : providerRegistry.storageKeys()) {
      remove(key);
    }
  }

  private void validateKey(String key) {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
  }
}
