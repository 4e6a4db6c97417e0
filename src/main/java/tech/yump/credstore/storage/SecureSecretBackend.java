package tech.yump.credstore.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.provider.ProviderRegistry;
import tech.yump.credstore.storage.secure.SecureRecordStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps all secrets as one JSON object inside a single secure record.
 *
 * <p>The record is loaded on first access and held in memory for the lifetime of the process.
 * Each mutation is a read-modify-write of the whole map, so mutations are serialized on this
 * instance's monitor, and the in-memory map is only replaced once the record write has succeeded.
 *
 * <p>If the unified record does not exist yet, legacy per-provider records (one record per
 * provider id) are folded into it; the legacy records are deleted only after the unified record
 * has been written.
 */
@Slf4j
public class SecureSecretBackend implements SecretBackend {

  private static final TypeReference<Map<String, String>> MAP_TYPE_REFERENCE = new TypeReference<>() {};

  private final SecureRecordStore recordStore;
  private final ObjectMapper objectMapper;
  private final String account;
  private final ProviderRegistry providerRegistry;

  // null until loaded; replaced, never mutated in place
  private Map<String, String> secrets;

  public SecureSecretBackend(
          final SecureRecordStore recordStore,
          final ObjectMapper objectMapper,
          final String account,
          final ProviderRegistry providerRegistry
  ) {
    if (!StringUtils.hasText(account)) {
      throw new IllegalArgumentException("Secure record account cannot be null or empty.");
    }
    this.recordStore = recordStore;
    this.objectMapper = objectMapper;
    this.account = account;
    this.providerRegistry = providerRegistry;
  }

  @Override
  public BackendKind kind() {
    return BackendKind.SECURE;
  }

  @Override
  public synchronized Optional<String> get(String key) throws StorageException {
    validateKey(key);
    String value = loadedSecrets().get(key);
    log.debug("Secure lookup for key '{}': {}", key, value != null ? "found" : "not found");
    return Optional.ofNullable(value);
  }

  @Override
  public synchronized void put(String key, String value) throws StorageException {
    validateKey(key);
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null for put operation.");
    }
    Map<String, String> updated = new HashMap<>(loadedSecrets());
    updated.put(key, value);
    persist(updated);
    secrets = updated;
    log.info("Successfully stored secure entry for key '{}' ({} entries in record)", key, updated.size());
  }

  @Override
  public synchronized void remove(String key) throws StorageException {
    validateKey(key);
    Map<String, String> current = loadedSecrets();
    if (!current.containsKey(key)) {
      log.debug("No secure entry to remove for key '{}'", key);
      return;
    }
    Map<String, String> updated = new HashMap<>(current);
    updated.remove(key);
    persist(updated);
    secrets = updated;
    log.info("Successfully removed secure entry for key '{}'", key);
  }

  @Override
  public synchronized void clear() throws StorageException {
    log.warn("Clearing all entries from the secure record");
    Map<String, String> empty = new HashMap<>();
    persist(empty);
    secrets = empty;
  }

  /**
   * @return true if the secure record can currently be loaded.
   */
  public synchronized boolean isAccessible() {
    try {
      loadedSecrets();
      return true;
    } catch (StorageException e) {
      log.warn("Secure store is not accessible: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Drops the in-memory copy; the next access reloads the record.
   */
  public synchronized void reload() {
    secrets = null;
    log.debug("Secure backend in-memory map discarded");
  }

  public synchronized boolean isLoaded() {
    return secrets != null;
  }

  private Map<String, String> loadedSecrets() throws StorageException {
    if (secrets == null) {
      secrets = load();
    }
    return Collections.unmodifiableMap(secrets);
  }

  private Map<String, String> load() throws StorageException {
    Optional<byte[]> record;
    try {
      record = recordStore.read(account);
    } catch (CorruptedDataException e) {
      throw new CorruptedDataException(kind(), "Secure record is corrupted: " + e.getMessage(), e);
    } catch (StorageException e) {
      log.error("Failed to load secure record '{}': {}", account, e.getMessage());
      throw new StorageException(kind(), "Failed to read secure record: " + e.getMessage(), e);
    }

    if (record.isEmpty()) {
      log.info("No secure record found for account '{}', checking legacy records", account);
      return importLegacyRecords();
    }

    Map<String, String> loaded;
    try {
      loaded = objectMapper.readValue(record.get(), MAP_TYPE_REFERENCE);
    } catch (IOException e) {
      log.error("Secure record '{}' does not contain a valid secret map: {}", account, e.getMessage());
      throw new CorruptedDataException(kind(), "Secure record contains corrupted data", e);
    }
    if (loaded == null) {
      throw new CorruptedDataException(kind(), "Secure record contains corrupted data", null);
    }
    log.info("Loaded {} entries from secure record '{}'", loaded.size(), account);
    return new HashMap<>(loaded);
  }

  private Map<String, String> importLegacyRecords() throws StorageException {
    Map<Provider, String> legacy = new LinkedHashMap<>();
    for (Provider provider : providerRegistry.all()) {
      if (provider.id().equals(account)) {
        continue;
      }
      try {
        recordStore.read(provider.id())
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .filter(value -> !value.isEmpty())
                .ifPresent(value -> legacy.put(provider, value));
      } catch (StorageException e) {
        log.warn("Skipping unreadable legacy secure record for provider '{}': {}", provider, e.getMessage());
      }
    }

    Map<String, String> imported = new HashMap<>();
    if (legacy.isEmpty()) {
      return imported;
    }

    legacy.forEach((provider, value) -> imported.put(provider.storageKey(), value));
    persist(imported);
    log.info("Imported {} legacy secure records into '{}'", imported.size(), account);

    List<Provider> importedProviders = List.copyOf(legacy.keySet());
    for (Provider provider : importedProviders) {
      try {
        recordStore.delete(provider.id());
      } catch (StorageException e) {
        log.warn("Could not delete legacy secure record for provider '{}': {}", provider, e.getMessage());
      }
    }
    return imported;
  }

  private void persist(Map<String, String> updated) throws StorageException {
    byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(updated);
    } catch (JsonProcessingException e) {
      throw new StorageWriteException(kind(), "Failed to serialize secret map", e);
    }

    try {
      if (!recordStore.update(account, payload)) {
        recordStore.create(account, payload);
      }
    } catch (StorageException e) {
      log.error("Failed to write secure record '{}': {}", account, e.getMessage());
      throw new StorageWriteException(kind(), "Failed to write secure record: " + e.getMessage(), e);
    }
  }

  private void validateKey(String key) {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
  }
}
