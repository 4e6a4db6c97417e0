package tech.yump.credstore.storage;

import lombok.extern.slf4j.Slf4j;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.provider.ProviderRegistry;
import tech.yump.credstore.provider.UnknownProviderException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider-scoped CRUD over whichever backend is current, with a read-through cache.
 *
 * <p>The cache mirrors the secrets of a single backend kind. It is filled from that backend on
 * first use, reloaded when the current backend changes, and kept in step with every successful
 * mutation made through this adapter against that backend. Reads of non-current backends
 * ({@link #loadFrom}) always go to the backend.
 */
@Slf4j
public class StorageAdapter {

  private final Map<BackendKind, SecretBackend> backends;
  private final BackendPreference backendPreference;
  private final ProviderRegistry providerRegistry;

  private final Object cacheLock = new Object();
  private final Map<Provider, String> cache = new HashMap<>();
  private BackendKind cachedKind;
  private boolean cacheLoaded;

  public StorageAdapter(
          final Collection<? extends SecretBackend> backends,
          final BackendPreference backendPreference,
          final ProviderRegistry providerRegistry
  ) {
    Map<BackendKind, SecretBackend> byKind = new EnumMap<>(BackendKind.class);
    for (SecretBackend backend : backends) {
      if (byKind.putIfAbsent(backend.kind(), backend) != null) {
        throw new IllegalArgumentException("Duplicate backend for kind: " + backend.kind());
      }
    }
    for (BackendKind kind : BackendKind.values()) {
      if (!byKind.containsKey(kind)) {
        throw new IllegalArgumentException("No backend configured for kind: " + kind);
      }
    }
    this.backends = Collections.unmodifiableMap(byKind);
    this.backendPreference = backendPreference;
    this.providerRegistry = providerRegistry;
  }

  public BackendKind currentBackendKind() throws StorageException {
    return backendPreference.current();
  }

  public SecretBackend backend(BackendKind kind) {
    SecretBackend backend = backends.get(kind);
    if (backend == null) {
      throw new IllegalArgumentException("Unknown backend kind: " + kind);
    }
    return backend;
  }

  public ProviderRegistry providers() {
    return providerRegistry;
  }

  // --- Current backend ---

  /**
   * Sanitizes and stores the key in the current backend.
   *
   * @return the value actually stored (NUL characters stripped).
   * @throws InvalidSecretException if the value is empty after sanitization.
   */
  public String save(Provider provider, String apiKey) throws StorageException {
    return saveTo(currentBackendKind(), provider, apiKey);
  }

  public Optional<String> load(Provider provider) throws StorageException {
    requireKnown(provider);
    BackendKind kind = currentBackendKind();
    synchronized (cacheLock) {
      ensureCacheFor(kind);
      if (cacheLoaded) {
        return Optional.ofNullable(cache.get(provider));
      }
    }
    return loadFrom(kind, provider);
  }

  public void remove(Provider provider) throws StorageException {
    removeFrom(currentBackendKind(), provider);
  }

  /**
   * @return true if the current backend holds a non-empty key for the provider. Served from the cache when possible.
   */
  public boolean has(Provider provider) throws StorageException {
    return load(provider).filter(value -> !value.isEmpty()).isPresent();
  }

  /**
   * Clears the provider secrets of the current backend.
   */
  public void clearAll() throws StorageException {
    BackendKind kind = currentBackendKind();
    try {
      backend(kind).clear();
    } catch (StorageException e) {
      log.error("Failed to clear backend '{}': {}", kind.value(), e.getMessage());
      invalidateCache();
      throw e;
    }
    synchronized (cacheLock) {
      if (kind == cachedKind) {
        cache.clear();
      }
    }
    log.info("Cleared all provider secrets from backend '{}'", kind.value());
  }

  // --- Kind-aware operations used by the atomic manager ---

  public String saveTo(BackendKind kind, Provider provider, String apiKey) throws StorageException {
    requireKnown(provider);
    String sanitized = SecretSanitizer.requireUsable(apiKey);
    try {
      backend(kind).put(provider.storageKey(), sanitized);
    } catch (StorageException e) {
      // the backend may hold anything now
      invalidateCache();
      throw e;
    }
    updateCache(kind, provider, sanitized);
    log.debug("Saved key for provider '{}' to backend '{}'", provider, kind.value());
    return sanitized;
  }

  /**
   * Reads directly from the given backend, bypassing the cache.
   */
  public Optional<String> loadFrom(BackendKind kind, Provider provider) throws StorageException {
    requireKnown(provider);
    return backend(kind).get(provider.storageKey());
  }

  public void removeFrom(BackendKind kind, Provider provider) throws StorageException {
    requireKnown(provider);
    try {
      backend(kind).remove(provider.storageKey());
    } catch (StorageException e) {
      invalidateCache();
      throw e;
    }
    updateCache(kind, provider, null);
    log.debug("Removed key for provider '{}' from backend '{}'", provider, kind.value());
  }

  /**
   * Persists the current backend choice and drops the cache.
   */
  public void selectBackend(BackendKind kind) throws StorageException {
    backendPreference.set(kind);
    invalidateCache();
  }

  /**
   * Moves every provider secret from the current backend to {@code target}: read all, write all,
   * verify all, persist the backend choice, then remove from the source. If any of the first three
   * steps fails, the target is restored to its previous content and the source is left untouched.
   *
   * @return the providers whose keys were moved.
   * @throws MigrationException if the target could not be populated and verified, or the backend choice
   *     could not be persisted.
   */
  public List<Provider> migrate(BackendKind target) throws StorageException {
    BackendKind source = currentBackendKind();
    if (source == target) {
      log.info("Backend '{}' is already current, nothing to migrate", target.value());
      return List.of();
    }
    SecretBackend from = backend(source);
    SecretBackend to = backend(target);
    log.info("Migrating all provider secrets from '{}' to '{}'", source.value(), target.value());

    Map<Provider, String> values = new LinkedHashMap<>();
    Map<Provider, Optional<String>> targetSnapshot = new LinkedHashMap<>();
    for (Provider provider : providerRegistry.all()) {
      from.get(provider.storageKey())
              .filter(value -> !value.isEmpty())
              .ifPresent(value -> values.put(provider, value));
      targetSnapshot.put(provider, to.get(provider.storageKey()));
    }

    try {
      for (Map.Entry<Provider, String> entry : values.entrySet()) {
        to.put(entry.getKey().storageKey(), entry.getValue());
      }
      for (Map.Entry<Provider, String> entry : values.entrySet()) {
        String written = to.get(entry.getKey().storageKey()).orElse(null);
        if (!entry.getValue().equals(written)) {
          throw new StorageWriteException(target, "Verification failed for provider: " + entry.getKey());
        }
      }
    } catch (StorageException e) {
      log.error("Migration to '{}' failed, restoring target backend: {}", target.value(), e.getMessage());
      restore(to, targetSnapshot, e);
      invalidateCache();
      throw new MigrationException(target, "Migration from " + source.value() + " to " + target.value() + " failed: " + e.getMessage(), e);
    }

    // the source copies stay until the new backend choice is persisted
    try {
      selectBackend(target);
    } catch (StorageException e) {
      log.error("Could not persist backend '{}' after migration, restoring target backend: {}", target.value(), e.getMessage());
      restore(to, targetSnapshot, e);
      invalidateCache();
      throw new MigrationException(target, "Failed to persist storage backend " + target.value() + ": " + e.getMessage(), e);
    }

    for (Provider provider : values.keySet()) {
      try {
        from.remove(provider.storageKey());
      } catch (StorageException e) {
        log.warn("Could not remove migrated key for provider '{}' from '{}': {}", provider, source.value(), e.getMessage());
      }
    }

    log.info("Migrated {} provider secrets from '{}' to '{}'", values.size(), source.value(), target.value());
    return new ArrayList<>(values.keySet());
  }

  // --- Cache ---

  public void invalidateCache() {
    synchronized (cacheLock) {
      cache.clear();
      cachedKind = null;
      cacheLoaded = false;
    }
    log.debug("Storage cache invalidated");
  }

  public CacheInfo cacheInfo() {
    synchronized (cacheLock) {
      return new CacheInfo(cacheLoaded, cache.size(), cachedKind);
    }
  }

  /**
   * @param loaded  whether the cache holds a complete view of {@code backend}.
   * @param size    number of providers with a cached key.
   * @param backend the backend the cache mirrors, or null if none.
   */
  public record CacheInfo(boolean loaded, int size, BackendKind backend) {
  }

  private void ensureCacheFor(BackendKind kind) {
    if (cacheLoaded && kind == cachedKind) {
      return;
    }
    cache.clear();
    cachedKind = kind;
    cacheLoaded = false;

    SecretBackend backend = backend(kind);
    Map<Provider, String> loaded = new HashMap<>();
    for (Provider provider : providerRegistry.all()) {
      try {
        backend.get(provider.storageKey()).ifPresent(value -> loaded.put(provider, value));
      } catch (StorageException e) {
        log.warn("Could not populate cache from backend '{}': {}", kind.value(), e.getMessage());
        return;
      }
    }
    cache.putAll(loaded);
    cacheLoaded = true;
    log.debug("Cache loaded from backend '{}' with {} entries", kind.value(), loaded.size());
  }

  private void updateCache(BackendKind kind, Provider provider, String value) {
    synchronized (cacheLock) {
      if (kind != cachedKind) {
        return;
      }
      if (value == null) {
        cache.remove(provider);
      } else {
        cache.put(provider, value);
      }
    }
  }

  private void restore(SecretBackend to, Map<Provider, Optional<String>> snapshot, StorageException failure) {
    snapshot.forEach((provider, previous) -> {
      try {
        if (previous.isPresent()) {
          to.put(provider.storageKey(), previous.get());
        } else {
          to.remove(provider.storageKey());
        }
      } catch (StorageException e) {
        log.error("Failed to restore provider '{}' in backend '{}': {}", provider, to.kind().value(), e.getMessage());
        failure.addSuppressed(e);
      }
    });
  }

  private void requireKnown(Provider provider) {
    if (!providerRegistry.contains(provider)) {
      throw new UnknownProviderException(provider == null ? null : provider.id());
    }
  }
}
