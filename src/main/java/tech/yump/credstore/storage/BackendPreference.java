package tech.yump.credstore.storage;

import lombok.extern.slf4j.Slf4j;
import tech.yump.credstore.storage.prefs.PreferenceStore;

import java.util.Optional;

/**
 * The persisted "current backend" choice. Stored in the preference store next to, but outside
 * the namespace of, the provider secrets.
 */
@Slf4j
public class BackendPreference {

  public static final String PREFERENCE_KEY = "storage_backend";

  private final PreferenceStore preferenceStore;
  private final BackendKind defaultKind;

  public BackendPreference(final PreferenceStore preferenceStore, final BackendKind defaultKind) {
    this.preferenceStore = preferenceStore;
    this.defaultKind = defaultKind != null ? defaultKind : BackendKind.PLAIN;
  }

  /**
   * @return the persisted backend, or the configured default when none (or an unreadable one) is stored.
   * @throws StorageException if the preference store cannot be read.
   */
  public BackendKind current() throws StorageException {
    Optional<String> stored = preferenceStore.get(PREFERENCE_KEY);
    if (stored.isEmpty()) {
      return defaultKind;
    }
    try {
      return BackendKind.fromValue(stored.get());
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring invalid persisted storage backend '{}', using default '{}'", stored.get(), defaultKind.value());
      return defaultKind;
    }
  }

  public void set(BackendKind kind) throws StorageException {
    if (kind == null) {
      throw new IllegalArgumentException("Backend kind cannot be null.");
    }
    preferenceStore.put(PREFERENCE_KEY, kind.value());
    log.info("Current storage backend set to '{}'", kind.value());
  }

  public BackendKind defaultKind() {
    return defaultKind;
  }
}
