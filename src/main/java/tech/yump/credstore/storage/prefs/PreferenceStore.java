package tech.yump.credstore.storage.prefs;

import tech.yump.credstore.storage.StorageException;

import java.util.Optional;
import java.util.Set;

/**
 * An unstructured, unencrypted key/value preference store. It may hold unrelated application
 * preferences next to secrets and offers no transactional guarantee across keys.
 */
public interface PreferenceStore {

  Optional<String> get(String key) throws StorageException;

  void put(String key, String value) throws StorageException;

  /**
   * Removing an absent key is not an error.
   */
  void remove(String key) throws StorageException;

  Set<String> keys() throws StorageException;
}
