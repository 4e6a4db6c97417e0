package tech.yump.credstore.storage;

import java.util.Optional;

/**
 * Contract for a secret storage mechanism over a flat, string-keyed namespace.
 * All operations are synchronous and may block on I/O.
 */
public interface SecretBackend {

  /**
   * @return which kind of backend this is.
   */
  BackendKind kind();

  /**
   * Retrieves the value stored under the given key.
   *
   * @param key The storage key (e.g. "secret_openai"). Must not be null or empty.
   * @return An Optional containing the value if found, otherwise Optional.empty().
   * @throws StorageException If the underlying store cannot be read or its data is corrupted.
   */
  Optional<String> get(String key) throws StorageException;

  /**
   * Stores the value under the given key, replacing any existing value.
   * Returns only once the store reflects the new value.
   *
   * @param key   The storage key. Must not be null or empty.
   * @param value The value to store. Must not be null.
   * @throws StorageException If the value could not be persisted.
   */
  void put(String key, String value) throws StorageException;

  /**
   * Removes the value stored under the given key. Removing an absent key is not an error.
   *
   * @throws StorageException If the removal could not be persisted.
   */
  void remove(String key) throws StorageException;

  /**
   * Removes every secret this backend holds for the configured providers.
   *
   * @throws StorageException If the removal could not be persisted.
   */
  void clear() throws StorageException;
}
