package tech.yump.credstore.storage.secure;

import tech.yump.credstore.storage.StorageException;

import java.util.Optional;

/**
 * An access-controlled store of opaque records, scoped by service and addressed by account.
 * Implementations own any encryption; callers only see plaintext bytes.
 */
public interface SecureRecordStore {

  /**
   * @return the record's plaintext, or Optional.empty() if no record exists for the account.
   * @throws SecureStoreLockedException if a record exists but the store is locked.
   * @throws StorageException if the record exists but cannot be read or unsealed.
   */
  Optional<byte[]> read(String account) throws StorageException;

  /**
   * Replaces an existing record.
   *
   * @return false if no record exists for the account, true once it has been replaced.
   */
  boolean update(String account, byte[] data) throws StorageException;

  /**
   * Creates a new record.
   *
   * @throws StorageException if a record already exists for the account or it cannot be written.
   */
  void create(String account, byte[] data) throws StorageException;

  /**
   * Deletes the record. Deleting an absent record is not an error.
   */
  void delete(String account) throws StorageException;

  /**
   * @return the service name every record of this store is scoped to.
   */
  String service();
}
