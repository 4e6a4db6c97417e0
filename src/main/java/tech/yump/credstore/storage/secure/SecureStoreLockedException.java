package tech.yump.credstore.storage.secure;

import tech.yump.credstore.storage.StorageException;

/**
 * Thrown when the secure store is accessed while no master key is loaded.
 */
public class SecureStoreLockedException extends StorageException {

  public SecureStoreLockedException(String message) {
    super(message);
  }
}
