package tech.yump.credstore.storage;

/**
 * Persisting a change failed, or the store did not reflect the change when read back.
 */
public class StorageWriteException extends StorageException {

  public StorageWriteException(BackendKind backend, String message) {
    super(backend, message);
  }

  public StorageWriteException(BackendKind backend, String message, Throwable cause) {
    super(backend, message, cause);
  }
}
