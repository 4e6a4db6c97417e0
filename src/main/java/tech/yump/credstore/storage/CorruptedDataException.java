package tech.yump.credstore.storage;

/**
 * Stored data exists but cannot be deserialized. The data is left in place.
 */
public class CorruptedDataException extends StorageException {

  public CorruptedDataException(String message, Throwable cause) {
    super(message, cause);
  }

  public CorruptedDataException(BackendKind backend, String message, Throwable cause) {
    super(backend, message, cause);
  }
}
