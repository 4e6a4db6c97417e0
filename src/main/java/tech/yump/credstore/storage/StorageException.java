package tech.yump.credstore.storage;

/**
 * Custom runtime exception for errors occurring within a backend or its underlying store.
 * Carries the backend the failure happened in, when known.
 */
public class StorageException extends RuntimeException {

  private final BackendKind backend;

  public StorageException(String message) {
    this(null, message, null);
  }

  public StorageException(String message, Throwable cause) {
    this(null, message, cause);
  }

  public StorageException(BackendKind backend, String message) {
    this(backend, message, null);
  }

  public StorageException(BackendKind backend, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
  }

  /**
   * @return the backend the failure occurred in, or null if raised below the backend layer.
   */
  public BackendKind getBackend() {
    return backend;
  }
}
