package tech.yump.credstore.storage;

/**
 * Thrown when moving all secrets from one backend to another could not be completed.
 * The source backend is left untouched when this is raised.
 */
public class MigrationException extends StorageException {

  public MigrationException(BackendKind target, String message) {
    super(target, message);
  }

  public MigrationException(BackendKind target, String message, Throwable cause) {
    super(target, message, cause);
  }
}
