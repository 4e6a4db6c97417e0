package tech.yump.credstore.core;

import tech.yump.credstore.storage.BackendKind;

/**
 * A typed failure returned from an atomic operation.
 *
 * @param kind    the failure class.
 * @param backend the backend involved, when the failure is specific to one.
 * @param message a human-readable reason; never contains secret values.
 */
public record StorageError(StorageErrorKind kind, BackendKind backend, String message) {

  public static StorageError operationInProgress(String providerId) {
    return new StorageError(StorageErrorKind.OPERATION_IN_PROGRESS, null,
            "Another storage operation is already in progress for provider: " + providerId);
  }

  public static StorageError backendFailure(BackendKind backend, String message) {
    return new StorageError(StorageErrorKind.BACKEND_FAILURE, backend, message);
  }

  public static StorageError migrationFailed(BackendKind backend, String message) {
    return new StorageError(StorageErrorKind.MIGRATION_FAILED, backend, message);
  }

  public static StorageError validationFailed(BackendKind backend, String message) {
    return new StorageError(StorageErrorKind.VALIDATION_FAILED, backend, message);
  }

  public static StorageError rollbackFailed(BackendKind backend, String message) {
    return new StorageError(StorageErrorKind.ROLLBACK_FAILED, backend, message);
  }

  public String describe() {
    return backend == null ? kind + ": " + message : kind + " (" + backend.value() + "): " + message;
  }
}
