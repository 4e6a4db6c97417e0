package tech.yump.credstore.core;

import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.storage.BackendKind;

import java.util.Optional;

/**
 * Outcome of an atomic operation. A failed result always carries the original error; a rollback
 * error, if any, is reported next to it and never replaces it.
 *
 * @param operation     the protocol that ran.
 * @param provider      the provider it was scoped to, or null for store-wide operations.
 * @param backend       the backend the operation targeted.
 * @param error         the failure, or null on success.
 * @param rollbackError the failure of the restore attempt, if one was made and failed.
 */
public record StorageResult(
        OperationKind operation,
        Provider provider,
        BackendKind backend,
        StorageError error,
        StorageError rollbackError
) {

  public static StorageResult success(OperationKind operation, Provider provider, BackendKind backend) {
    return new StorageResult(operation, provider, backend, null, null);
  }

  public static StorageResult failure(OperationKind operation, Provider provider, BackendKind backend, StorageError error) {
    return new StorageResult(operation, provider, backend, error, null);
  }

  public static StorageResult failure(
          OperationKind operation,
          Provider provider,
          BackendKind backend,
          StorageError error,
          StorageError rollbackError
  ) {
    return new StorageResult(operation, provider, backend, error, rollbackError);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<StorageErrorKind> errorKind() {
    return Optional.ofNullable(error).map(StorageError::kind);
  }

  public Optional<StorageError> rollbackFailure() {
    return Optional.ofNullable(rollbackError);
  }
}
