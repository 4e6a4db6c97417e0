package tech.yump.credstore.core;

public enum StorageErrorKind {
  /** Another atomic operation for the same provider is in flight. */
  OPERATION_IN_PROGRESS,
  BACKEND_FAILURE,
  MIGRATION_FAILED,
  VALIDATION_FAILED,
  /** A restore attempt failed or could not be verified; reported next to the original error. */
  ROLLBACK_FAILED
}
