package tech.yump.credstore.core;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.yump.credstore.audit.StorageEventReporter;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.provider.UnknownProviderException;
import tech.yump.credstore.storage.BackendKind;
import tech.yump.credstore.storage.InvalidSecretException;
import tech.yump.credstore.storage.SecretSanitizer;
import tech.yump.credstore.storage.StorageAdapter;
import tech.yump.credstore.storage.StorageException;
import tech.yump.credstore.storage.StorageVerificationException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs save, migrate and remove as multi-step protocols with backup, post-write verification and
 * rollback.
 *
 * <p>All protocols execute on one worker thread, so every operation is globally serialized and
 * the secure backend's whole-record read-modify-write never interleaves. Before a protocol is
 * queued its provider is registered in the {@link OperationRegistry}; a second request for a
 * provider that is queued or running fails immediately with
 * {@link StorageErrorKind#OPERATION_IN_PROGRESS} instead of waiting.
 *
 * <p>Returned futures never complete exceptionally for storage failures; the outcome is always
 * carried by the {@link StorageResult}.
 */
@Slf4j
public class AtomicStorageManager {

  private static final String VALUE_MISMATCH = "Stored API key does not match the written value";
  private static final String KEY_STILL_PRESENT = "API key still exists after removal";

  private final StorageAdapter storageAdapter;
  private final OperationRegistry operationRegistry;
  private final StorageEventReporter eventReporter;
  private final ExecutorService executor;

  public AtomicStorageManager(
          final StorageAdapter storageAdapter,
          final OperationRegistry operationRegistry,
          final StorageEventReporter eventReporter
  ) {
    this.storageAdapter = storageAdapter;
    this.operationRegistry = operationRegistry;
    this.eventReporter = eventReporter;
    this.executor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("atomic-storage-"));
  }

  /**
   * Saves a key into {@code target}. If {@code source} names a different backend, its current
   * value is backed up first and removed once the new value has been verified.
   *
   * @param source the backend the key is moving out of, or null.
   */
  public CompletableFuture<StorageResult> save(Provider provider, String apiKey, BackendKind target, BackendKind source) {
    return submit(OperationKind.SAVE, provider, target, () -> runSave(provider, apiKey, target, source));
  }

  public CompletableFuture<StorageResult> save(Provider provider, String apiKey, BackendKind target) {
    return save(provider, apiKey, target, null);
  }

  /**
   * Moves a provider's key from one backend to another and makes {@code to} the current backend.
   */
  public CompletableFuture<StorageResult> migrate(Provider provider, BackendKind from, BackendKind to) {
    return submit(OperationKind.MIGRATE, provider, to, () -> runMigration(provider, from, to));
  }

  public CompletableFuture<StorageResult> remove(Provider provider, BackendKind backend) {
    return submit(OperationKind.REMOVE, provider, backend, () -> runRemove(provider, backend));
  }

  /**
   * Clears the provider keys from every backend. Rejected if any provider has an operation in flight.
   */
  public CompletableFuture<StorageResult> clearAll() {
    List<Provider> providers = storageAdapter.providers().all();
    Optional<List<OperationToken>> tokens = operationRegistry.tryBeginAll(OperationKind.CLEAR, providers);
    if (tokens.isEmpty()) {
      return rejected(OperationKind.CLEAR, null, null, StorageError.operationInProgress("*"));
    }
    return enqueue(OperationKind.CLEAR, null, null, () -> runClearAll(), () -> operationRegistry.endAll(tokens.get()));
  }

  public boolean isOperationInProgress(Provider provider) {
    return operationRegistry.isActive(provider);
  }

  /**
   * Reads both backends directly, bypassing the adapter cache.
   *
   * @throws StorageException if either backend cannot be read.
   */
  public StorageStatus getStorageStatus(Provider provider) throws StorageException {
    String secure = storageAdapter.loadFrom(BackendKind.SECURE, provider).orElse(null);
    String plain = storageAdapter.loadFrom(BackendKind.PLAIN, provider).orElse(null);
    StorageStatus status = new StorageStatus(provider, secure, plain);
    log.debug("Storage status for provider '{}': {}", provider, status.state());
    return status;
  }

  @PreDestroy
  public void shutdown() {
    log.info("Shutting down atomic storage executor");
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Atomic storage executor did not terminate in time, forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  // --- Submission ---

  private CompletableFuture<StorageResult> submit(
          OperationKind kind,
          Provider provider,
          BackendKind backend,
          Supplier<StorageResult> protocol
  ) {
    if (!storageAdapter.providers().contains(provider)) {
      throw new UnknownProviderException(provider == null ? null : provider.id());
    }
    Optional<OperationToken> token = operationRegistry.tryBegin(kind, provider);
    if (token.isEmpty()) {
      return rejected(kind, provider, backend, StorageError.operationInProgress(provider.id()));
    }
    return enqueue(kind, provider, backend, protocol, () -> operationRegistry.end(token.get()));
  }

  private CompletableFuture<StorageResult> enqueue(
          OperationKind kind,
          Provider provider,
          BackendKind backend,
          Supplier<StorageResult> protocol,
          Runnable release
  ) {
    try {
      return CompletableFuture.supplyAsync(() -> execute(kind, provider, backend, protocol, release), executor);
    } catch (RejectedExecutionException e) {
      release.run();
      log.error("Atomic storage executor rejected '{}' for provider '{}'", kind.value(), provider);
      return rejected(kind, provider, backend, StorageError.backendFailure(backend, "Storage manager is shut down"));
    }
  }

  private StorageResult execute(
          OperationKind kind,
          Provider provider,
          BackendKind backend,
          Supplier<StorageResult> protocol,
          Runnable release
  ) {
    StorageResult result;
    try {
      result = protocol.get();
    } catch (RuntimeException e) {
      log.error("Unexpected failure during '{}' for provider '{}': {}", kind.value(), provider, e.getMessage(), e);
      BackendKind failedBackend = e instanceof StorageException se && se.getBackend() != null ? se.getBackend() : backend;
      result = StorageResult.failure(kind, provider, backend, StorageError.backendFailure(failedBackend, e.getMessage()));
    } finally {
      release.run();
    }
    if (result.isSuccess()) {
      log.info("Atomic '{}' for provider '{}' succeeded", kind.value(), provider);
    } else {
      log.error("Atomic '{}' for provider '{}' failed: {}", kind.value(), provider, result.error().describe());
    }
    eventReporter.report(result);
    return result;
  }

  private CompletableFuture<StorageResult> rejected(OperationKind kind, Provider provider, BackendKind backend, StorageError error) {
    StorageResult result = StorageResult.failure(kind, provider, backend, error);
    eventReporter.report(result);
    return CompletableFuture.completedFuture(result);
  }

  // --- Protocols ---

  private StorageResult runSave(Provider provider, String apiKey, BackendKind target, BackendKind source) {
    String value;
    try {
      value = SecretSanitizer.requireUsable(apiKey);
    } catch (InvalidSecretException e) {
      return StorageResult.failure(OperationKind.SAVE, provider, target, StorageError.validationFailed(target, e.getMessage()));
    }

    boolean moving = source != null && source != target;
    BackendKind backupFrom = moving ? source : target;
    BackupSnapshot backup;
    try {
      backup = capture(provider, backupFrom);
    } catch (StorageException e) {
      return StorageResult.failure(OperationKind.SAVE, provider, target,
              StorageError.backendFailure(backupFrom, "Failed to read existing API key: " + e.getMessage()));
    }

    try {
      storageAdapter.saveTo(target, provider, value);
    } catch (StorageVerificationException e) {
      log.error("Backend '{}' rejected its own read-back for provider '{}': {}", target.value(), provider, e.getMessage());
      StorageError rollbackError = rollback(backup);
      return StorageResult.failure(OperationKind.SAVE, provider, target,
              StorageError.validationFailed(target, VALUE_MISMATCH), rollbackError);
    } catch (StorageException e) {
      // the write may have landed before the failure surfaced
      StorageError rollbackError = rollbackIfChanged(backup);
      return StorageResult.failure(OperationKind.SAVE, provider, target,
              StorageError.backendFailure(target, "Failed to save API key: " + e.getMessage()), rollbackError);
    }

    Optional<String> mismatch = verifyValue(provider, target, value);
    if (mismatch.isPresent()) {
      StorageError rollbackError = rollback(backup);
      return StorageResult.failure(OperationKind.SAVE, provider, target,
              StorageError.validationFailed(target, mismatch.get()), rollbackError);
    }

    if (moving) {
      removeQuietly(provider, source);
    }
    return StorageResult.success(OperationKind.SAVE, provider, target);
  }

  private StorageResult runMigration(Provider provider, BackendKind from, BackendKind to) {
    if (from == to) {
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.migrationFailed(to, "Source and target storage are the same"));
    }

    Optional<String> existing;
    try {
      existing = storageAdapter.loadFrom(from, provider);
    } catch (StorageException e) {
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.backendFailure(from, "Failed to read API key from source storage: " + e.getMessage()));
    }
    if (existing.isEmpty()) {
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.migrationFailed(from, "No API key found in source storage"));
    }
    String value = SecretSanitizer.stripNul(existing.get());
    if (value.isEmpty()) {
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.migrationFailed(from, "Source API key is empty"));
    }

    try {
      storageAdapter.saveTo(to, provider, value);
    } catch (StorageVerificationException e) {
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.migrationFailed(to, "Target validation failed"));
    } catch (StorageException e) {
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.migrationFailed(to, "Failed to write API key to target storage: " + e.getMessage()));
    }

    // source is untouched until the target is verified
    if (verifyValue(provider, to, value).isPresent()) {
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.migrationFailed(to, "Target validation failed"));
    }

    removeQuietly(provider, from);

    try {
      storageAdapter.selectBackend(to);
    } catch (StorageException e) {
      log.error("Failed to persist storage backend '{}' after migrating provider '{}': {}", to.value(), provider, e.getMessage());
      StorageError rollbackError = rollback(new BackupSnapshot(provider, from, value));
      return StorageResult.failure(OperationKind.MIGRATE, provider, to,
              StorageError.backendFailure(null, "Failed to persist storage backend preference: " + e.getMessage()), rollbackError);
    }
    return StorageResult.success(OperationKind.MIGRATE, provider, to);
  }

  private StorageResult runRemove(Provider provider, BackendKind backend) {
    BackupSnapshot backup;
    try {
      backup = capture(provider, backend);
    } catch (StorageException e) {
      return StorageResult.failure(OperationKind.REMOVE, provider, backend,
              StorageError.backendFailure(backend, "Failed to read existing API key: " + e.getMessage()));
    }

    try {
      storageAdapter.removeFrom(backend, provider);
    } catch (StorageVerificationException e) {
      StorageError rollbackError = rollback(backup);
      return StorageResult.failure(OperationKind.REMOVE, provider, backend,
              StorageError.validationFailed(backend, KEY_STILL_PRESENT), rollbackError);
    } catch (StorageException e) {
      return StorageResult.failure(OperationKind.REMOVE, provider, backend,
              StorageError.backendFailure(backend, "Failed to remove API key: " + e.getMessage()));
    }

    Optional<String> remaining;
    try {
      remaining = storageAdapter.loadFrom(backend, provider);
    } catch (StorageException e) {
      // removal state is unknown, so put the backup back
      StorageError rollbackError = rollback(backup);
      return StorageResult.failure(OperationKind.REMOVE, provider, backend,
              StorageError.validationFailed(backend, "Could not verify removal: " + e.getMessage()), rollbackError);
    }
    if (remaining.filter(value -> !value.isEmpty()).isPresent()) {
      StorageError rollbackError = rollback(backup);
      return StorageResult.failure(OperationKind.REMOVE, provider, backend,
              StorageError.validationFailed(backend, KEY_STILL_PRESENT), rollbackError);
    }
    return StorageResult.success(OperationKind.REMOVE, provider, backend);
  }

  private StorageResult runClearAll() {
    StorageError firstError = null;
    for (BackendKind kind : BackendKind.values()) {
      try {
        storageAdapter.backend(kind).clear();
      } catch (StorageException e) {
        log.error("Failed to clear backend '{}': {}", kind.value(), e.getMessage());
        if (firstError == null) {
          firstError = StorageError.backendFailure(kind, "Failed to clear storage: " + e.getMessage());
        }
      }
    }
    storageAdapter.invalidateCache();
    return firstError == null
            ? StorageResult.success(OperationKind.CLEAR, null, null)
            : StorageResult.failure(OperationKind.CLEAR, null, firstError.backend(), firstError);
  }

  // --- Steps ---

  private BackupSnapshot capture(Provider provider, BackendKind backend) throws StorageException {
    return storageAdapter.loadFrom(backend, provider)
            .filter(value -> !value.isEmpty())
            .map(value -> new BackupSnapshot(provider, backend, value))
            .orElse(null);
  }

  /**
   * @return a description of the problem, or empty if the backend holds exactly {@code expected}.
   */
  private Optional<String> verifyValue(Provider provider, BackendKind backend, String expected) {
    try {
      Optional<String> actual = storageAdapter.loadFrom(backend, provider);
      if (actual.isPresent() && actual.get().equals(expected)) {
        return Optional.empty();
      }
      log.error("Verification failed for provider '{}' in backend '{}'", provider, backend.value());
      return Optional.of(VALUE_MISMATCH);
    } catch (StorageException e) {
      log.error("Could not read back provider '{}' from backend '{}': {}", provider, backend.value(), e.getMessage());
      return Optional.of("Could not verify stored API key: " + e.getMessage());
    }
  }

  /**
   * Restores the backup into its backend and verifies it.
   *
   * @return null if there was nothing to restore or the restore was verified, otherwise the rollback error.
   */
  private StorageError rollback(BackupSnapshot backup) {
    if (backup == null) {
      return null;
    }
    Provider provider = backup.provider();
    BackendKind backend = backup.backend();
    log.warn("Rolling back provider '{}' in backend '{}'", provider, backend.value());

    StorageError error = null;
    try {
      storageAdapter.saveTo(backend, provider, backup.value());
      if (verifyValue(provider, backend, backup.value()).isPresent()) {
        error = StorageError.rollbackFailed(backend, "Restored API key could not be verified");
      }
    } catch (StorageException | InvalidSecretException e) {
      error = StorageError.rollbackFailed(backend, "Failed to restore API key: " + e.getMessage());
    }

    if (error != null) {
      log.error("Rollback failed for provider '{}' in backend '{}': {}", provider, backend.value(), error.message());
    } else {
      log.info("Rollback succeeded for provider '{}' in backend '{}'", provider, backend.value());
    }
    eventReporter.reportRollback(provider, backend, error);
    return error;
  }

  /**
   * Rolls back only if the backup's backend no longer holds the backup value, or cannot tell.
   */
  private StorageError rollbackIfChanged(BackupSnapshot backup) {
    if (backup == null) {
      return null;
    }
    try {
      if (storageAdapter.loadFrom(backup.backend(), backup.provider()).filter(backup.value()::equals).isPresent()) {
        return null;
      }
    } catch (StorageException e) {
      log.warn("Could not check provider '{}' in backend '{}' after a failed write: {}",
              backup.provider(), backup.backend().value(), e.getMessage());
    }
    return rollback(backup);
  }

  private void removeQuietly(Provider provider, BackendKind backend) {
    try {
      storageAdapter.removeFrom(backend, provider);
    } catch (StorageException e) {
      log.warn("Could not remove API key for provider '{}' from '{}', key is now stored in both backends: {}",
              provider, backend.value(), e.getMessage());
    }
  }
}
