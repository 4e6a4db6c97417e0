package tech.yump.credstore.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.credstore.audit.AuditOutcome;
import tech.yump.credstore.audit.StorageEventReporter;
import tech.yump.credstore.core.AtomicStorageManager;
import tech.yump.credstore.core.OperationKind;
import tech.yump.credstore.core.StorageError;
import tech.yump.credstore.core.StorageResult;
import tech.yump.credstore.core.StorageStatus;
import tech.yump.credstore.core.StorageValidationResult;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.provider.ProviderRegistry;
import tech.yump.credstore.storage.BackendKind;
import tech.yump.credstore.storage.StorageAdapter;
import tech.yump.credstore.storage.StorageException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Service
@RequiredArgsConstructor
@Slf4j
public class ApiKeyServiceImpl implements ApiKeyService {

    private final AtomicStorageManager storageManager;
    private final StorageAdapter storageAdapter;
    private final ProviderRegistry providerRegistry;
    private final StorageEventReporter eventReporter;

    @Override
    public CompletableFuture<StorageResult> saveApiKey(String providerId, String apiKey) {
        Provider provider = providerRegistry.require(providerId);
        BackendKind current;
        try {
            current = storageAdapter.currentBackendKind();
        } catch (StorageException e) {
            log.error("Service layer: Cannot determine current backend for saving provider '{}': {}", providerId, e.getMessage());
            return CompletableFuture.completedFuture(StorageResult.failure(OperationKind.SAVE, provider, null,
                    StorageError.backendFailure(null, "Failed to read storage backend preference: " + e.getMessage())));
        }
        log.info("Service layer: Saving API key for provider '{}' to '{}'", providerId, current.value());
        return storageManager.save(provider, apiKey, current);
    }

    @Override
    public Optional<String> getApiKey(String providerId) throws StorageException {
        return storageAdapter.load(providerRegistry.require(providerId));
    }

    @Override
    public boolean isProviderConfigured(String providerId) throws StorageException {
        return storageAdapter.has(providerRegistry.require(providerId));
    }

    @Override
    public CompletableFuture<StorageResult> migrateTo(String providerId, BackendKind target) throws StorageException {
        Provider provider = providerRegistry.require(providerId);
        BackendKind current = storageAdapter.currentBackendKind();
        if (current == target) {
            log.info("Service layer: Provider '{}' already uses '{}', nothing to migrate", providerId, target.value());
            return CompletableFuture.completedFuture(StorageResult.success(OperationKind.MIGRATE, provider, target));
        }
        log.info("Service layer: Migrating provider '{}' from '{}' to '{}'", providerId, current.value(), target.value());
        return storageManager.migrate(provider, current, target);
    }

    @Override
    public CompletableFuture<StorageResult> removeApiKey(String providerId) throws StorageException {
        Provider provider = providerRegistry.require(providerId);
        BackendKind current = storageAdapter.currentBackendKind();
        log.info("Service layer: Removing API key for provider '{}' from '{}'", providerId, current.value());
        return storageManager.remove(provider, current);
    }

    @Override
    public CompletableFuture<StorageResult> clearAll() {
        log.warn("Service layer: Clearing all API keys from all backends");
        return storageManager.clearAll();
    }

    @Override
    public CompletableFuture<Map<Provider, StorageResult>> migrateAll(BackendKind target) throws StorageException {
        BackendKind current = storageAdapter.currentBackendKind();
        if (current == target) {
            log.info("Service layer: '{}' is already the current backend", target.value());
            return CompletableFuture.completedFuture(Map.of());
        }

        Map<Provider, CompletableFuture<StorageResult>> pending = new LinkedHashMap<>();
        for (Provider provider : providerRegistry.all()) {
            try {
                if (storageAdapter.loadFrom(current, provider).filter(value -> !value.isEmpty()).isPresent()) {
                    pending.put(provider, storageManager.migrate(provider, current, target));
                }
            } catch (StorageException e) {
                log.error("Service layer: Cannot read provider '{}' from '{}' for migration: {}", provider, current.value(), e.getMessage());
                pending.put(provider, CompletableFuture.completedFuture(StorageResult.failure(OperationKind.MIGRATE, provider, target,
                        StorageError.backendFailure(current, "Failed to read API key from source storage: " + e.getMessage()))));
            }
        }

        if (pending.isEmpty()) {
            log.info("Service layer: No API keys stored in '{}', switching backend to '{}'", current.value(), target.value());
            storageAdapter.selectBackend(target);
            return CompletableFuture.completedFuture(Map.of());
        }

        return CompletableFuture.allOf(pending.values().toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    Map<Provider, StorageResult> results = new LinkedHashMap<>();
                    pending.forEach((provider, future) -> results.put(provider, future.join()));
                    long failed = results.values().stream().filter(result -> !result.isSuccess()).count();
                    log.info("Service layer: Migrated {} of {} providers to '{}'", results.size() - failed, results.size(), target.value());
                    return results;
                });
    }

    @Override
    public CompletableFuture<StorageValidationResult> validateAndFixStorage(String providerId) {
        Provider provider = providerRegistry.require(providerId);
        StorageStatus status;
        try {
            status = storageManager.getStorageStatus(provider);
        } catch (StorageException e) {
            log.error("Service layer: Cannot inspect storage for provider '{}': {}", providerId, e.getMessage());
            return CompletableFuture.completedFuture(reportValidation(provider,
                    StorageValidationResult.cannotFix("Failed to read storage: " + e.getMessage())));
        }

        if (status.state() != StorageStatus.State.DUPLICATE) {
            return CompletableFuture.completedFuture(reportValidation(provider, StorageValidationResult.noIssues()));
        }
        if (!status.isIdenticalDuplicate()) {
            log.warn("Service layer: Provider '{}' has different API keys in secure and plain storage", providerId);
            return CompletableFuture.completedFuture(reportValidation(provider, StorageValidationResult.needsUserChoice()));
        }

        log.info("Service layer: Removing duplicate plain copy for provider '{}'", providerId);
        return storageManager.remove(provider, BackendKind.PLAIN).thenApply(result -> {
            if (!result.isSuccess()) {
                return reportValidation(provider, StorageValidationResult.cannotFix(
                        "Failed to remove duplicate: " + result.error().message()));
            }
            try {
                storageAdapter.selectBackend(BackendKind.SECURE);
            } catch (StorageException e) {
                return reportValidation(provider, StorageValidationResult.cannotFix(
                        "Failed to persist storage backend preference: " + e.getMessage()));
            }
            return reportValidation(provider, StorageValidationResult.fixedDuplicates());
        });
    }

    @Override
    public StorageStatus storageStatus(String providerId) throws StorageException {
        return storageManager.getStorageStatus(providerRegistry.require(providerId));
    }

    @Override
    public BackendKind currentBackend() throws StorageException {
        return storageAdapter.currentBackendKind();
    }

    private StorageValidationResult reportValidation(Provider provider, StorageValidationResult result) {
        boolean failed = result.outcome() == StorageValidationResult.Outcome.CANNOT_FIX;
        eventReporter.reportValidation(provider, failed ? AuditOutcome.FAILURE : AuditOutcome.SUCCESS,
                result.outcome().name(), result.message());
        return result;
    }
}
