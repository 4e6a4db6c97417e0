package tech.yump.credstore.service;

import tech.yump.credstore.core.StorageResult;
import tech.yump.credstore.core.StorageStatus;
import tech.yump.credstore.core.StorageValidationResult;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.provider.UnknownProviderException;
import tech.yump.credstore.storage.BackendKind;
import tech.yump.credstore.storage.StorageException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing API for provider keys. Mutations run through the atomic storage manager; reads go
 * through the storage adapter and its cache.
 *
 * <p>Every method taking a provider id throws {@link UnknownProviderException} for ids that are not configured.
 */
public interface ApiKeyService {

    /**
     * Atomically saves the key into the current backend.
     */
    CompletableFuture<StorageResult> saveApiKey(String providerId, String apiKey);

    /**
     * @throws StorageException If the current backend cannot be read.
     */
    Optional<String> getApiKey(String providerId) throws StorageException;

    boolean isProviderConfigured(String providerId) throws StorageException;

    /**
     * Moves the provider's key from the current backend to {@code target}. Completes successfully
     * without doing anything if {@code target} is already current.
     */
    CompletableFuture<StorageResult> migrateTo(String providerId, BackendKind target) throws StorageException;

    CompletableFuture<StorageResult> removeApiKey(String providerId) throws StorageException;

    /**
     * Removes the keys of all providers from both backends.
     */
    CompletableFuture<StorageResult> clearAll();

    /**
     * Migrates every provider that has a key in the current backend to {@code target}. The target
     * becomes the current backend even when no provider had a key.
     *
     * @return the outcome per migrated provider, in configuration order.
     */
    CompletableFuture<Map<Provider, StorageResult>> migrateAll(BackendKind target) throws StorageException;

    /**
     * Looks for a key stored in both backends and removes the plain copy when both are identical.
     */
    CompletableFuture<StorageValidationResult> validateAndFixStorage(String providerId);

    StorageStatus storageStatus(String providerId) throws StorageException;

    BackendKind currentBackend() throws StorageException;
}
