package tech.yump.credstore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.credstore.audit.StorageEventReporter;
import tech.yump.credstore.core.AtomicStorageManager;
import tech.yump.credstore.core.OperationRegistry;
import tech.yump.credstore.crypto.EncryptionService;
import tech.yump.credstore.provider.ProviderRegistry;
import tech.yump.credstore.storage.BackendPreference;
import tech.yump.credstore.storage.PlainSecretBackend;
import tech.yump.credstore.storage.SecureSecretBackend;
import tech.yump.credstore.storage.StorageAdapter;
import tech.yump.credstore.storage.prefs.FilePreferenceStore;
import tech.yump.credstore.storage.prefs.PreferenceStore;
import tech.yump.credstore.storage.secure.EncryptedFileRecordStore;
import tech.yump.credstore.storage.secure.SecureRecordStore;
import tech.yump.credstore.storage.secure.SecureStoreKeyHolder;

import java.nio.file.Paths;
import java.util.List;

/**
 * Wires the storage stack from {@link CredStoreProperties}: record and preference stores, both
 * backends, the adapter and the atomic manager.
 */
@Configuration
@Slf4j
public class StorageConfiguration {

    private final CredStoreProperties properties;

    public StorageConfiguration(CredStoreProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ProviderRegistry providerRegistry() {
        return new ProviderRegistry(properties.providers());
    }

    @Bean
    public PreferenceStore preferenceStore(ObjectMapper objectMapper) {
        return new FilePreferenceStore(objectMapper, Paths.get(properties.storage().plain().path()));
    }

    @Bean
    public SecureStoreKeyHolder secureStoreKeyHolder() {
        return new SecureStoreKeyHolder(properties.storage().secure().masterKeyB64());
    }

    @Bean
    public EncryptionService encryptionService(SecureStoreKeyHolder keyHolder) {
        return new EncryptionService(keyHolder);
    }

    @Bean
    public SecureRecordStore secureRecordStore(ObjectMapper objectMapper, EncryptionService encryptionService) {
        CredStoreProperties.StorageProperties.SecureProperties secure = properties.storage().secure();
        log.info("Configuring secure record store: {}", secure);
        return new EncryptedFileRecordStore(objectMapper, encryptionService, secure.path(), secure.service());
    }

    @Bean
    public PlainSecretBackend plainSecretBackend(PreferenceStore preferenceStore, ProviderRegistry providerRegistry) {
        return new PlainSecretBackend(preferenceStore, providerRegistry);
    }

    @Bean
    public SecureSecretBackend secureSecretBackend(
            SecureRecordStore secureRecordStore,
            ObjectMapper objectMapper,
            ProviderRegistry providerRegistry) {
        return new SecureSecretBackend(secureRecordStore, objectMapper, properties.storage().secure().account(), providerRegistry);
    }

    @Bean
    public BackendPreference backendPreference(PreferenceStore preferenceStore) {
        return new BackendPreference(preferenceStore, properties.storage().defaultBackend());
    }

    @Bean
    public StorageAdapter storageAdapter(
            PlainSecretBackend plainSecretBackend,
            SecureSecretBackend secureSecretBackend,
            BackendPreference backendPreference,
            ProviderRegistry providerRegistry) {
        return new StorageAdapter(List.of(secureSecretBackend, plainSecretBackend), backendPreference, providerRegistry);
    }

    @Bean
    public OperationRegistry operationRegistry() {
        return new OperationRegistry();
    }

    @Bean
    public AtomicStorageManager atomicStorageManager(
            StorageAdapter storageAdapter,
            OperationRegistry operationRegistry,
            StorageEventReporter storageEventReporter) {
        log.info("Configuring atomic storage manager, default backend '{}'", properties.storage().defaultBackend().value());
        return new AtomicStorageManager(storageAdapter, operationRegistry, storageEventReporter);
    }
}
