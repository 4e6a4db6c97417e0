package tech.yump.credstore.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.credstore.audit.AuditOutcome;
import tech.yump.credstore.audit.StorageEventReporter;
import tech.yump.credstore.core.AtomicStorageManager;
import tech.yump.credstore.core.OperationRegistry;
import tech.yump.credstore.core.StorageErrorKind;
import tech.yump.credstore.core.StorageResult;
import tech.yump.credstore.core.StorageStatus;
import tech.yump.credstore.core.StorageValidationResult;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.provider.ProviderRegistry;
import tech.yump.credstore.provider.UnknownProviderException;
import tech.yump.credstore.storage.BackendKind;
import tech.yump.credstore.storage.BackendPreference;
import tech.yump.credstore.storage.StorageAdapter;
import tech.yump.credstore.support.InMemoryPreferenceStore;
import tech.yump.credstore.support.InMemorySecretBackend;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ApiKeyServiceImplTest {

    private static final Provider OPENAI = new Provider("openai");
    private static final Provider ANTHROPIC = new Provider("anthropic");
    private static final Provider GOOGLE = new Provider("google");

    @Mock
    private StorageEventReporter eventReporter;

    private InMemorySecretBackend secure;
    private InMemorySecretBackend plain;
    private StorageAdapter adapter;
    private AtomicStorageManager manager;
    private ApiKeyServiceImpl service;

    @BeforeEach
    void setUp() {
        ProviderRegistry registry = new ProviderRegistry(List.of("openai", "anthropic", "google"));
        secure = new InMemorySecretBackend(BackendKind.SECURE);
        plain = new InMemorySecretBackend(BackendKind.PLAIN);
        adapter = new StorageAdapter(List.of(secure, plain),
                new BackendPreference(new InMemoryPreferenceStore(), BackendKind.PLAIN), registry);
        manager = new AtomicStorageManager(adapter, new OperationRegistry(), eventReporter);
        service = new ApiKeyServiceImpl(manager, adapter, registry, eventReporter);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void saveApiKey_shouldStoreInCurrentBackend() throws Exception {
        StorageResult result = service.saveApiKey("openai", "sk-ABC123").get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.backend()).isEqualTo(BackendKind.PLAIN);
        assertThat(service.getApiKey("openai")).contains("sk-ABC123");
        assertThat(service.isProviderConfigured("openai")).isTrue();
        assertThat(service.isProviderConfigured("google")).isFalse();
    }

    @Test
    void unknownProvider_shouldThrow() {
        assertThatThrownBy(() -> service.saveApiKey("mistral", "sk")).isInstanceOf(UnknownProviderException.class);
        assertThatThrownBy(() -> service.getApiKey("mistral")).isInstanceOf(UnknownProviderException.class);
    }

    @Test
    void migrateTo_currentBackend_shouldBeNoOp() throws Exception {
        plain.seed("secret_openai", "sk-1");

        StorageResult result = service.migrateTo("openai", BackendKind.PLAIN).get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(secure.putCount()).isZero();
    }

    @Test
    void migrateTo_otherBackend_shouldMoveKey() throws Exception {
        plain.seed("secret_openai", "sk-1");

        StorageResult result = service.migrateTo("openai", BackendKind.SECURE).get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(service.currentBackend()).isEqualTo(BackendKind.SECURE);
        assertThat(service.getApiKey("openai")).contains("sk-1");
    }

    @Test
    void removeApiKey_shouldRemoveFromCurrentBackend() throws Exception {
        service.saveApiKey("openai", "sk-1").get(5, TimeUnit.SECONDS);

        StorageResult result = service.removeApiKey("openai").get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(service.getApiKey("openai")).isEmpty();
    }

    @Test
    @DisplayName("migrateAll moves every configured key and reports per provider")
    void migrateAll_shouldMigrateProvidersWithKeys() throws Exception {
        plain.seed("secret_openai", "sk-1");
        plain.seed("secret_google", "sk-3");

        Map<Provider, StorageResult> results = service.migrateAll(BackendKind.SECURE).get(5, TimeUnit.SECONDS);

        assertThat(results).containsOnlyKeys(OPENAI, GOOGLE);
        assertThat(results.values()).allMatch(StorageResult::isSuccess);
        assertThat(secure.entries()).containsOnlyKeys("secret_openai", "secret_google");
        assertThat(plain.entries()).isEmpty();
        assertThat(service.currentBackend()).isEqualTo(BackendKind.SECURE);
    }

    @Test
    void migrateAll_withNoKeys_shouldStillSwitchBackend() throws Exception {
        Map<Provider, StorageResult> results = service.migrateAll(BackendKind.SECURE).get(5, TimeUnit.SECONDS);

        assertThat(results).isEmpty();
        assertThat(service.currentBackend()).isEqualTo(BackendKind.SECURE);
    }

    @Test
    void migrateAll_withPartialFailure_shouldReportFailedProvider() throws Exception {
        plain.seed("secret_openai", "sk-1");
        plain.seed("secret_anthropic", "sk-2");
        secure.failWritesAfter(1);

        Map<Provider, StorageResult> results = service.migrateAll(BackendKind.SECURE).get(5, TimeUnit.SECONDS);

        assertThat(results.get(OPENAI).isSuccess()).isTrue();
        assertThat(results.get(ANTHROPIC).errorKind()).contains(StorageErrorKind.MIGRATION_FAILED);
        assertThat(plain.entries()).containsEntry("secret_anthropic", "sk-2");
    }

    @Test
    void clearAll_shouldRemoveFromBothBackends() throws Exception {
        plain.seed("secret_openai", "sk-1");
        secure.seed("secret_google", "sk-3");

        assertThat(service.clearAll().get(5, TimeUnit.SECONDS).isSuccess()).isTrue();

        assertThat(plain.entries()).isEmpty();
        assertThat(secure.entries()).isEmpty();
    }

    // --- Validate and fix ---

    @Test
    void validateAndFix_singleLocation_shouldReportNoIssues() throws Exception {
        plain.seed("secret_openai", "sk-1");

        StorageValidationResult result = service.validateAndFixStorage("openai").get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(StorageValidationResult.Outcome.NO_ISSUES);
        assertThat(plain.entries()).containsKey("secret_openai");
    }

    @Test
    @DisplayName("Identical duplicates: plain copy removed, secure becomes current")
    void validateAndFix_identicalDuplicate_shouldRemovePlainCopy() throws Exception {
        plain.seed("secret_openai", "sk-1");
        secure.seed("secret_openai", "sk-1");

        StorageValidationResult result = service.validateAndFixStorage("openai").get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(StorageValidationResult.Outcome.FIXED_DUPLICATES);
        assertThat(plain.entries()).doesNotContainKey("secret_openai");
        assertThat(secure.entries()).containsEntry("secret_openai", "sk-1");
        assertThat(service.currentBackend()).isEqualTo(BackendKind.SECURE);
        verify(eventReporter).reportValidation(eq(OPENAI), eq(AuditOutcome.SUCCESS), eq("FIXED_DUPLICATES"), anyString());
    }

    @Test
    void validateAndFix_differentDuplicates_shouldNeedUserChoice() throws Exception {
        plain.seed("secret_openai", "sk-plain");
        secure.seed("secret_openai", "sk-secure");

        StorageValidationResult result = service.validateAndFixStorage("openai").get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(StorageValidationResult.Outcome.NEEDS_USER_CHOICE);
        assertThat(plain.entries()).containsEntry("secret_openai", "sk-plain");
        assertThat(secure.entries()).containsEntry("secret_openai", "sk-secure");
    }

    @Test
    void validateAndFix_whenCleanupFails_shouldReportCannotFix() throws Exception {
        plain.seed("secret_openai", "sk-1");
        secure.seed("secret_openai", "sk-1");
        plain.failRemoves(true);

        StorageValidationResult result = service.validateAndFixStorage("openai").get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(StorageValidationResult.Outcome.CANNOT_FIX);
        assertThat(service.currentBackend()).isEqualTo(BackendKind.PLAIN);
    }

    @Test
    void storageStatus_shouldPreferSecure() {
        plain.seed("secret_openai", "sk-plain");
        secure.seed("secret_openai", "sk-secure");

        StorageStatus status = service.storageStatus("openai");

        assertThat(status.state()).isEqualTo(StorageStatus.State.DUPLICATE);
        assertThat(status.preferredValue()).contains("sk-secure");
    }
}
