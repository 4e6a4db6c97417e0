package tech.yump.credstore.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import tech.yump.credstore.core.OperationKind;
import tech.yump.credstore.core.StorageError;
import tech.yump.credstore.core.StorageResult;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.storage.BackendKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StorageEventReporterTest {

    private static final Provider OPENAI = new Provider("openai");

    @Mock
    private AuditBackend auditBackend;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private StorageEventReporter reporter;

    @Test
    void report_success_shouldLogAndPublish() {
        reporter.report(StorageResult.success(OperationKind.MIGRATE, OPENAI, BackendKind.SECURE));

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.type()).isEqualTo(StorageEventReporter.EVENT_TYPE);
        assertThat(event.action()).isEqualTo("migrate");
        assertThat(event.outcome()).isEqualTo(AuditOutcome.SUCCESS);
        assertThat(event.provider()).isEqualTo("openai");
        assertThat(event.backend()).isEqualTo("secure");
        assertThat(event.error()).isNull();
        assertThat(event.timestamp()).isNotNull();
        verify(eventPublisher).publishEvent(event);
    }

    @Test
    @DisplayName("A failure carries the original error and the rollback error side by side")
    void report_failureWithRollback_shouldCarryBothErrors() {
        StorageResult result = StorageResult.failure(OperationKind.SAVE, OPENAI, BackendKind.SECURE,
                StorageError.validationFailed(BackendKind.SECURE, "mismatch"),
                StorageError.rollbackFailed(BackendKind.PLAIN, "restore failed"));

        reporter.report(result);

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.outcome()).isEqualTo(AuditOutcome.FAILURE);
        assertThat(event.error().kind()).isEqualTo("VALIDATION_FAILED");
        assertThat(event.rollbackError().kind()).isEqualTo("ROLLBACK_FAILED");
        assertThat(event.rollbackError().backend()).isEqualTo("plain");
    }

    @Test
    void reportRollback_shouldUseRollbackAction() {
        reporter.reportRollback(OPENAI, BackendKind.PLAIN, null);

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo("rollback");
        assertThat(captor.getValue().outcome()).isEqualTo(AuditOutcome.SUCCESS);
    }

    @Test
    void reportValidation_shouldCarryResultInData() {
        reporter.reportValidation(OPENAI, AuditOutcome.SUCCESS, "NO_ISSUES", "No storage issues found");

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        assertThat(captor.getValue().data()).containsEntry("result", "NO_ISSUES");
    }

    @Test
    @DisplayName("Sink failures never propagate into storage operations")
    void report_whenSinkFails_shouldNotThrow() {
        doThrow(new IllegalStateException("sink down")).when(auditBackend).logEvent(any());
        doThrow(new IllegalStateException("listener failed")).when(eventPublisher).publishEvent(any(Object.class));

        assertThatCode(() -> reporter.report(StorageResult.success(OperationKind.SAVE, OPENAI, BackendKind.PLAIN)))
                .doesNotThrowAnyException();
    }
}
