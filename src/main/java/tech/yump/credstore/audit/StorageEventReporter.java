package tech.yump.credstore.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.lang.Nullable;
import tech.yump.credstore.core.StorageError;
import tech.yump.credstore.core.StorageResult;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.storage.BackendKind;

import java.time.Instant;
import java.util.Map;

/**
 * Turns storage outcomes into {@link AuditEvent}s, hands them to the {@link AuditBackend} and
 * publishes them to application listeners. Reporting never fails the storage operation it describes.
 */
@RequiredArgsConstructor
@Slf4j
public class StorageEventReporter {

    public static final String EVENT_TYPE = "storage_operation";

    private final AuditBackend auditBackend;
    private final ApplicationEventPublisher eventPublisher;

    public void report(StorageResult result) {
        emit(AuditEvent.builder()
                .timestamp(Instant.now())
                .type(EVENT_TYPE)
                .action(result.operation().value())
                .outcome(result.isSuccess() ? AuditOutcome.SUCCESS : AuditOutcome.FAILURE)
                .provider(result.provider() != null ? result.provider().id() : null)
                .backend(result.backend() != null ? result.backend().value() : null)
                .error(toErrorInfo(result.error()))
                .rollbackError(toErrorInfo(result.rollbackError()))
                .build());
    }

    /**
     * @param error the rollback failure, or null if the restore was verified.
     */
    public void reportRollback(Provider provider, BackendKind backend, @Nullable StorageError error) {
        emit(AuditEvent.builder()
                .timestamp(Instant.now())
                .type(EVENT_TYPE)
                .action("rollback")
                .outcome(error == null ? AuditOutcome.SUCCESS : AuditOutcome.FAILURE)
                .provider(provider.id())
                .backend(backend.value())
                .error(toErrorInfo(error))
                .build());
    }

    public void reportValidation(Provider provider, String outcome, String result, @Nullable String message) {
        emit(AuditEvent.builder()
                .timestamp(Instant.now())
                .type(EVENT_TYPE)
                .action("validate")
                .outcome(outcome)
                .provider(provider.id())
                .data(message != null ? Map.of("result", result, "message", message) : Map.of("result", result))
                .build());
    }

    private void emit(AuditEvent event) {
        try {
            auditBackend.logEvent(event);
        } catch (Exception e) {
            log.error("Failed to log storage audit event: Action={}, Provider={}, Outcome={}, Error={}",
                    event.action(), event.provider(), event.outcome(), e.getMessage(), e);
        }
        try {
            eventPublisher.publishEvent(event);
        } catch (Exception e) {
            log.error("Failed to publish storage audit event: Action={}, Provider={}, Error={}",
                    event.action(), event.provider(), e.getMessage(), e);
        }
    }

    @Nullable
    private static AuditEvent.ErrorInfo toErrorInfo(@Nullable StorageError error) {
        if (error == null) {
            return null;
        }
        return AuditEvent.ErrorInfo.builder()
                .kind(error.kind().name())
                .backend(error.backend() != null ? error.backend().value() : null)
                .message(error.message())
                .build();
    }
}
