package tech.yump.credstore.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single storage audit entry, logged as JSON. Never carries secret values.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // "storage_operation"
        String action,          // "save", "migrate", "remove", "clear", "rollback", "validate"
        String outcome,         // "success" or "failure"
        String provider,
        String backend,
        ErrorInfo error,
        ErrorInfo rollbackError,
        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorInfo(
            String kind,
            String backend,
            String message
    ) {}
}
