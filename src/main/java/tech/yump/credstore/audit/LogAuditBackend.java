package tech.yump.credstore.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events as JSON through the application log. Failed operations are logged at WARN.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        boolean failure = AuditOutcome.FAILURE.equals(event.outcome());
        try {
            String jsonEvent = objectMapper.writeValueAsString(event);
            if (failure) {
                log.warn("AUDIT_EVENT: {}", jsonEvent);
            } else {
                log.info("AUDIT_EVENT: {}", jsonEvent);
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize AuditEvent to JSON. Logging raw event details.", e);
            log.info("AUDIT_EVENT_FALLBACK: {}", event);
        }
    }
}
