package tech.yump.credstore.audit;

/**
 * Sink for storage audit events. Implementations decide where events end up (application log, audit file).
 */
public interface AuditBackend {

    /**
     * @param event The event to record. Must not be null.
     */
    void logEvent(AuditEvent event);

}
