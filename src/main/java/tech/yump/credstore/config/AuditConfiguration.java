package tech.yump.credstore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.credstore.audit.AuditBackend;
import tech.yump.credstore.audit.FileAuditBackend;
import tech.yump.credstore.audit.LogAuditBackend;
import tech.yump.credstore.audit.StorageEventReporter;

@Configuration
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    public AuditConfiguration(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    @ConditionalOnProperty(name = "credstore.audit.backend", havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "credstore.audit.backend", havingValue = "file")
    public AuditBackend fileAuditBackend() {
        log.info("Configuring File Audit Backend. Ensure Logback is configured correctly for logger '{}' and path property '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, CredStoreProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }

    @Bean
    public StorageEventReporter storageEventReporter(AuditBackend auditBackend, ApplicationEventPublisher eventPublisher) {
        return new StorageEventReporter(auditBackend, eventPublisher);
    }
}
