package tech.yump.credstore.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import tech.yump.credstore.audit.AuditBackend;
import tech.yump.credstore.audit.LogAuditBackend;
import tech.yump.credstore.audit.StorageEventReporter;
import tech.yump.credstore.core.OperationKind;
import tech.yump.credstore.core.StorageResult;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.storage.BackendKind;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@DisplayName("Integration Test: SLF4j Audit Backend (Default)")
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
public class Slf4jAuditBackendIntegrationTest {

    @Autowired
    private AuditBackend auditBackend;
    @Autowired
    private StorageEventReporter eventReporter;

    @Test
    void shouldUseSlf4jAuditBackendAndLogToConsole(CapturedOutput output) {
        assertThat(auditBackend)
                .withFailMessage("Expected LogAuditBackend bean as the default")
                .isInstanceOf(LogAuditBackend.class);

        eventReporter.report(StorageResult.success(OperationKind.REMOVE, new Provider("google"), BackendKind.SECURE));

        assertThat(output.getOut())
                .contains("AUDIT_EVENT:")
                .contains("\"type\":\"storage_operation\"")
                .contains("\"action\":\"remove\"")
                .contains("\"provider\":\"google\"");
    }
}
