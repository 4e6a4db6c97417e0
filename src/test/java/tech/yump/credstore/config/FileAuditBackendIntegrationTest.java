package tech.yump.credstore.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import tech.yump.credstore.audit.AuditBackend;
import tech.yump.credstore.audit.FileAuditBackend;
import tech.yump.credstore.audit.StorageEventReporter;
import tech.yump.credstore.core.OperationKind;
import tech.yump.credstore.core.StorageError;
import tech.yump.credstore.core.StorageResult;
import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.storage.BackendKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest
@TestPropertySource(properties = {
        "credstore.audit.backend=file",
        "credstore.audit.file.path=target/test-audit/integration-audit.log"
})
@DisplayName("Integration Test: File Audit Backend")
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
public class FileAuditBackendIntegrationTest {

    private static final Path auditLogPath = Paths.get("target/test-audit/integration-audit.log");

    // directory must exist before Logback opens the appender
    static {
        try {
            Files.createDirectories(auditLogPath.getParent());
        } catch (IOException e) {
            throw new IllegalStateException("Could not create test audit directory", e);
        }
    }

    @Autowired
    private AuditBackend auditBackend;
    @Autowired
    private StorageEventReporter eventReporter;

    @AfterEach
    void cleanupLogFile() throws IOException {
        Files.deleteIfExists(auditLogPath);
    }

    @Test
    void shouldUseFileAuditBackendAndLogToFile(CapturedOutput output) {
        assertThat(auditBackend)
                .withFailMessage("Expected FileAuditBackend bean due to credstore.audit.backend=file property")
                .isInstanceOf(FileAuditBackend.class);

        eventReporter.report(StorageResult.failure(OperationKind.MIGRATE, new Provider("anthropic"), BackendKind.SECURE,
                StorageError.migrationFailed(BackendKind.PLAIN, "No API key found in source storage")));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(auditLogPath).exists();
            assertThat(Files.readString(auditLogPath))
                    .contains("\"action\":\"migrate\"")
                    .contains("\"provider\":\"anthropic\"")
                    .contains("MIGRATION_FAILED");
        });

        assertThat(output.getOut()).doesNotContain("\"provider\":\"anthropic\"");
    }
}
