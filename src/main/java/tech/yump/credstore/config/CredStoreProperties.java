package tech.yump.credstore.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import tech.yump.credstore.config.validation.ValidProviderIds;
import tech.yump.credstore.storage.BackendKind;

import java.util.List;

/**
 * Configuration properties for the credential store under the 'credstore' prefix.
 */
@ConfigurationProperties(prefix = "credstore")
@Validated
public record CredStoreProperties(

        @NotEmpty(message = "At least one provider id (credstore.providers) must be configured.")
        @ValidProviderIds
        List<String> providers,

        @Valid
        @NotNull(message = "Storage configuration (credstore.storage) is required.")
        StorageProperties storage,

        @Valid
        AuditProperties audit
) {

    @Validated
    public record StorageProperties(
            BackendKind defaultBackend,

            @Valid
            @NotNull(message = "Plain storage configuration (credstore.storage.plain) is required.")
            PlainProperties plain,

            @Valid
            @NotNull(message = "Secure storage configuration (credstore.storage.secure) is required.")
            SecureProperties secure
    ) {
        public StorageProperties {
            if (defaultBackend == null) {
                defaultBackend = BackendKind.PLAIN;
            }
        }

        /**
         * Unencrypted preference file holding one entry per provider plus the backend preference.
         */
        @Validated
        public record PlainProperties(
                @NotBlank(message = "Plain storage path (credstore.storage.plain.path) must be provided.")
                String path
        ) {}

        /**
         * Sealed record store. The master key is optional: without it the store stays locked
         * and every secure backend operation fails.
         */
        @Validated
        public record SecureProperties(
                @NotBlank(message = "Secure storage path (credstore.storage.secure.path) must be provided.")
                String path,

                @NotBlank(message = "Secure record service (credstore.storage.secure.service) must be provided.")
                String service,

                @NotBlank(message = "Secure record account (credstore.storage.secure.account) must be provided.")
                String account,

                String masterKeyB64
        ) {
            @Override
            public String toString() {
                return "SecureProperties[" +
                        "path='" + path + '\'' +
                        ", service='" + service + '\'' +
                        ", account='" + account + '\'' +
                        ", masterKeyB64=" + (masterKeyB64 == null ? "null" : "******") +
                        ']';
            }
        }
    }

    @Validated
    public record AuditProperties(
            String backend,

            @Valid
            FileAuditProperties file
    ) {
        public record FileAuditProperties(
                String path
        ) {
            public static final String PATH_PROPERTY = "credstore.audit.file.path";
        }
    }
}
