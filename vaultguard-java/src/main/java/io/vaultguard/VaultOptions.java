package io.vaultguard;

import io.vaultguard.integrity.IntegrityMonitor.MonitorOptions;
import io.vaultguard.integrity.SeverityTable;
import io.vaultguard.storage.SecureStorageEngine.StorageOptions;

import java.nio.file.Path;

/**
 * Everything needed to build a {@link VaultContext}.
 *
 * A null keystore file keeps keys in memory only; a null metadata file keeps metadata in memory only.
 */
public class VaultOptions {
    public final StorageOptions storage;
    public final MonitorOptions monitor;
    public final SeverityTable severityTable;
    public final Path keyStoreFile;
    public final char[] keyStorePassword;
    public final Path metadataFile;

    private VaultOptions(Builder builder) {
        this.storage = builder.storage;
        this.monitor = builder.monitor;
        this.severityTable = builder.severityTable;
        this.keyStoreFile = builder.keyStoreFile;
        this.keyStorePassword = builder.keyStorePassword.clone();
        this.metadataFile = builder.metadataFile;
    }

    public static VaultOptions defaults() {
        return builder().build();
    }

    /**
     * Persistent layout under one home directory: {@code files/}, {@code protected/},
     * {@code keys.p12}, {@code metadata.json} and {@code baseline.json}.
     */
    public static VaultOptions inDirectory(Path home, char[] keyStorePassword) {
        return builder()
            .storage(StorageOptions.withRoot(home.resolve("files")))
            .monitor(MonitorOptions.builder()
                .monitoredRoot(home.resolve("protected"))
                .baselineFile(home.resolve("baseline.json"))
                .build())
            .keyStoreFile(home.resolve("keys.p12"))
            .keyStorePassword(keyStorePassword)
            .metadataFile(home.resolve("metadata.json"))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StorageOptions storage = StorageOptions.defaults();
        private MonitorOptions monitor = MonitorOptions.defaults();
        private SeverityTable severityTable = SeverityTable.empty();
        private Path keyStoreFile;
        private char[] keyStorePassword = new char[0];
        private Path metadataFile;

        public Builder storage(StorageOptions storage) { this.storage = storage; return this; }
        public Builder monitor(MonitorOptions monitor) { this.monitor = monitor; return this; }
        public Builder severityTable(SeverityTable table) { this.severityTable = table; return this; }
        public Builder keyStoreFile(Path file) { this.keyStoreFile = file; return this; }
        public Builder keyStorePassword(char[] password) { this.keyStorePassword = password.clone(); return this; }
        public Builder metadataFile(Path file) { this.metadataFile = file; return this; }

        public VaultOptions build() {
            if (keyStoreFile != null && keyStorePassword.length == 0) {
                throw new IllegalArgumentException("A persistent keystore needs a password");
            }
            return new VaultOptions(this);
        }
    }
}
