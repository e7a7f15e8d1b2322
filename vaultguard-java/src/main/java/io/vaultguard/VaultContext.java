package io.vaultguard;

import io.vaultguard.crypto.CryptoProvider;
import io.vaultguard.crypto.KeyStoreCryptoProvider;
import io.vaultguard.integrity.CountermeasureResponder;
import io.vaultguard.integrity.DefaultCountermeasures;
import io.vaultguard.integrity.IntegrityMonitor;
import io.vaultguard.integrity.IntegrityRegistry;
import io.vaultguard.storage.AccessGate;
import io.vaultguard.storage.InMemoryMetadataStore;
import io.vaultguard.storage.JsonFileMetadataStore;
import io.vaultguard.storage.MetadataStore;
import io.vaultguard.storage.SecureStorageEngine;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Owns one instance of every vault component and their lifecycle.
 *
 * Build it once with {@link #create(VaultOptions)} and pass it (or its components) to callers.
 * {@link #initialize()} starts integrity monitoring; {@link #shutdown()} stops monitoring and the
 * storage executor.
 */
public class VaultContext implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(VaultContext.class.getName());

    private final VaultOptions options;
    private final CryptoProvider crypto;
    private final MetadataStore metadataStore;
    private final AccessGate accessGate;
    private final SecureStorageEngine storage;
    private final IntegrityRegistry registry;
    private final DefaultCountermeasures countermeasures;
    private final IntegrityMonitor monitor;
    private final AtomicBoolean closed = new AtomicBoolean();

    public VaultContext(VaultOptions options, CryptoProvider crypto, MetadataStore metadataStore) {
        this.options = options;
        this.crypto = crypto;
        this.metadataStore = metadataStore;
        this.accessGate = new AccessGate();
        this.storage = new SecureStorageEngine(crypto, metadataStore, accessGate, options.storage);
        this.registry = new IntegrityRegistry();
        this.countermeasures = new DefaultCountermeasures(
            accessGate, options.monitor.monitoredRoot, options.monitor.quarantineOnLockdown);
        this.monitor = new IntegrityMonitor(
            registry,
            options.severityTable,
            crypto,
            new CountermeasureResponder(countermeasures),
            options.monitor
        );
        countermeasures.attach(monitor);
    }

    /**
     * Build a context with a {@link KeyStoreCryptoProvider} and a JSON or in-memory metadata store,
     * as configured.
     * @throws IOException if an existing metadata file cannot be read
     */
    public static VaultContext create(VaultOptions options) throws IOException {
        CryptoProvider crypto = options.keyStoreFile != null
            ? new KeyStoreCryptoProvider(options.keyStoreFile, options.keyStorePassword)
            : new KeyStoreCryptoProvider();
        MetadataStore metadata = options.metadataFile != null
            ? new JsonFileMetadataStore(options.metadataFile)
            : new InMemoryMetadataStore();
        return new VaultContext(options, crypto, metadata);
    }

    /**
     * Start integrity monitoring.
     * @throws IOException if the configured baseline cannot be loaded
     */
    public void initialize() throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Vault context has been shut down");
        }
        monitor.initialize();
        logger.info("Vault initialized, storage root " + storage.getRoot());
    }

    /**
     * Stop monitoring and storage. Idempotent.
     */
    public void shutdown() {
        if (closed.getAndSet(true)) {
            return;
        }
        monitor.shutdown();
        storage.shutdown().join();
        logger.info("Vault shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public VaultOptions getOptions() { return options; }
    public CryptoProvider getCrypto() { return crypto; }
    public MetadataStore getMetadataStore() { return metadataStore; }
    public AccessGate getAccessGate() { return accessGate; }
    public SecureStorageEngine getStorage() { return storage; }
    public IntegrityRegistry getRegistry() { return registry; }
    public DefaultCountermeasures getCountermeasures() { return countermeasures; }
    public IntegrityMonitor getMonitor() { return monitor; }
}
