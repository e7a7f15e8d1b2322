package io.vaultguard.integrity;

import io.vaultguard.storage.AccessGate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Countermeasures acting on the vault itself.
 *
 * Lockdown locks the storage {@link AccessGate}, moves compromised resources into
 * {@code <monitoredRoot>/.quarantine/}, raises a CRITICAL alert and leaves the vault in recovery
 * until {@link #completeRecovery()}. Defensive measures mark resources as isolated and make the
 * attached monitor check faster; enhanced monitoring only makes it check faster.
 */
public class DefaultCountermeasures implements Countermeasures {

    private static final Logger logger = Logger.getLogger(DefaultCountermeasures.class.getName());

    public static final String QUARANTINE_DIR = ".quarantine";

    private final AccessGate accessGate;
    private final Path monitoredRoot;
    private final boolean quarantineEnabled;
    private final Set<String> isolated = ConcurrentHashMap.newKeySet();

    private volatile IntegrityMonitor monitor;
    private volatile boolean inRecovery;
    private Consumer<SecurityAlert> onAlert;

    public DefaultCountermeasures(AccessGate accessGate, Path monitoredRoot, boolean quarantineEnabled) {
        this.accessGate = accessGate;
        this.monitoredRoot = monitoredRoot;
        this.quarantineEnabled = quarantineEnabled;
    }

    @Override
    public void lockdown(List<IntegrityRecord> records) {
        List<String> resources = resourceNames(records);
        logger.severe("Emergency lockdown for " + resources);

        accessGate.lock("Integrity violation in " + String.join(", ", resources));
        if (quarantineEnabled) {
            for (String resource : resources) {
                quarantine(resource);
            }
        }
        alert(ThreatLevel.CRITICAL, "Lockdown engaged, storage access disabled", resources);
        inRecovery = true;
    }

    @Override
    public void defensiveMeasures(List<IntegrityRecord> records) {
        List<String> resources = resourceNames(records);
        isolated.addAll(resources);
        logger.warning("Isolated " + resources + " after " + records.size() + " violations");
        alert(ThreatLevel.HIGH, "Resources isolated", resources);
        accelerateMonitor();
    }

    @Override
    public void enhanceMonitoring(List<IntegrityRecord> records) {
        logger.info("Enhancing monitoring after violations in " + resourceNames(records));
        accelerateMonitor();
    }

    @Override
    public void logForAnalysis(List<IntegrityRecord> records) {
        for (IntegrityRecord record : records) {
            logger.info("Violation for analysis: " + record.resourceName()
                + " expected=" + record.expectedHash()
                + " actual=" + record.actualHash()
                + " at=" + Instant.ofEpochMilli(record.timestamp()));
        }
    }

    /**
     * Leave recovery: reopen storage, clear isolation and release the monitor's compromise latch.
     * Quarantined files stay where they are.
     */
    public void completeRecovery() {
        accessGate.unlock();
        isolated.clear();
        inRecovery = false;
        IntegrityMonitor m = monitor;
        if (m != null) {
            m.acknowledgeCompromise();
        }
        logger.info("Recovery completed");
    }

    public boolean isInRecovery() {
        return inRecovery;
    }

    public Set<String> getIsolatedResources() {
        return Set.copyOf(isolated);
    }

    public Path getQuarantineDirectory() {
        return monitoredRoot.resolve(QUARANTINE_DIR);
    }

    public void attach(IntegrityMonitor monitor) {
        this.monitor = monitor;
    }

    public void setOnAlert(Consumer<SecurityAlert> listener) { this.onAlert = listener; }

    private void accelerateMonitor() {
        IntegrityMonitor m = monitor;
        if (m != null) {
            m.accelerate();
        }
    }

    private void quarantine(String resource) {
        Path source = monitoredRoot.resolve(resource);
        if (!Files.exists(source)) {
            return;
        }
        Path dir = getQuarantineDirectory();
        String quarantinedName = resource.replace('/', '_').replace('\\', '_') + "." + System.currentTimeMillis();
        try {
            Files.createDirectories(dir);
            Files.move(source, dir.resolve(quarantinedName), StandardCopyOption.REPLACE_EXISTING);
            logger.warning("Quarantined " + resource + " as " + quarantinedName);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to quarantine " + resource, e);
        }
    }

    private void alert(ThreatLevel level, String message, List<String> resources) {
        Consumer<SecurityAlert> listener = onAlert;
        if (listener != null) {
            listener.accept(new SecurityAlert(level, message, resources, Instant.now()));
        }
    }

    private static List<String> resourceNames(List<IntegrityRecord> records) {
        return records.stream().map(IntegrityRecord::resourceName).distinct().toList();
    }

    public record SecurityAlert(ThreatLevel level, String message, List<String> resources, Instant raisedAt) {}
}
