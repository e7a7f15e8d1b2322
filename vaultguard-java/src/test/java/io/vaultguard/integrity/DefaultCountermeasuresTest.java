package io.vaultguard.integrity;

import io.vaultguard.crypto.KeyStoreCryptoProvider;
import io.vaultguard.integrity.DefaultCountermeasures.SecurityAlert;
import io.vaultguard.integrity.IntegrityMonitor.MonitorOptions;
import io.vaultguard.storage.AccessGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultCountermeasures")
class DefaultCountermeasuresTest {

    @TempDir
    Path root;

    private AccessGate gate;
    private DefaultCountermeasures countermeasures;
    private List<SecurityAlert> alerts;

    @BeforeEach
    void setUp() {
        gate = new AccessGate();
        countermeasures = new DefaultCountermeasures(gate, root, true);
        alerts = new ArrayList<>();
        countermeasures.setOnAlert(alerts::add);
    }

    private static IntegrityRecord violation(String resource, ThreatLevel level) {
        return new IntegrityRecord(resource, "0".repeat(64), "f".repeat(64), System.currentTimeMillis(), level);
    }

    private IntegrityMonitor attachedMonitor() {
        IntegrityMonitor monitor = new IntegrityMonitor(new IntegrityRegistry(), SeverityTable.empty(),
            new KeyStoreCryptoProvider(), new CountermeasureResponder(countermeasures),
            MonitorOptions.builder().monitoredRoot(root).initialDelay(Duration.ofHours(1)).build());
        countermeasures.attach(monitor);
        return monitor;
    }

    @Nested
    @DisplayName("Lockdown")
    class LockdownTests {

        @Test
        @DisplayName("should lock the gate, quarantine and alert")
        void lockdown() throws IOException {
            Files.createDirectories(root.resolve("bin"));
            Files.writeString(root.resolve("bin/core.bin"), "tampered");

            countermeasures.lockdown(List.of(violation("bin/core.bin", ThreatLevel.CRITICAL)));

            assertTrue(gate.isLocked());
            assertTrue(countermeasures.isInRecovery());
            assertFalse(Files.exists(root.resolve("bin/core.bin")));
            try (Stream<Path> quarantined = Files.list(countermeasures.getQuarantineDirectory())) {
                List<String> names = quarantined.map(p -> p.getFileName().toString()).toList();
                assertEquals(1, names.size());
                assertTrue(names.get(0).startsWith("bin_core.bin."));
            }
            assertEquals(1, alerts.size());
            assertEquals(ThreatLevel.CRITICAL, alerts.get(0).level());
            assertEquals(List.of("bin/core.bin"), alerts.get(0).resources());
        }

        @Test
        @DisplayName("should leave files in place when quarantine is disabled")
        void noQuarantine() throws IOException {
            DefaultCountermeasures noQuarantine = new DefaultCountermeasures(gate, root, false);
            Files.writeString(root.resolve("core.bin"), "tampered");

            noQuarantine.lockdown(List.of(violation("core.bin", ThreatLevel.CRITICAL)));

            assertTrue(gate.isLocked());
            assertTrue(Files.exists(root.resolve("core.bin")));
            assertFalse(Files.exists(noQuarantine.getQuarantineDirectory()));
        }

        @Test
        @DisplayName("should stay locked until recovery completes")
        void recovery() {
            IntegrityMonitor monitor = attachedMonitor();
            try {
                countermeasures.lockdown(List.of(violation("missing.bin", ThreatLevel.CRITICAL)));

                assertTrue(gate.isLocked());

                countermeasures.completeRecovery();

                assertFalse(gate.isLocked());
                assertFalse(countermeasures.isInRecovery());
            } finally {
                monitor.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("Defensive Measures")
    class DefensiveTests {

        @Test
        @DisplayName("should isolate resources and accelerate the monitor")
        void isolate() {
            IntegrityMonitor monitor = attachedMonitor();
            try {
                countermeasures.defensiveMeasures(List.of(
                    violation("a.db", ThreatLevel.HIGH),
                    violation("b.db", ThreatLevel.LOW)));

                assertEquals(Set.of("a.db", "b.db"), countermeasures.getIsolatedResources());
                assertTrue(monitor.isAccelerated());
                assertFalse(gate.isLocked());
                assertEquals(ThreatLevel.HIGH, alerts.get(0).level());

                countermeasures.completeRecovery();

                assertTrue(countermeasures.getIsolatedResources().isEmpty());
            } finally {
                monitor.shutdown();
            }
        }

        @Test
        @DisplayName("should accelerate the monitor for enhanced monitoring")
        void enhance() {
            IntegrityMonitor monitor = attachedMonitor();
            try {
                countermeasures.enhanceMonitoring(List.of(violation("c.db", ThreatLevel.MEDIUM)));

                assertTrue(monitor.isAccelerated());
                assertTrue(alerts.isEmpty());
            } finally {
                monitor.shutdown();
            }
        }

        @Test
        @DisplayName("should work without an attached monitor")
        void detached() {
            assertDoesNotThrow(() -> countermeasures.enhanceMonitoring(List.of(violation("c.db", ThreatLevel.MEDIUM))));
            assertDoesNotThrow(() -> countermeasures.logForAnalysis(List.of(violation("d.db", ThreatLevel.LOW))));
        }
    }
}
