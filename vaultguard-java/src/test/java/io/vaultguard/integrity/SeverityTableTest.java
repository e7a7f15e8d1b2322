package io.vaultguard.integrity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SeverityTable")
class SeverityTableTest {

    @Test
    @DisplayName("should look up configured severities")
    void lookup() {
        SeverityTable table = SeverityTable.builder()
            .critical("core.bin")
            .high("keys.p12")
            .medium("config.json")
            .build();

        assertEquals(ThreatLevel.CRITICAL, table.severityOf("core.bin"));
        assertEquals(ThreatLevel.HIGH, table.severityOf("keys.p12"));
        assertEquals(ThreatLevel.MEDIUM, table.severityOf("config.json"));
        assertEquals(ThreatLevel.LOW, table.severityOf("other"));
    }

    @Test
    @DisplayName("should honour a custom default")
    void customDefault() {
        SeverityTable table = SeverityTable.builder().defaultSeverity(ThreatLevel.MEDIUM).build();

        assertEquals(ThreatLevel.MEDIUM, table.severityOf("anything"));
    }

    @Test
    @DisplayName("should refuse NONE as a severity")
    void rejectsNone() {
        assertThrows(IllegalArgumentException.class, () -> SeverityTable.builder().put("a", ThreatLevel.NONE));
        assertThrows(IllegalArgumentException.class, () -> SeverityTable.builder().defaultSeverity(ThreatLevel.NONE));
    }

    @Test
    @DisplayName("should build from a map")
    void fromMap() {
        SeverityTable table = SeverityTable.of(Map.of("core.bin", ThreatLevel.CRITICAL));

        assertEquals(Map.of("core.bin", ThreatLevel.CRITICAL), table.entries());
    }

    @Test
    @DisplayName("should order threat levels by severity")
    void threatOrder() {
        assertTrue(ThreatLevel.CRITICAL.isAtLeast(ThreatLevel.HIGH));
        assertFalse(ThreatLevel.LOW.isAtLeast(ThreatLevel.MEDIUM));
        assertEquals(ThreatLevel.HIGH, ThreatLevel.max(ThreatLevel.LOW, ThreatLevel.HIGH));
        assertEquals(ThreatLevel.MEDIUM, ThreatLevel.max(ThreatLevel.MEDIUM, ThreatLevel.NONE));
    }
}
