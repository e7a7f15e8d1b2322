package io.vaultguard.integrity;

/**
 * One hash mismatch found during a tick.
 *
 * @param resourceName Registered resource name, relative to the monitored root
 * @param expectedHash Hash recorded in the registry
 * @param actualHash Hash computed during the tick
 * @param timestamp Epoch millis of detection
 * @param severity Severity of the resource from the severity table
 */
public record IntegrityRecord(
    String resourceName,
    String expectedHash,
    String actualHash,
    long timestamp,
    ThreatLevel severity
) {}
