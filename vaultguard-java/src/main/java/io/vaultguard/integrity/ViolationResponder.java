package io.vaultguard.integrity;

import java.util.List;

/**
 * Reacts to the violations found in one tick.
 *
 * Implementations must accept every level, including {@link ThreatLevel#NONE}, and must not
 * throw: the monitor calls this from its tick and expects it to return normally.
 */
@FunctionalInterface
public interface ViolationResponder {

    /**
     * @param maxSeverity Highest severity in the batch
     * @param records All violations found in the tick
     */
    void handle(ThreatLevel maxSeverity, List<IntegrityRecord> records);
}
