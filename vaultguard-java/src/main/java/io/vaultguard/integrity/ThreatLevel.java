package io.vaultguard.integrity;

/**
 * Severity of an integrity violation batch. Declaration order is severity order.
 */
public enum ThreatLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(ThreatLevel other) {
        return compareTo(other) >= 0;
    }

    public static ThreatLevel max(ThreatLevel a, ThreatLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
