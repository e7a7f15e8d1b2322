package io.vaultguard.integrity;

public enum IntegrityStatus {
    /** Monitoring started, no tick evaluated yet. */
    MONITORING,
    /** Last tick found no violations. */
    SECURE,
    /** Last tick found at least one violation, or a compromise is still latched. */
    COMPROMISED,
    /** Last tick failed, or the monitor is not running. */
    OFFLINE
}
