package io.vaultguard.integrity;

import java.util.List;

/**
 * The response actions available to {@link CountermeasureResponder}, one per severity.
 */
public interface Countermeasures {

    /** Disable access, quarantine, alert, enter recovery. */
    void lockdown(List<IntegrityRecord> records);

    /** Isolate affected resources and check more often. */
    void defensiveMeasures(List<IntegrityRecord> records);

    /** Check more often and watch more closely. */
    void enhanceMonitoring(List<IntegrityRecord> records);

    /** Record the violations for later analysis. */
    void logForAnalysis(List<IntegrityRecord> records);
}
