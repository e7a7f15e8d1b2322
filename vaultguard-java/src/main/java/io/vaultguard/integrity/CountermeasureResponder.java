package io.vaultguard.integrity;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatches a violation batch to exactly one {@link Countermeasures} action chosen by severity.
 * Failures inside an action are logged and go no further.
 */
public class CountermeasureResponder implements ViolationResponder {

    private static final Logger logger = Logger.getLogger(CountermeasureResponder.class.getName());

    private final Countermeasures countermeasures;

    public CountermeasureResponder(Countermeasures countermeasures) {
        this.countermeasures = countermeasures;
    }

    @Override
    public void handle(ThreatLevel maxSeverity, List<IntegrityRecord> records) {
        try {
            switch (maxSeverity) {
                case CRITICAL -> {
                    logger.severe("CRITICAL threat detected, initiating lockdown");
                    countermeasures.lockdown(records);
                }
                case HIGH -> {
                    logger.warning("HIGH threat detected, implementing defensive measures");
                    countermeasures.defensiveMeasures(records);
                }
                case MEDIUM -> {
                    logger.warning("MEDIUM threat detected, enhancing monitoring");
                    countermeasures.enhanceMonitoring(records);
                }
                case LOW -> {
                    logger.info("LOW threat detected, logging for analysis");
                    countermeasures.logForAnalysis(records);
                }
                case NONE -> { }
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Response to " + maxSeverity + " threat failed", e);
        }
    }
}
