package io.vaultguard.integrity;

import java.util.HashMap;
import java.util.Map;

/**
 * Static resource to severity mapping. Resources without an entry get the default severity.
 */
public final class SeverityTable {

    private final Map<String, ThreatLevel> severities;
    private final ThreatLevel defaultSeverity;

    private SeverityTable(Map<String, ThreatLevel> severities, ThreatLevel defaultSeverity) {
        this.severities = Map.copyOf(severities);
        this.defaultSeverity = defaultSeverity;
    }

    public static SeverityTable of(Map<String, ThreatLevel> severities) {
        return new SeverityTable(severities, ThreatLevel.LOW);
    }

    public static SeverityTable empty() {
        return of(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public ThreatLevel severityOf(String resourceName) {
        return severities.getOrDefault(resourceName, defaultSeverity);
    }

    public ThreatLevel getDefaultSeverity() {
        return defaultSeverity;
    }

    public Map<String, ThreatLevel> entries() {
        return severities;
    }

    public static class Builder {
        private final Map<String, ThreatLevel> severities = new HashMap<>();
        private ThreatLevel defaultSeverity = ThreatLevel.LOW;

        public Builder critical(String resource) { return put(resource, ThreatLevel.CRITICAL); }
        public Builder high(String resource) { return put(resource, ThreatLevel.HIGH); }
        public Builder medium(String resource) { return put(resource, ThreatLevel.MEDIUM); }
        public Builder low(String resource) { return put(resource, ThreatLevel.LOW); }

        public Builder put(String resource, ThreatLevel severity) {
            if (severity == ThreatLevel.NONE) {
                throw new IllegalArgumentException("A monitored resource cannot have severity NONE: " + resource);
            }
            severities.put(resource, severity);
            return this;
        }

        public Builder defaultSeverity(ThreatLevel severity) {
            if (severity == ThreatLevel.NONE) {
                throw new IllegalArgumentException("Default severity cannot be NONE");
            }
            this.defaultSeverity = severity;
            return this;
        }

        public SeverityTable build() {
            return new SeverityTable(severities, defaultSeverity);
        }
    }
}
