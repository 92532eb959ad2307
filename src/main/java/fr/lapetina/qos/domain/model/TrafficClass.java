package fr.lapetina.qos.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named class of traffic within a QoS policy.
 * Bandwidth values are kbps, burst is kb. Immutable and thread-safe.
 */
public record TrafficClass(
        String name,
        int priority,
        int minBandwidth,
        int maxBandwidth,
        String dscp,
        int burst,
        List<TrafficClassifier> classifiers
) {
    public static final String DEFAULT_DSCP = "default";
    public static final int MAX_PRIORITY = 7;

    public TrafficClass {
        Objects.requireNonNull(name, "Traffic class name is required");
        dscp = dscp == null || dscp.isBlank() ? DEFAULT_DSCP : dscp;
        classifiers = classifiers != null ? List.copyOf(classifiers) : List.of();
    }

    public boolean hasDefaultDscp() {
        return DEFAULT_DSCP.equalsIgnoreCase(dscp);
    }

    /**
     * Strict-priority classes under LLQ.
     */
    public boolean isLowLatency() {
        return priority >= 5;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TrafficClass.
     */
    public static final class Builder {
        private String name;
        private int priority;
        private int minBandwidth;
        private int maxBandwidth;
        private String dscp = DEFAULT_DSCP;
        private int burst;
        private final List<TrafficClassifier> classifiers = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder minBandwidth(int kbps) {
            this.minBandwidth = kbps;
            return this;
        }

        public Builder maxBandwidth(int kbps) {
            this.maxBandwidth = kbps;
            return this;
        }

        public Builder dscp(String dscp) {
            this.dscp = dscp;
            return this;
        }

        public Builder burst(int kb) {
            this.burst = kb;
            return this;
        }

        public Builder addClassifier(TrafficClassifier classifier) {
            this.classifiers.add(classifier);
            return this;
        }

        public TrafficClass build() {
            return new TrafficClass(name, priority, minBandwidth, maxBandwidth, dscp, burst, classifiers);
        }
    }
}
