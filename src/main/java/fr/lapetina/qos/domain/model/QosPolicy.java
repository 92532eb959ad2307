package fr.lapetina.qos.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative QoS policy: a bandwidth budget (kbps) shared by ordered traffic classes.
 *
 * <p>Structural checks only happen here. Bandwidth invariants are enforced by
 * {@link fr.lapetina.qos.domain.algorithm.PolicyValidator} and by each queue algorithm
 * before any configuration is produced.
 */
public record QosPolicy(
        String id,
        String name,
        int bandwidthLimit,
        int priority,
        boolean active,
        List<TrafficClass> trafficClasses
) {
    public QosPolicy {
        Objects.requireNonNull(name, "Policy name is required");
        if (id == null) {
            id = name;
        }
        trafficClasses = trafficClasses != null ? List.copyOf(trafficClasses) : List.of();
    }

    public int totalMinBandwidth() {
        return trafficClasses.stream().mapToInt(TrafficClass::minBandwidth).sum();
    }

    /**
     * Returns a copy with a different budget and class list, keeping identity fields.
     */
    public QosPolicy withClasses(int newBandwidthLimit, List<TrafficClass> classes) {
        return new QosPolicy(id, name, newBandwidthLimit, priority, active, classes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for QosPolicy.
     */
    public static final class Builder {
        private String id;
        private String name;
        private int bandwidthLimit;
        private int priority;
        private boolean active = true;
        private final List<TrafficClass> trafficClasses = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder bandwidthLimit(int kbps) {
            this.bandwidthLimit = kbps;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder addTrafficClass(TrafficClass trafficClass) {
            this.trafficClasses.add(trafficClass);
            return this;
        }

        public QosPolicy build() {
            return new QosPolicy(id, name, bandwidthLimit, priority, active, trafficClasses);
        }
    }
}
