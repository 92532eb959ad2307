package fr.lapetina.qos.domain.model;

import java.util.Objects;

/**
 * Computed configuration of one traffic class: the class itself plus its queue and
 * congestion parameters. Transient, produced on each policy evaluation.
 */
public record QueueConfiguration(
        TrafficClass trafficClass,
        QueueParameters queueParameters,
        CongestionParameters congestionParameters
) {
    public QueueConfiguration {
        Objects.requireNonNull(trafficClass, "Traffic class is required");
        Objects.requireNonNull(queueParameters, "Queue parameters are required");
        congestionParameters = congestionParameters != null ? congestionParameters : CongestionParameters.tailDrop();
    }

    public String className() {
        return trafficClass.name();
    }
}
