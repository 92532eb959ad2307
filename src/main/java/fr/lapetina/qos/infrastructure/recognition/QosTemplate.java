package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;

/**
 * Suggested QoS treatment for a traffic category.
 *
 * @param bandwidthPercent         share of the link to reserve
 * @param latencyTargetMs          one-way latency target
 * @param jitterToleranceMs        acceptable jitter
 * @param packetLossTolerance      acceptable loss, percent
 */
public record QosTemplate(
        String key,
        List<String> keywords,
        String name,
        String description,
        int bandwidthPercent,
        int priority,
        int latencyTargetMs,
        int jitterToleranceMs,
        double packetLossTolerance
) {
    public QosTemplate {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    /**
     * Copy named after the traffic class it is suggested for.
     */
    public QosTemplate customize(String trafficClass) {
        return new QosTemplate(key, keywords, name + "_" + trafficClass,
                description + " for " + trafficClass, bandwidthPercent, priority,
                latencyTargetMs, jitterToleranceMs, packetLossTolerance);
    }
}
