package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.AlgorithmFactory;
import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;

import java.time.Duration;
import java.util.List;

/**
 * Runs a queue algorithm and records its latency.
 */
final class QueueCalculations {

    private QueueCalculations() {
    }

    static List<QueueConfiguration> calculate(QueueAlgorithmType algorithm, QosPolicy policy,
                                              QosMetricsRegistry metrics) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            List<QueueConfiguration> configurations = AlgorithmFactory.create(algorithm).calculate(policy);
            success = true;
            return configurations;
        } finally {
            if (metrics != null) {
                metrics.recordCalculation(algorithm, success, Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }
}
