package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;

import java.util.List;

/**
 * Computes per-class queue and congestion parameters for a policy.
 *
 * Implementations are pure and stateless: they may be called concurrently
 * without synchronization.
 */
public interface QueueAlgorithm {

    QueueAlgorithmType getType();

    /**
     * Calculates one configuration per traffic class, ordered by decreasing class priority
     * (declaration order among equal priorities).
     *
     * @throws fr.lapetina.qos.domain.exception.ValidationException if the policy is malformed
     *         or its bandwidth guarantees do not fit; nothing is produced in that case
     */
    List<QueueConfiguration> calculate(QosPolicy policy);
}
