package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.BandwidthAllocation;
import fr.lapetina.qos.domain.algorithm.BandwidthAllocator;
import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.exception.PolicyNotFoundException;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Read-only view of how a stored policy would split its bandwidth.
 *
 * <p>Unlike the apply use cases this one throws: it touches no device and has nothing to roll back.
 */
public final class CalculateBandwidthAllocationUseCase {

    private final PolicyRepository policies;
    private final QosMetricsRegistry metrics;

    public CalculateBandwidthAllocationUseCase(PolicyRepository policies, QosMetricsRegistry metrics) {
        this.policies = Objects.requireNonNull(policies, "Policy repository is required");
        this.metrics = metrics;
    }

    public BandwidthAllocation execute(String policyId) {
        return execute(policyId, QueueAlgorithmType.CBWFQ);
    }

    /**
     * @throws PolicyNotFoundException if the policy does not exist
     * @throws fr.lapetina.qos.domain.exception.ValidationException if the policy violates its bandwidth invariants
     */
    public BandwidthAllocation execute(String policyId, QueueAlgorithmType algorithm) {
        QosPolicy policy = policies.findById(policyId)
                .orElseThrow(() -> new PolicyNotFoundException(policyId));
        return calculate(policy, algorithm);
    }

    public BandwidthAllocation calculate(QosPolicy policy, QueueAlgorithmType algorithm) {
        List<QueueConfiguration> configurations = QueueCalculations.calculate(algorithm, policy, metrics);
        return BandwidthAllocator.allocate(algorithm, policy, configurations);
    }
}
