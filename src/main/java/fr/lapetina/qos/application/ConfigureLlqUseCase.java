package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.BandwidthAllocation;
import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.Direction;

import java.util.Objects;

/**
 * Applies a policy with the LLQ layout, replacing whatever the interface currently runs.
 *
 * <p>Priority-7 classes go to the strict-priority queue. The call fails with
 * {@link fr.lapetina.qos.domain.model.ErrorType#LOW_LATENCY_VALIDATION_ERROR} when they reserve
 * more than a third of the budget.
 */
public final class ConfigureLlqUseCase {

    private final ValidateAndApplyQosConfigUseCase applyUseCase;
    private final CalculateBandwidthAllocationUseCase allocationUseCase;

    public ConfigureLlqUseCase(ValidateAndApplyQosConfigUseCase applyUseCase,
                            CalculateBandwidthAllocationUseCase allocationUseCase) {
        this.applyUseCase = Objects.requireNonNull(applyUseCase, "Apply use case is required");
        this.allocationUseCase = Objects.requireNonNull(allocationUseCase, "Allocation use case is required");
    }

    public QosConfigurationResult execute(String policyId, String deviceId, String interfaceName, Direction direction) {
        return applyUseCase.execute(new ApplyQosRequest(policyId, deviceId, interfaceName, direction,
                QueueAlgorithmType.LLQ, true));
    }

    /**
     * Computes the LLQ allocation without touching any device.
     */
    public BandwidthAllocation simulate(String policyId) {
        return allocationUseCase.execute(policyId, QueueAlgorithmType.LLQ);
    }
}
