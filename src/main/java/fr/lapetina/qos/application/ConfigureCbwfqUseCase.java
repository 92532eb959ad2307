package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.BandwidthAllocation;
import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.Direction;

import java.util.Objects;

/**
 * Applies a policy with the CBWFQ layout, replacing whatever the interface currently runs.
 */
public final class ConfigureCbwfqUseCase {

    private final ValidateAndApplyQosConfigUseCase applyUseCase;
    private final CalculateBandwidthAllocationUseCase allocationUseCase;

    public ConfigureCbwfqUseCase(ValidateAndApplyQosConfigUseCase applyUseCase,
                               CalculateBandwidthAllocationUseCase allocationUseCase) {
        this.applyUseCase = Objects.requireNonNull(applyUseCase, "Apply use case is required");
        this.allocationUseCase = Objects.requireNonNull(allocationUseCase, "Allocation use case is required");
    }

    public QosConfigurationResult execute(String policyId, String deviceId, String interfaceName, Direction direction) {
        return applyUseCase.execute(new ApplyQosRequest(policyId, deviceId, interfaceName, direction,
                QueueAlgorithmType.CBWFQ, true));
    }

    /**
     * Computes the CBWFQ allocation without touching any device.
     */
    public BandwidthAllocation simulate(String policyId) {
        return allocationUseCase.execute(policyId, QueueAlgorithmType.CBWFQ);
    }
}
