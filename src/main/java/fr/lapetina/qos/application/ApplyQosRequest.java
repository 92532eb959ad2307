package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.Direction;

import java.util.Objects;

/**
 * Request to attach a policy to a device interface.
 *
 * @param reapplyIfExists replace an association already active on the interface and direction;
 *                        when false such an association makes the call fail
 */
public record ApplyQosRequest(
        String policyId,
        String deviceId,
        String interfaceName,
        Direction direction,
        QueueAlgorithmType algorithm,
        boolean reapplyIfExists
) {
    public ApplyQosRequest {
        Objects.requireNonNull(policyId, "Policy id is required");
        Objects.requireNonNull(deviceId, "Device id is required");
        Objects.requireNonNull(interfaceName, "Interface name is required");
        direction = direction != null ? direction : Direction.EGRESS;
        algorithm = algorithm != null ? algorithm : QueueAlgorithmType.CBWFQ;
    }
}
