package fr.lapetina.qos.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Association between an interface and an applied policy.
 */
public record InterfaceQosPolicy(
        String deviceId,
        String interfaceName,
        String policyId,
        Direction direction,
        boolean active,
        Instant appliedAt
) {
    public InterfaceQosPolicy {
        Objects.requireNonNull(deviceId, "Device id is required");
        Objects.requireNonNull(interfaceName, "Interface name is required");
        Objects.requireNonNull(policyId, "Policy id is required");
        Objects.requireNonNull(direction, "Direction is required");
        if (appliedAt == null) {
            appliedAt = Instant.now();
        }
    }

    public static InterfaceQosPolicy activeNow(String deviceId, String interfaceName,
                                               String policyId, Direction direction) {
        return new InterfaceQosPolicy(deviceId, interfaceName, policyId, direction, true, Instant.now());
    }

    public InterfaceQosPolicy deactivate() {
        return new InterfaceQosPolicy(deviceId, interfaceName, policyId, direction, false, appliedAt);
    }
}
