package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.InterfaceQosPolicy;

import java.util.List;
import java.util.Optional;

/**
 * Storage of interface/policy associations, implemented outside the library.
 */
public interface InterfaceQosPolicyRepository {

    Optional<InterfaceQosPolicy> findActive(String deviceId, String interfaceName, Direction direction);

    List<InterfaceQosPolicy> findByDevice(String deviceId);

    List<InterfaceQosPolicy> findByPolicy(String policyId);

    /**
     * Inserts the association or replaces the one with the same device, interface, direction and policy.
     */
    InterfaceQosPolicy save(InterfaceQosPolicy association);
}
