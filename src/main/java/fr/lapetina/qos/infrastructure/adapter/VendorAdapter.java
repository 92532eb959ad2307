package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.TrafficClass;

import java.util.List;

/**
 * Renders computed queue configurations as device CLI commands.
 *
 * Implementations are pure: they never talk to a device. Execution goes through
 * {@link CommandExecutionService}.
 */
public interface VendorAdapter {

    DeviceVendor getVendor();

    /**
     * Ordered commands that install the policy on the interface.
     *
     * @throws fr.lapetina.qos.domain.exception.ValidationException if the platform cannot express the request
     */
    List<String> generate(QosCommandRequest request);

    /**
     * Ordered commands that detach the policy from the interface and delete its definitions.
     *
     * @param trafficClasses the policy's traffic classes in declaration order, may be empty
     */
    List<String> generateRemoval(String interfaceName, String policyName, Direction direction,
                                 List<TrafficClass> trafficClasses);
}
