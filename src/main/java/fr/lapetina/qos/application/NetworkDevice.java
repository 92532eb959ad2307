package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.model.DeviceVendor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Managed network device as known by the inventory.
 *
 * @param managementAddress host the command executor connects to
 * @param qosCapable        false for devices that cannot run queueing policies
 * @param switchId          controller identifier of an OpenFlow switch, null for CLI devices
 */
public record NetworkDevice(
        String id,
        String name,
        String managementAddress,
        DeviceVendor vendor,
        boolean qosCapable,
        List<NetworkInterface> interfaces,
        String switchId
) {
    public NetworkDevice {
        Objects.requireNonNull(id, "Device id is required");
        Objects.requireNonNull(vendor, "Vendor is required");
        interfaces = interfaces != null ? List.copyOf(interfaces) : List.of();
    }

    public Optional<NetworkInterface> findInterface(String interfaceName) {
        return interfaces.stream().filter(i -> i.name().equals(interfaceName)).findFirst();
    }

    /**
     * Controller identifier of the switch, falling back to the device id.
     */
    public String openFlowSwitchId() {
        return switchId != null ? switchId : id;
    }
}
