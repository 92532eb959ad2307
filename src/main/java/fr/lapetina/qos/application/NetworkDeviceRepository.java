package fr.lapetina.qos.application;

import java.util.Optional;

/**
 * Device inventory, implemented outside the library.
 */
public interface NetworkDeviceRepository {

    Optional<NetworkDevice> findById(String deviceId);

    default Optional<NetworkInterface> findInterface(String deviceId, String interfaceName) {
        return findById(deviceId).flatMap(device -> device.findInterface(interfaceName));
    }
}
