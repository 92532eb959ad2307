package fr.lapetina.qos.application;

import java.util.Objects;

/**
 * Interface of a managed device.
 *
 * @param speedKbps line rate, 0 when unknown
 */
public record NetworkInterface(String name, String description, int speedKbps, boolean enabled) {

    public NetworkInterface {
        Objects.requireNonNull(name, "Interface name is required");
    }

    public static NetworkInterface of(String name) {
        return new NetworkInterface(name, null, 0, true);
    }
}
