package fr.lapetina.qos.infrastructure.sdn;

import java.util.Locale;
import java.util.Optional;

/**
 * SDN controllers the service knows about.
 */
public enum ControllerType {
    ONOS,
    OPENDAYLIGHT,
    /** Recognised, no payload shapes available. */
    RYU,
    /** Recognised, no payload shapes available. */
    FLOODLIGHT;

    public boolean isSupported() {
        return this == ONOS || this == OPENDAYLIGHT;
    }

    public static Optional<ControllerType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "ONOS" -> Optional.of(ONOS);
            case "OPENDAYLIGHT", "ODL" -> Optional.of(OPENDAYLIGHT);
            case "RYU" -> Optional.of(RYU);
            case "FLOODLIGHT" -> Optional.of(FLOODLIGHT);
            default -> Optional.empty();
        };
    }
}
