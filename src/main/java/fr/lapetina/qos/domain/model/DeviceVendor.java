package fr.lapetina.qos.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Platforms a QoS policy can be rendered for.
 */
public enum DeviceVendor {
    CISCO_IOS,
    JUNIPER_JUNOS,
    LINUX_TC,
    /** Switch managed through an SDN controller rather than a CLI. */
    OPENFLOW;

    public boolean isCommandLine() {
        return this != OPENFLOW;
    }

    /**
     * Accepts the enum name or the usual short vendor names ("cisco", "juniper", "linux").
     */
    public static Optional<DeviceVendor> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "cisco", "cisco_ios", "ios" -> Optional.of(CISCO_IOS);
            case "juniper", "juniper_junos", "junos" -> Optional.of(JUNIPER_JUNOS);
            case "linux", "linux_tc", "tc" -> Optional.of(LINUX_TC);
            case "openflow", "sdn" -> Optional.of(OPENFLOW);
            default -> Optional.empty();
        };
    }
}
