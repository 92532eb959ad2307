package fr.lapetina.qos.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Transport or network protocol a classifier can select on.
 * {@link #ANY} acts as a wildcard.
 */
public enum Protocol {
    ANY(-1),
    TCP(6),
    UDP(17),
    ICMP(1),
    IGMP(2);

    private final int ipProtocolNumber;

    Protocol(int ipProtocolNumber) {
        this.ipProtocolNumber = ipProtocolNumber;
    }

    /**
     * IANA protocol number, or -1 for {@link #ANY}.
     */
    public int getIpProtocolNumber() {
        return ipProtocolNumber;
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isWildcard() {
        return this == ANY;
    }

    /**
     * Parses a protocol name case-insensitively. Null or blank maps to {@link #ANY}.
     */
    public static Optional<Protocol> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of(ANY);
        }
        for (Protocol protocol : values()) {
            if (protocol.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(protocol);
            }
        }
        return Optional.empty();
    }
}
