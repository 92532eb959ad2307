package fr.lapetina.qos.domain.model;

import java.util.Locale;

/**
 * Direction a policy is attached to on an interface.
 */
public enum Direction {
    INGRESS,
    EGRESS;

    /**
     * Cisco {@code service-policy} keyword.
     */
    public String serviceKeyword() {
        return this == EGRESS ? "output" : "input";
    }

    public static Direction fromName(String name) {
        if (name == null) {
            return EGRESS;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "ingress", "input", "in" -> INGRESS;
            case "egress", "output", "out" -> EGRESS;
            default -> throw new IllegalArgumentException("Unknown direction: " + name);
        };
    }
}
