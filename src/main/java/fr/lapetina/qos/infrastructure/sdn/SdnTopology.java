package fr.lapetina.qos.infrastructure.sdn;

import java.time.Instant;
import java.util.List;

/**
 * Switches and links reported by the controller at {@code discoveredAt}.
 */
public record SdnTopology(List<String> switches, List<Link> links, Instant discoveredAt) {

    public SdnTopology {
        switches = switches != null ? List.copyOf(switches) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
    }

    public static SdnTopology empty(Instant at) {
        return new SdnTopology(List.of(), List.of(), at);
    }

    public record Link(String sourceSwitch, String sourcePort, String destinationSwitch, String destinationPort) {
    }
}
