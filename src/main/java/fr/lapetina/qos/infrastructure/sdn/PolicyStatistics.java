package fr.lapetina.qos.infrastructure.sdn;

import java.time.Instant;
import java.util.Map;

/**
 * Flow counters of a deployed policy, per switch and summed.
 *
 * Switches whose statistics could not be read appear with an error and do not count in the totals.
 */
public record PolicyStatistics(
        String policyId,
        Map<String, SwitchStatistics> switches,
        int totalFlows,
        long totalBytes,
        long totalPackets,
        Instant collectedAt
) {
    public PolicyStatistics {
        switches = Map.copyOf(switches);
    }

    public static PolicyStatistics aggregate(String policyId, Map<String, SwitchStatistics> perSwitch, Instant at) {
        int flows = 0;
        long bytes = 0;
        long packets = 0;
        for (SwitchStatistics stats : perSwitch.values()) {
            if (stats.error() == null) {
                flows += stats.flowCount();
                bytes += stats.bytes();
                packets += stats.packets();
            }
        }
        return new PolicyStatistics(policyId, perSwitch, flows, bytes, packets, at);
    }

    public record SwitchStatistics(int flowCount, long bytes, long packets, String error) {

        public static SwitchStatistics of(int flowCount, long bytes, long packets) {
            return new SwitchStatistics(flowCount, bytes, packets, null);
        }

        public static SwitchStatistics failed(String error) {
            return new SwitchStatistics(0, 0, 0, error);
        }
    }
}
