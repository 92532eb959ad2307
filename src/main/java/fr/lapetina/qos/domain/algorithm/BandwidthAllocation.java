package fr.lapetina.qos.domain.algorithm;

import java.util.List;

/**
 * Inspection view of how a policy budget is split between classes.
 *
 * @param bandwidthLimit      policy budget in kbps
 * @param totalGuaranteed     sum of class guarantees in kbps
 * @param unreserved          budget left for weighted sharing in kbps
 * @param classes             one entry per class, by decreasing priority
 */
public record BandwidthAllocation(
        QueueAlgorithmType algorithm,
        int bandwidthLimit,
        int totalGuaranteed,
        int unreserved,
        List<ClassAllocation> classes
) {
    public BandwidthAllocation {
        classes = List.copyOf(classes);
    }

    /**
     * Allocation of one traffic class.
     *
     * @param maxRateKbps guarantee plus the weighted share of the unreserved bandwidth,
     *                    bounded by the class maximum when one is set
     */
    public record ClassAllocation(
            String className,
            double bandwidthPercent,
            int guaranteedRateKbps,
            double sharedRateKbps,
            double maxRateKbps,
            int priority,
            boolean strictPriority
    ) {
    }
}
