package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a {@link BandwidthAllocation} from computed queue configurations.
 *
 * <p>Guarantees are the service rates. The remainder of the budget is split between the
 * weighted queues in proportion to their weight; strict-priority queues (weight 0) only
 * get their guarantee.
 */
public final class BandwidthAllocator {

    private BandwidthAllocator() {
        // Utility class
    }

    public static BandwidthAllocation allocate(QueueAlgorithmType algorithm, QosPolicy policy,
                                               List<QueueConfiguration> configurations) {
        int limit = policy.bandwidthLimit();
        int guaranteed = configurations.stream()
                .mapToInt(qc -> qc.queueParameters().serviceRate())
                .sum();
        int unreserved = Math.max(0, limit - guaranteed);
        double totalWeight = configurations.stream()
                .mapToDouble(qc -> qc.queueParameters().weight())
                .filter(w -> w > 0)
                .sum();

        List<BandwidthAllocation.ClassAllocation> classes = new ArrayList<>();
        for (QueueConfiguration qc : configurations) {
            QueueParameters params = qc.queueParameters();
            double share = totalWeight > 0 && params.weight() > 0
                    ? unreserved * params.weight() / totalWeight
                    : 0.0;
            double maxRate = params.serviceRate() + share;
            int classMax = qc.trafficClass().maxBandwidth();
            if (classMax > 0) {
                maxRate = Math.max(params.serviceRate(), Math.min(maxRate, classMax));
            }
            double percent = limit > 0 ? (double) params.serviceRate() / limit * 100.0 : 0.0;

            classes.add(new BandwidthAllocation.ClassAllocation(
                    qc.className(),
                    percent,
                    params.serviceRate(),
                    share,
                    maxRate,
                    params.priorityLevel(),
                    params.weight() == 0.0 && qc.trafficClass().isLowLatency()
            ));
        }
        return new BandwidthAllocation(algorithm, limit, guaranteed, unreserved, classes);
    }
}
