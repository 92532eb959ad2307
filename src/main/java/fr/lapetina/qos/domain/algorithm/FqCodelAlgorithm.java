package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.model.CongestionParameters;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Fair-Queue Controlled Delay.
 *
 * <p>The resulting {@link QueueParameters#weight()} is the quantum in bytes and the ECN
 * congestion thresholds hold the CoDel target and interval in microseconds.
 */
public final class FqCodelAlgorithm implements QueueAlgorithm {

    public static final int DEFAULT_TARGET_MICROS = 5_000;
    public static final int DEFAULT_INTERVAL_MICROS = 100_000;
    public static final int DEFAULT_QUANTUM = 1514;
    public static final int DEFAULT_FLOWS = 1024;

    @Override
    public QueueAlgorithmType getType() {
        return QueueAlgorithmType.FQ_CODEL;
    }

    @Override
    public List<QueueConfiguration> calculate(QosPolicy policy) {
        PolicyValidator.validateStructureOrThrow(policy);
        PolicyValidator.requireGuaranteesWithinLimit(policy);

        int totalBandwidth = policy.bandwidthLimit();
        int baseQuantum = baseQuantum(totalBandwidth);

        List<QueueConfiguration> configurations = new ArrayList<>();
        for (TrafficClass tc : CbwfqAlgorithm.byDecreasingPriority(policy.trafficClasses())) {
            int target = targetDelayMicros(tc.priority());
            int interval = intervalMicros(target);
            int quantum = quantum(tc, baseQuantum);
            int flows = flows(tc.minBandwidth());

            QueueParameters queueParameters = new QueueParameters(
                    flows * 2,
                    flows * 4,
                    tc.minBandwidth(),
                    quantum,
                    tc.priority(),
                    (double) tc.minBandwidth() / totalBandwidth * 100.0
            );
            configurations.add(new QueueConfiguration(tc, queueParameters,
                    CongestionParameters.ecn(target, interval)));
        }
        return configurations;
    }

    static int targetDelayMicros(int priority) {
        if (priority >= 7) {
            return 2_000;
        } else if (priority >= 5) {
            return 3_000;
        } else if (priority >= 3) {
            return 5_000;
        }
        return 10_000;
    }

    static int intervalMicros(int targetMicros) {
        return Math.max(DEFAULT_INTERVAL_MICROS, targetMicros * 20);
    }

    /**
     * Roughly one, two or three MTUs depending on the total bandwidth tier (100 Mbps, 1 Gbps).
     */
    static int baseQuantum(int totalBandwidthKbps) {
        if (totalBandwidthKbps >= 1_000_000) {
            return 4608;
        } else if (totalBandwidthKbps >= 100_000) {
            return 3072;
        }
        return DEFAULT_QUANTUM;
    }

    static int quantum(TrafficClass tc, int baseQuantum) {
        double priorityFactor = (tc.priority() + 1) / 8.0;
        double bandwidthFactor = Math.max(1.0, tc.minBandwidth() / 1000.0);
        return Math.max(DEFAULT_QUANTUM, (int) (baseQuantum * priorityFactor * bandwidthFactor));
    }

    static int flows(int minBandwidthKbps) {
        if (minBandwidthKbps >= 100_000) {
            return 2048;
        } else if (minBandwidthKbps >= 10_000) {
            return 1024;
        }
        return 512;
    }
}
