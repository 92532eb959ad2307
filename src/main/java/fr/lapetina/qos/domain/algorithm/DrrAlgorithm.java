package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.model.CongestionParameters;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Deficit Round Robin. Quantum (bytes) is the class share of a 1500-byte round scaled
 * up for links above 100 Mbps.
 */
public final class DrrAlgorithm implements QueueAlgorithm {

    public static final int DEFAULT_QUANTUM = 1500;
    static final int AVERAGE_PACKET_SIZE = 1000;
    static final int MIN_QUANTUM = 512;
    static final int MAX_QUANTUM = 65_536;

    @Override
    public QueueAlgorithmType getType() {
        return QueueAlgorithmType.DRR;
    }

    @Override
    public List<QueueConfiguration> calculate(QosPolicy policy) {
        PolicyValidator.validateStructureOrThrow(policy);
        PolicyValidator.requireGuaranteesWithinLimit(policy);

        int totalBandwidth = policy.bandwidthLimit();
        double totalWeight = policy.trafficClasses().stream().mapToDouble(DrrAlgorithm::weight).sum();

        List<QueueConfiguration> configurations = new ArrayList<>();
        for (TrafficClass tc : CbwfqAlgorithm.byDecreasingPriority(policy.trafficClasses())) {
            double weight = weight(tc);
            int quantum = quantum(weight, totalWeight, totalBandwidth);
            int bufferSize = bufferSize(quantum);
            int queueLimit = bufferSize * 2;

            QueueParameters queueParameters = new QueueParameters(
                    bufferSize,
                    queueLimit,
                    tc.minBandwidth(),
                    weight,
                    tc.priority(),
                    (double) tc.minBandwidth() / totalBandwidth * 100.0
            );

            CongestionParameters congestion = tc.priority() >= 5
                    ? CongestionParameters.red(queueLimit / 4, queueLimit * 3 / 4, 0.1)
                    : CongestionParameters.tailDrop();

            configurations.add(new QueueConfiguration(tc, queueParameters, congestion));
        }
        return configurations;
    }

    static double weight(TrafficClass tc) {
        return (tc.priority() + 1) * Math.max(1.0, tc.minBandwidth() / 1000.0);
    }

    static int quantum(double weight, double totalWeight, int totalBandwidthKbps) {
        if (totalWeight == 0) {
            return DEFAULT_QUANTUM;
        }
        double bandwidthFactor = Math.max(1.0, totalBandwidthKbps / 100_000.0);
        int quantum = (int) (DEFAULT_QUANTUM * (weight / totalWeight) * bandwidthFactor);
        return Math.max(MIN_QUANTUM, Math.min(MAX_QUANTUM, quantum));
    }

    static int bufferSize(int quantum) {
        int packets = Math.max(1, quantum / AVERAGE_PACKET_SIZE) * 4;
        return Math.max(16, Math.min(1024, packets));
    }
}
