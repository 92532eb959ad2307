package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.model.CongestionParameters;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Class-Based Weighted Fair Queuing.
 *
 * <p>Each class is guaranteed its minimum bandwidth; the unreserved remainder is shared
 * in proportion to a weight mixing priority (70%) and guarantee size (30%).
 * Classes with an explicit DSCP get WRED, the others tail-drop.
 */
public class CbwfqAlgorithm implements QueueAlgorithm {

    static final double WRED_DROP_PROBABILITY = 0.1;

    @Override
    public QueueAlgorithmType getType() {
        return QueueAlgorithmType.CBWFQ;
    }

    @Override
    public List<QueueConfiguration> calculate(QosPolicy policy) {
        PolicyValidator.validateStructureOrThrow(policy);
        PolicyValidator.requireGuaranteesWithinLimit(policy);
        return calculateStandardClasses(policy.bandwidthLimit(), policy.trafficClasses());
    }

    /**
     * CBWFQ parameters for the given classes against a budget, without validation.
     */
    protected List<QueueConfiguration> calculateStandardClasses(int bandwidthLimit, List<TrafficClass> classes) {
        int maxPriority = classes.stream().mapToInt(TrafficClass::priority).max().orElse(0);
        int maxMinBandwidth = classes.stream().mapToInt(TrafficClass::minBandwidth).max().orElse(0);

        List<QueueConfiguration> configurations = new ArrayList<>();
        for (TrafficClass tc : byDecreasingPriority(classes)) {
            int minBandwidth = tc.minBandwidth();
            double bandwidthPercent = bandwidthLimit > 0 ? (double) minBandwidth / bandwidthLimit * 100.0 : 0.0;
            int queueLimit = queueLimit(minBandwidth);

            QueueParameters queueParameters = new QueueParameters(
                    bufferSize(minBandwidth, tc.burst()),
                    queueLimit,
                    minBandwidth,
                    weight(tc, maxPriority, maxMinBandwidth),
                    tc.priority(),
                    bandwidthPercent
            );

            CongestionParameters congestion = tc.hasDefaultDscp()
                    ? CongestionParameters.tailDrop()
                    : CongestionParameters.wred(queueLimit / 4, queueLimit * 3 / 4,
                    WRED_DROP_PROBABILITY, Map.of(tc.dscp(), 1.0));

            configurations.add(new QueueConfiguration(tc, queueParameters, congestion));
        }
        return configurations;
    }

    /**
     * Weight in [1,100]. When no class has a positive priority (or guarantee) the
     * corresponding factor is 1.
     */
    static double weight(TrafficClass tc, int maxPriority, int maxMinBandwidth) {
        double priorityFactor = maxPriority > 0 ? (double) tc.priority() / maxPriority : 1.0;
        double bandwidthFactor = maxMinBandwidth > 0 ? (double) tc.minBandwidth() / maxMinBandwidth : 1.0;
        double weight = (priorityFactor * 0.7 + bandwidthFactor * 0.3) * 100.0;
        return Math.max(1.0, Math.min(100.0, weight));
    }

    static int bufferSize(int bandwidthKbps, int burstKb) {
        if (burstKb > 0) {
            return (int) Math.ceil(burstKb / 1.5);
        }
        return Math.max(16, (int) Math.ceil(bandwidthKbps * 0.1 / 12));
    }

    static int queueLimit(int bandwidthKbps) {
        return Math.max(64, Math.min(4096, bandwidthKbps / 8));
    }

    static List<TrafficClass> byDecreasingPriority(List<TrafficClass> classes) {
        return classes.stream()
                .sorted(Comparator.comparingInt(TrafficClass::priority).reversed())
                .toList();
    }
}
