package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.exception.LowLatencyValidationException;
import fr.lapetina.qos.domain.model.CongestionParameters;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Low Latency Queuing: strict-priority queues for classes of priority 5 and above,
 * CBWFQ for the rest against the bandwidth left after the priority reservation.
 *
 * <p>Priority queues are sized for at most 50ms of queueing and never use RED.
 * Their reservation is capped at 33% of the policy budget.
 */
public final class LlqAlgorithm extends CbwfqAlgorithm {

    static final double MAX_PRIORITY_PERCENT = 33.0;

    @Override
    public QueueAlgorithmType getType() {
        return QueueAlgorithmType.LLQ;
    }

    @Override
    public List<QueueConfiguration> calculate(QosPolicy policy) {
        PolicyValidator.validateStructureOrThrow(policy);

        int totalBandwidth = policy.bandwidthLimit();
        List<TrafficClass> priorityClasses = policy.trafficClasses().stream()
                .filter(TrafficClass::isLowLatency)
                .toList();
        List<TrafficClass> standardClasses = policy.trafficClasses().stream()
                .filter(tc -> !tc.isLowLatency())
                .toList();

        int priorityBandwidth = priorityClasses.stream().mapToInt(TrafficClass::minBandwidth).sum();
        double priorityPercent = totalBandwidth > 0 ? (double) priorityBandwidth / totalBandwidth * 100.0 : 0.0;
        if (priorityPercent > MAX_PRIORITY_PERCENT) {
            throw new LowLatencyValidationException(String.format(
                    "Priority classes reserve %.1f%% of the bandwidth (%d of %d kbps), limit is %.0f%%",
                    priorityPercent, priorityBandwidth, totalBandwidth, MAX_PRIORITY_PERCENT));
        }

        int standardBandwidth = totalBandwidth - priorityBandwidth;
        int standardMinBandwidth = standardClasses.stream().mapToInt(TrafficClass::minBandwidth).sum();
        if (standardMinBandwidth > standardBandwidth) {
            throw new LowLatencyValidationException(
                    "Standard class guarantees (" + standardMinBandwidth
                            + " kbps) exceed the bandwidth left after priority reservation ("
                            + standardBandwidth + " kbps)");
        }

        List<QueueConfiguration> configurations = new ArrayList<>();
        for (TrafficClass tc : byDecreasingPriority(priorityClasses)) {
            int minBandwidth = tc.minBandwidth();
            QueueParameters queueParameters = new QueueParameters(
                    priorityBufferSize(minBandwidth, tc.burst()),
                    priorityQueueLimit(minBandwidth),
                    minBandwidth,
                    0.0,
                    tc.priority(),
                    0.0
            );
            configurations.add(new QueueConfiguration(tc, queueParameters, CongestionParameters.tailDrop()));
        }

        configurations.addAll(calculateStandardClasses(standardBandwidth, standardClasses));
        return configurations;
    }

    static int priorityBufferSize(int bandwidthKbps, int burstKb) {
        if (burstKb > 0) {
            return (int) Math.ceil(burstKb / 1.5);
        }
        return Math.max(8, (int) Math.ceil(bandwidthKbps * 0.05 / 12));
    }

    static int priorityQueueLimit(int bandwidthKbps) {
        return Math.max(32, Math.min(1024, bandwidthKbps / 16));
    }
}
