package fr.lapetina.qos.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * Congestion avoidance settings for a queue.
 * For ECN (FQ-CoDel) the thresholds hold the target delay and interval in microseconds.
 */
public record CongestionParameters(
        CongestionAlgorithm algorithm,
        int minThreshold,
        int maxThreshold,
        double dropProbability,
        Map<String, Double> dscpWeights
) {
    public CongestionParameters {
        Objects.requireNonNull(algorithm, "Congestion algorithm is required");
        if (dropProbability < 0.0 || dropProbability > 1.0) {
            throw new IllegalArgumentException("Drop probability must be in [0,1]: " + dropProbability);
        }
        dscpWeights = dscpWeights != null ? Map.copyOf(dscpWeights) : Map.of();
    }

    public static CongestionParameters tailDrop() {
        return new CongestionParameters(CongestionAlgorithm.TAIL_DROP, 0, 0, 0.0, null);
    }

    public static CongestionParameters red(int minThreshold, int maxThreshold, double dropProbability) {
        return new CongestionParameters(CongestionAlgorithm.RED, minThreshold, maxThreshold, dropProbability, null);
    }

    public static CongestionParameters wred(int minThreshold, int maxThreshold, double dropProbability,
                                            Map<String, Double> dscpWeights) {
        return new CongestionParameters(CongestionAlgorithm.WRED, minThreshold, maxThreshold,
                dropProbability, dscpWeights);
    }

    public static CongestionParameters ecn(int targetMicros, int intervalMicros) {
        return new CongestionParameters(CongestionAlgorithm.ECN, targetMicros, intervalMicros, 0.0, null);
    }
}
