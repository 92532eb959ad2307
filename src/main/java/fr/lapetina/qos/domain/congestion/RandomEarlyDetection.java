package fr.lapetina.qos.domain.congestion;

import fr.lapetina.qos.domain.model.CongestionParameters;

/**
 * Random Early Detection drop-probability functions.
 *
 * <p>Pure functions, safe to call concurrently.
 *
 * <pre>
 *   occupancy &lt;= min  -&gt; 0
 *   occupancy &gt;= max  -&gt; 1
 *   otherwise        -&gt; (occupancy - min) / (max - min) * maxProbability
 * </pre>
 *
 * WRED scales the RED probability by {@code (1 - weight)} where the weight in [0,1]
 * reflects how protected a DSCP class is.
 */
public final class RandomEarlyDetection {

    private RandomEarlyDetection() {
        // Utility class
    }

    public static double red(double occupancy, double minThreshold, double maxThreshold, double maxProbability) {
        if (occupancy <= minThreshold) {
            return 0.0;
        }
        if (occupancy >= maxThreshold) {
            return 1.0;
        }
        return (occupancy - minThreshold) / (maxThreshold - minThreshold) * maxProbability;
    }

    public static double wred(double occupancy, double minThreshold, double maxThreshold,
                              double maxProbability, double weight) {
        double clampedWeight = Math.max(0.0, Math.min(1.0, weight));
        double adjusted = red(occupancy, minThreshold, maxThreshold, maxProbability) * (1.0 - clampedWeight);
        return Math.max(0.0, Math.min(1.0, adjusted));
    }

    /**
     * Drop (or ECN mark) probability for a queue at the given occupancy.
     *
     * <ul>
     *   <li>TAIL_DROP: 0 below the max threshold, 1 at or above it when a threshold is set</li>
     *   <li>RED and ECN: plain RED on the configured thresholds</li>
     *   <li>WRED: RED weighted by the DSCP weight, plain RED when the DSCP has no weight</li>
     * </ul>
     */
    public static double dropProbability(CongestionParameters parameters, double occupancy, String dscp) {
        int min = parameters.minThreshold();
        int max = parameters.maxThreshold();
        return switch (parameters.algorithm()) {
            case TAIL_DROP -> max > 0 && occupancy >= max ? 1.0 : 0.0;
            case RED, ECN -> red(occupancy, min, max, parameters.dropProbability());
            case WRED -> {
                Double weight = dscp != null ? parameters.dscpWeights().get(dscp) : null;
                yield wred(occupancy, min, max, parameters.dropProbability(), weight != null ? weight : 0.0);
            }
        };
    }
}
