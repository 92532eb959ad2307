package fr.lapetina.qos.infrastructure.sdn;

/**
 * Switch port queue backing one traffic class. Rates are bps.
 *
 * @param dscp DSCP code point of the class, 0 when the class keeps the default marking
 */
public record SdnQueue(int queueId, String name, long minRateBps, long maxRateBps, int priority, int dscp) {

    public SdnQueue {
        if (queueId < 1) {
            throw new IllegalArgumentException("Queue id must be positive: " + queueId);
        }
        if (maxRateBps < minRateBps) {
            throw new IllegalArgumentException("Queue " + name + ": max rate below min rate");
        }
    }
}
