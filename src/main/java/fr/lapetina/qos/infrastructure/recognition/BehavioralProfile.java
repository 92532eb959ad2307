package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;

/**
 * Expected flow behaviour of an application.
 *
 * <p>Every descriptor that is set counts towards the total used to compute the match
 * score. Descriptors no heuristic verifies (packet interval, free-form traits such as
 * "sustained_connection") still count, which caps the achievable score.
 */
public record BehavioralProfile(
        Integer minPacketSize,
        Integer maxPacketSize,
        Integer packetIntervalMs,
        boolean constantBitrate,
        boolean bidirectional,
        boolean lowLatencyRequired,
        List<String> traits
) {
    public static final BehavioralProfile NONE =
            new BehavioralProfile(null, null, null, false, false, false, List.of());

    public BehavioralProfile {
        traits = traits != null ? List.copyOf(traits) : List.of();
    }

    public boolean hasPacketSizeRange() {
        return minPacketSize != null && maxPacketSize != null;
    }

    public int descriptorCount() {
        int count = traits.size();
        if (hasPacketSizeRange()) {
            count++;
        }
        if (packetIntervalMs != null) {
            count++;
        }
        if (constantBitrate) {
            count++;
        }
        if (bidirectional) {
            count++;
        }
        if (lowLatencyRequired) {
            count++;
        }
        return count;
    }

    public boolean isEmpty() {
        return descriptorCount() == 0;
    }
}
