package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;
import java.util.Optional;

/**
 * Compares derived flow statistics with each signature's behavioral profile.
 *
 * <p>Scoring per descriptor: packet size range within bounds +1, constant bitrate with
 * traffic +0.5, bidirectional +1, low latency with more than 10 packets/s +1. The score is
 * divided by the number of descriptors, and the best score must reach the signature's
 * confidence threshold.
 */
public final class BehavioralClassifier implements ApplicationClassifier {

    static final double LOW_LATENCY_MIN_PPS = 10.0;

    @Override
    public ClassificationMethod getMethod() {
        return ClassificationMethod.BEHAVIORAL;
    }

    @Override
    public Optional<ClassificationResult> classify(TrafficFlow.Snapshot flow, List<ApplicationSignature> signatures) {
        ApplicationSignature best = null;
        double bestScore = 0.0;
        for (ApplicationSignature signature : signatures) {
            BehavioralProfile profile = signature.behavior();
            if (profile.isEmpty()) {
                continue;
            }
            double score = score(flow, profile);
            if (score > bestScore) {
                bestScore = score;
                best = signature;
            }
        }
        if (best != null && bestScore >= best.confidenceThreshold()) {
            return Optional.of(ClassificationResult.of(best, bestScore, getMethod()));
        }
        return Optional.empty();
    }

    static double score(TrafficFlow.Snapshot flow, BehavioralProfile profile) {
        double matches = 0.0;
        if (profile.hasPacketSizeRange()) {
            double average = flow.averagePacketSize();
            if (average >= profile.minPacketSize() && average <= profile.maxPacketSize()) {
                matches += 1.0;
            }
        }
        if (profile.constantBitrate() && flow.bytesPerSecond() > 0) {
            matches += 0.5;
        }
        if (profile.bidirectional() && flow.bidirectional()) {
            matches += 1.0;
        }
        if (profile.lowLatencyRequired() && flow.packetsPerSecond() > LOW_LATENCY_MIN_PPS) {
            matches += 1.0;
        }
        return matches / Math.max(profile.descriptorCount(), 1);
    }
}
