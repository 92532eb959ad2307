package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deep packet inspection on the retained payload prefixes.
 *
 * <p>Matches are counted over every (sample, pattern) pair; confidence is the ratio to the
 * signature's pattern count, capped at 0.9. The best signature wins. The signature
 * confidence threshold is not applied here.
 */
public final class PayloadClassifier implements ApplicationClassifier {

    static final double MAX_PAYLOAD_CONFIDENCE = 0.9;

    @Override
    public ClassificationMethod getMethod() {
        return ClassificationMethod.PAYLOAD;
    }

    @Override
    public Optional<ClassificationResult> classify(TrafficFlow.Snapshot flow, List<ApplicationSignature> signatures) {
        if (flow.payloadSamples().isEmpty()) {
            return Optional.empty();
        }

        ApplicationSignature best = null;
        double bestConfidence = 0.0;
        for (ApplicationSignature signature : signatures) {
            List<Pattern> patterns = signature.payloadPatterns();
            if (patterns.isEmpty()) {
                continue;
            }
            int matches = 0;
            for (String sample : flow.payloadSamples()) {
                for (Pattern pattern : patterns) {
                    if (pattern.matcher(sample).find()) {
                        matches++;
                    }
                }
            }
            if (matches > 0) {
                double confidence = Math.min(MAX_PAYLOAD_CONFIDENCE, (double) matches / patterns.size());
                if (confidence > bestConfidence) {
                    bestConfidence = confidence;
                    best = signature;
                }
            }
        }
        return best == null
                ? Optional.empty()
                : Optional.of(ClassificationResult.of(best, bestConfidence, getMethod()));
    }
}
