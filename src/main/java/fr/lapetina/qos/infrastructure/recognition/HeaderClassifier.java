package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches recorded protocol headers against each signature's header patterns.
 * The first signature whose match ratio reaches its confidence threshold is accepted.
 */
public final class HeaderClassifier implements ApplicationClassifier {

    @Override
    public ClassificationMethod getMethod() {
        return ClassificationMethod.HEADER;
    }

    @Override
    public Optional<ClassificationResult> classify(TrafficFlow.Snapshot flow, List<ApplicationSignature> signatures) {
        if (flow.headers().isEmpty()) {
            return Optional.empty();
        }
        for (ApplicationSignature signature : signatures) {
            Map<String, Pattern> expected = signature.headerPatterns();
            if (expected.isEmpty()) {
                continue;
            }
            int matches = 0;
            for (Map.Entry<String, Pattern> header : expected.entrySet()) {
                String value = headerValue(flow.headers(), header.getKey());
                if (header.getValue().matcher(value).find()) {
                    matches++;
                }
            }
            double confidence = (double) matches / expected.size();
            if (confidence > 0 && confidence >= signature.confidenceThreshold()) {
                return Optional.of(ClassificationResult.of(signature, confidence, getMethod()));
            }
        }
        return Optional.empty();
    }

    // Header names are case-insensitive on the wire
    private static String headerValue(Map<String, String> headers, String name) {
        String exact = headers.get(name);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return "";
    }
}
