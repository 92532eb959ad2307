package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;
import java.util.Map;

/**
 * Fused recognition outcome for a flow.
 *
 * @param confidence   aggregate weighted confidence, capped at 1.0
 * @param methodsUsed  methods that contributed to the winning application
 * @param candidates   aggregate score of every candidate, in first-seen order
 * @param method       "fusion", or "error" when classification failed
 */
public record ApplicationClassification(
        String application,
        String category,
        double confidence,
        List<ClassificationMethod> methodsUsed,
        Map<String, Double> candidates,
        String method,
        String details
) {
    public static final String UNKNOWN_APPLICATION = "unknown";
    public static final String UNCLASSIFIED = "unclassified";

    public ApplicationClassification {
        methodsUsed = methodsUsed != null ? List.copyOf(methodsUsed) : List.of();
        candidates = candidates != null ? candidates : Map.of();
    }

    public static ApplicationClassification unknown(String details) {
        return new ApplicationClassification(UNKNOWN_APPLICATION, UNCLASSIFIED, 0.0,
                List.of(), Map.of(), "fusion", details);
    }

    public static ApplicationClassification error(String details) {
        return new ApplicationClassification(UNKNOWN_APPLICATION, UNCLASSIFIED, 0.0,
                List.of(), Map.of(), "error", details);
    }

    public boolean isKnown() {
        return !UNKNOWN_APPLICATION.equals(application);
    }
}
