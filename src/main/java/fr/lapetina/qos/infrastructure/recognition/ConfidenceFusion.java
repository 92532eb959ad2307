package fr.lapetina.qos.infrastructure.recognition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines per-method results into one ranked guess.
 *
 * <p>Each positive confidence is multiplied by its method weight and summed per application.
 * The highest aggregate wins; ties go to the application seen first. The reported confidence
 * is capped at 1.0.
 */
public final class ConfidenceFusion {

    private ConfidenceFusion() {
        // Utility class
    }

    public static ApplicationClassification fuse(List<ClassificationResult> results) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (ClassificationResult result : results) {
            if (result.confidence() <= 0) {
                continue;
            }
            double weighted = result.confidence() * result.method().getFusionWeight();
            candidates.computeIfAbsent(result.application(), app -> new Candidate(result.category()))
                    .add(weighted, result.method());
        }

        if (candidates.isEmpty()) {
            return ApplicationClassification.unknown("No classification matches found");
        }

        String bestApplication = null;
        Candidate best = null;
        for (Map.Entry<String, Candidate> entry : candidates.entrySet()) {
            // Strict comparison keeps the first-seen candidate on ties
            if (best == null || entry.getValue().score > best.score) {
                bestApplication = entry.getKey();
                best = entry.getValue();
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        candidates.forEach((app, candidate) -> scores.put(app, candidate.score));

        return new ApplicationClassification(
                bestApplication,
                best.category,
                Math.min(1.0, best.score),
                best.methods,
                Collections.unmodifiableMap(scores),
                "fusion",
                null
        );
    }

    private static final class Candidate {
        private final String category;
        private final List<ClassificationMethod> methods = new ArrayList<>();
        private double score;

        Candidate(String category) {
            this.category = category;
        }

        void add(double weighted, ClassificationMethod method) {
            score += weighted;
            methods.add(method);
        }
    }
}
