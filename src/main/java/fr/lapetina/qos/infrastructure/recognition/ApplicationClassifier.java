package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;
import java.util.Optional;

/**
 * One recognition method applied to a flow snapshot.
 *
 * Implementations are stateless and thread-safe.
 */
public interface ApplicationClassifier {

    ClassificationMethod getMethod();

    /**
     * Returns this method's best guess, or empty when nothing matched.
     */
    Optional<ClassificationResult> classify(TrafficFlow.Snapshot flow, List<ApplicationSignature> signatures);
}
