package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;
import java.util.Optional;

/**
 * First signature whose port set contains the destination or source port, at flat 0.6.
 */
public final class PortClassifier implements ApplicationClassifier {

    static final double PORT_CONFIDENCE = 0.6;

    @Override
    public ClassificationMethod getMethod() {
        return ClassificationMethod.PORT;
    }

    @Override
    public Optional<ClassificationResult> classify(TrafficFlow.Snapshot flow, List<ApplicationSignature> signatures) {
        int destinationPort = flow.key().destinationPort();
        int sourcePort = flow.key().sourcePort();
        for (ApplicationSignature signature : signatures) {
            if (signature.matchesPort(destinationPort) || signature.matchesPort(sourcePort)) {
                return Optional.of(ClassificationResult.of(signature, PORT_CONFIDENCE, getMethod()));
            }
        }
        return Optional.empty();
    }
}
