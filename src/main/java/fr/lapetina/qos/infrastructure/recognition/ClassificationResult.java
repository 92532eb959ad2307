package fr.lapetina.qos.infrastructure.recognition;

/**
 * Raw guess of one recognition method.
 */
public record ClassificationResult(
        String application,
        String category,
        double confidence,
        ClassificationMethod method
) {
    static ClassificationResult of(ApplicationSignature signature, double confidence, ClassificationMethod method) {
        return new ClassificationResult(signature.name(), signature.category(), confidence, method);
    }
}
