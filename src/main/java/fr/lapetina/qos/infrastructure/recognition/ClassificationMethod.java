package fr.lapetina.qos.infrastructure.recognition;

/**
 * Recognition methods and their weight in confidence fusion.
 */
public enum ClassificationMethod {
    PAYLOAD("payload_based", 0.4),
    HEADER("header_based", 0.3),
    BEHAVIORAL("behavioral_based", 0.2),
    PORT("port_based", 0.1);

    private final String label;
    private final double fusionWeight;

    ClassificationMethod(String label, double fusionWeight) {
        this.label = label;
        this.fusionWeight = fusionWeight;
    }

    public String getLabel() {
        return label;
    }

    public double getFusionWeight() {
        return fusionWeight;
    }
}
