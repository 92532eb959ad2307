package fr.lapetina.qos.infrastructure.recognition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML representation of the signature catalogue. Populated by SnakeYAML.
 */
public class SignatureCatalog {

    private List<SignatureDefinition> signatures = new ArrayList<>();

    public List<SignatureDefinition> getSignatures() { return signatures; }
    public void setSignatures(List<SignatureDefinition> signatures) { this.signatures = signatures; }

    /**
     * One application signature.
     */
    public static class SignatureDefinition {
        private String name;
        private String category;
        private List<String> protocols = new ArrayList<>();
        private List<String> ports = new ArrayList<>();
        private List<String> payloadPatterns = new ArrayList<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private BehaviorDefinition behavior;
        private Double confidenceThreshold;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public List<String> getProtocols() { return protocols; }
        public void setProtocols(List<String> protocols) { this.protocols = protocols; }

        public List<String> getPorts() { return ports; }
        public void setPorts(List<String> ports) { this.ports = ports; }

        public List<String> getPayloadPatterns() { return payloadPatterns; }
        public void setPayloadPatterns(List<String> payloadPatterns) { this.payloadPatterns = payloadPatterns; }

        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }

        public BehaviorDefinition getBehavior() { return behavior; }
        public void setBehavior(BehaviorDefinition behavior) { this.behavior = behavior; }

        public Double getConfidenceThreshold() { return confidenceThreshold; }
        public void setConfidenceThreshold(Double confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; }
    }

    /**
     * Behavioral descriptors of a signature.
     */
    public static class BehaviorDefinition {
        private Integer minPacketSize;
        private Integer maxPacketSize;
        private Integer packetIntervalMs;
        private boolean constantBitrate;
        private boolean bidirectional;
        private boolean lowLatencyRequired;
        private List<String> traits = new ArrayList<>();

        public Integer getMinPacketSize() { return minPacketSize; }
        public void setMinPacketSize(Integer minPacketSize) { this.minPacketSize = minPacketSize; }

        public Integer getMaxPacketSize() { return maxPacketSize; }
        public void setMaxPacketSize(Integer maxPacketSize) { this.maxPacketSize = maxPacketSize; }

        public Integer getPacketIntervalMs() { return packetIntervalMs; }
        public void setPacketIntervalMs(Integer packetIntervalMs) { this.packetIntervalMs = packetIntervalMs; }

        public boolean isConstantBitrate() { return constantBitrate; }
        public void setConstantBitrate(boolean constantBitrate) { this.constantBitrate = constantBitrate; }

        public boolean isBidirectional() { return bidirectional; }
        public void setBidirectional(boolean bidirectional) { this.bidirectional = bidirectional; }

        public boolean isLowLatencyRequired() { return lowLatencyRequired; }
        public void setLowLatencyRequired(boolean lowLatencyRequired) { this.lowLatencyRequired = lowLatencyRequired; }

        public List<String> getTraits() { return traits; }
        public void setTraits(List<String> traits) { this.traits = traits; }
    }
}
