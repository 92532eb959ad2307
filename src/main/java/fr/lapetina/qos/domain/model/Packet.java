package fr.lapetina.qos.domain.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * Observed packet metadata used by match strategies and application recognition.
 * The payload, when present, is a prefix of the captured data.
 */
public record Packet(
        String sourceIp,
        String destinationIp,
        int sourcePort,
        int destinationPort,
        Protocol protocol,
        String dscp,
        Integer vlan,
        int size,
        byte[] payload,
        Map<String, String> headers,
        Instant timestamp
) {
    public Packet {
        protocol = protocol != null ? protocol : Protocol.ANY;
        payload = payload != null ? payload : new byte[0];
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Payload decoded as ISO-8859-1 so that every byte maps to one char,
     * which keeps binary signatures such as {@code \xFF\xFF} matchable by regex.
     */
    public String payloadText() {
        return new String(payload, StandardCharsets.ISO_8859_1);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Packet.
     */
    public static final class Builder {
        private String sourceIp;
        private String destinationIp;
        private int sourcePort;
        private int destinationPort;
        private Protocol protocol = Protocol.ANY;
        private String dscp;
        private Integer vlan;
        private int size;
        private byte[] payload;
        private Map<String, String> headers;
        private Instant timestamp;

        public Builder source(String ip, int port) {
            this.sourceIp = ip;
            this.sourcePort = port;
            return this;
        }

        public Builder destination(String ip, int port) {
            this.destinationIp = ip;
            this.destinationPort = port;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder dscp(String dscp) {
            this.dscp = dscp;
            return this;
        }

        public Builder vlan(Integer vlan) {
            this.vlan = vlan;
            return this;
        }

        public Builder size(int size) {
            this.size = size;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder payload(String text) {
            this.payload = text.getBytes(StandardCharsets.ISO_8859_1);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Packet build() {
            int effectiveSize = size > 0 ? size : (payload != null ? payload.length : 0);
            return new Packet(sourceIp, destinationIp, sourcePort, destinationPort, protocol,
                    dscp, vlan, effectiveSize, payload, headers, timestamp);
        }
    }
}
