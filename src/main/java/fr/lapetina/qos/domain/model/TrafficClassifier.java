package fr.lapetina.qos.domain.model;

import java.util.Objects;

/**
 * Match criteria selecting packets into a traffic class.
 * Immutable. Null fields (and {@link Protocol#ANY}) are wildcards.
 *
 * <p>Ports are expressed as optional ranges: a range whose start equals its end
 * selects a single port.
 */
public record TrafficClassifier(
        Protocol protocol,
        String sourceIp,
        String destinationIp,
        PortRange sourcePorts,
        PortRange destinationPorts,
        String dscpMarking,
        Integer vlan
) {
    public TrafficClassifier {
        protocol = protocol != null ? protocol : Protocol.ANY;
        sourcePorts = sourcePorts != null ? sourcePorts : PortRange.ANY;
        destinationPorts = destinationPorts != null ? destinationPorts : PortRange.ANY;
        if (vlan != null && (vlan < 0 || vlan > 4095)) {
            throw new IllegalArgumentException("VLAN id out of range: " + vlan);
        }
    }

    public static TrafficClassifier any() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TrafficClassifier.
     */
    public static final class Builder {
        private Protocol protocol = Protocol.ANY;
        private String sourceIp;
        private String destinationIp;
        private PortRange sourcePorts;
        private PortRange destinationPorts;
        private String dscpMarking;
        private Integer vlan;

        public Builder protocol(Protocol protocol) {
            this.protocol = Objects.requireNonNull(protocol);
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder destinationIp(String destinationIp) {
            this.destinationIp = destinationIp;
            return this;
        }

        public Builder sourcePort(int port) {
            this.sourcePorts = PortRange.single(port);
            return this;
        }

        public Builder sourcePorts(int start, int end) {
            this.sourcePorts = new PortRange(start, end);
            return this;
        }

        public Builder destinationPort(int port) {
            this.destinationPorts = PortRange.single(port);
            return this;
        }

        public Builder destinationPorts(int start, int end) {
            this.destinationPorts = new PortRange(start, end);
            return this;
        }

        public Builder dscpMarking(String dscpMarking) {
            this.dscpMarking = dscpMarking;
            return this;
        }

        public Builder vlan(Integer vlan) {
            this.vlan = vlan;
            return this;
        }

        public TrafficClassifier build() {
            return new TrafficClassifier(protocol, sourceIp, destinationIp,
                    sourcePorts, destinationPorts, dscpMarking, vlan);
        }
    }
}
