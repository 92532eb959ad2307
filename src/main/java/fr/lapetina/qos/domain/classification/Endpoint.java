package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;

/**
 * Side of the flow an address or port criterion applies to.
 */
public enum Endpoint {
    SOURCE("source"),
    DESTINATION("destination");

    private final String prefix;

    Endpoint(String prefix) {
        this.prefix = prefix;
    }

    String prefix() {
        return prefix;
    }

    String ipOf(Packet packet) {
        return this == SOURCE ? packet.sourceIp() : packet.destinationIp();
    }

    int portOf(Packet packet) {
        return this == SOURCE ? packet.sourcePort() : packet.destinationPort();
    }
}
