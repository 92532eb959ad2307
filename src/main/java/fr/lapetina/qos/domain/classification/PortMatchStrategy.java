package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;

/**
 * Matches a single source or destination port. Port 0 is a wildcard.
 */
public final class PortMatchStrategy implements PacketMatchStrategy<Integer> {

    private final Endpoint endpoint;

    public PortMatchStrategy(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public String getName() {
        return endpoint.prefix() + "-port";
    }

    @Override
    public boolean matches(Packet packet, Integer criterion) {
        if (criterion == null || criterion == 0) {
            return true;
        }
        return endpoint.portOf(packet) == criterion;
    }
}
