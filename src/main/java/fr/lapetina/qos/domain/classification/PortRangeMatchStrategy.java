package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.domain.model.PortRange;

/**
 * Matches an inclusive source or destination port range. {@code 0-0} is a wildcard.
 */
public final class PortRangeMatchStrategy implements PacketMatchStrategy<PortRange> {

    private final Endpoint endpoint;

    public PortRangeMatchStrategy(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public String getName() {
        return endpoint.prefix() + "-port-range";
    }

    @Override
    public boolean matches(Packet packet, PortRange criterion) {
        if (criterion == null) {
            return true;
        }
        return criterion.contains(endpoint.portOf(packet));
    }
}
