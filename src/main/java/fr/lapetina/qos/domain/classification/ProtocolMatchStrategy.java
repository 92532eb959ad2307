package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.domain.model.Protocol;

/**
 * Matches on transport protocol. {@link Protocol#ANY} is a wildcard.
 */
public final class ProtocolMatchStrategy implements PacketMatchStrategy<Protocol> {

    @Override
    public String getName() {
        return "protocol";
    }

    @Override
    public boolean matches(Packet packet, Protocol criterion) {
        if (criterion == null || criterion.isWildcard()) {
            return true;
        }
        return packet.protocol() == criterion;
    }
}
