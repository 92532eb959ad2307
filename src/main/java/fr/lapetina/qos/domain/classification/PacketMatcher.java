package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;

/**
 * A strategy already bound to its criterion.
 */
@FunctionalInterface
public interface PacketMatcher {

    boolean matches(Packet packet);
}
