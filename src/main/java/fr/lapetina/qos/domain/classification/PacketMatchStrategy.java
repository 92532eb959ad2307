package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;

/**
 * Strategy interface for matching a packet against one kind of criterion.
 *
 * Implementations are stateless and must be thread-safe: a single instance is
 * shared by every classifier and every ingestion thread.
 *
 * @param <C> criterion type
 */
public interface PacketMatchStrategy<C> {

    /**
     * Returns the name of this strategy, as registered in {@link MatchStrategyFactory}.
     */
    String getName();

    /**
     * Tests the packet against the criterion. A null, zero or "any" criterion is a
     * wildcard and always matches.
     */
    boolean matches(Packet packet, C criterion);

    /**
     * Binds a criterion, producing a reusable matcher.
     */
    default PacketMatcher bind(C criterion) {
        return packet -> matches(packet, criterion);
    }
}
