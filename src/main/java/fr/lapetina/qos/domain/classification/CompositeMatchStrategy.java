package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;

import java.util.ArrayList;
import java.util.List;

/**
 * AND-composition of bound strategies. An empty composite matches every packet.
 *
 * Instances are immutable once built and safe for concurrent reuse.
 */
public final class CompositeMatchStrategy implements PacketMatcher {

    private final List<PacketMatcher> matchers;

    private CompositeMatchStrategy(List<PacketMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public static CompositeMatchStrategy empty() {
        return new CompositeMatchStrategy(List.of());
    }

    @Override
    public boolean matches(Packet packet) {
        for (PacketMatcher matcher : matchers) {
            if (!matcher.matches(packet)) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return matchers.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for CompositeMatchStrategy.
     */
    public static final class Builder {
        private final List<PacketMatcher> matchers = new ArrayList<>();

        public <C> Builder add(PacketMatchStrategy<C> strategy, C criterion) {
            matchers.add(strategy.bind(criterion));
            return this;
        }

        public Builder add(PacketMatcher matcher) {
            matchers.add(matcher);
            return this;
        }

        public CompositeMatchStrategy build() {
            return new CompositeMatchStrategy(matchers);
        }
    }
}
