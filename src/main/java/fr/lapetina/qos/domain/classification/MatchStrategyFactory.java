package fr.lapetina.qos.domain.classification;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of packet match strategies by name.
 */
public final class MatchStrategyFactory {

    private static final Map<String, Supplier<PacketMatchStrategy<?>>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("protocol", ProtocolMatchStrategy::new);
        register("source-ip", () -> new IpAddressMatchStrategy(Endpoint.SOURCE));
        register("destination-ip", () -> new IpAddressMatchStrategy(Endpoint.DESTINATION));
        register("source-port", () -> new PortMatchStrategy(Endpoint.SOURCE));
        register("destination-port", () -> new PortMatchStrategy(Endpoint.DESTINATION));
        register("source-port-range", () -> new PortRangeMatchStrategy(Endpoint.SOURCE));
        register("destination-port-range", () -> new PortRangeMatchStrategy(Endpoint.DESTINATION));
        register("dscp", DscpMatchStrategy::new);
        register("vlan", VlanMatchStrategy::new);
    }

    private MatchStrategyFactory() {
        // Utility class
    }

    public static void register(String name, Supplier<PacketMatchStrategy<?>> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if the name is unknown
     */
    public static Optional<PacketMatchStrategy<?>> create(String name) {
        Supplier<PacketMatchStrategy<?>> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
