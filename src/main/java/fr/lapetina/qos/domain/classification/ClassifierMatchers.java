package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.domain.model.PortRange;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.TrafficClass;
import fr.lapetina.qos.domain.model.TrafficClassifier;

import java.util.Comparator;
import java.util.Optional;

/**
 * Turns classifiers into composite matchers and selects the traffic class of a packet.
 */
public final class ClassifierMatchers {

    private static final ProtocolMatchStrategy PROTOCOL = new ProtocolMatchStrategy();
    private static final IpAddressMatchStrategy SOURCE_IP = new IpAddressMatchStrategy(Endpoint.SOURCE);
    private static final IpAddressMatchStrategy DESTINATION_IP = new IpAddressMatchStrategy(Endpoint.DESTINATION);
    private static final PortMatchStrategy SOURCE_PORT = new PortMatchStrategy(Endpoint.SOURCE);
    private static final PortMatchStrategy DESTINATION_PORT = new PortMatchStrategy(Endpoint.DESTINATION);
    private static final PortRangeMatchStrategy SOURCE_RANGE = new PortRangeMatchStrategy(Endpoint.SOURCE);
    private static final PortRangeMatchStrategy DESTINATION_RANGE = new PortRangeMatchStrategy(Endpoint.DESTINATION);
    private static final DscpMatchStrategy DSCP = new DscpMatchStrategy();
    private static final VlanMatchStrategy VLAN = new VlanMatchStrategy();

    private ClassifierMatchers() {
        // Utility class
    }

    /**
     * Builds the AND-composite for a classifier. Only the criteria actually set are added.
     */
    public static CompositeMatchStrategy fromClassifier(TrafficClassifier classifier) {
        CompositeMatchStrategy.Builder builder = CompositeMatchStrategy.builder();

        if (!classifier.protocol().isWildcard()) {
            builder.add(PROTOCOL, classifier.protocol());
        }
        if (classifier.sourceIp() != null) {
            builder.add(SOURCE_IP, classifier.sourceIp());
        }
        if (classifier.destinationIp() != null) {
            builder.add(DESTINATION_IP, classifier.destinationIp());
        }
        addPorts(builder, classifier.sourcePorts(), SOURCE_PORT, SOURCE_RANGE);
        addPorts(builder, classifier.destinationPorts(), DESTINATION_PORT, DESTINATION_RANGE);
        if (classifier.dscpMarking() != null) {
            builder.add(DSCP, classifier.dscpMarking());
        }
        if (classifier.vlan() != null) {
            builder.add(VLAN, classifier.vlan());
        }
        return builder.build();
    }

    private static void addPorts(CompositeMatchStrategy.Builder builder, PortRange ports,
                                 PortMatchStrategy single, PortRangeMatchStrategy range) {
        if (ports == null || ports.isWildcard()) {
            return;
        }
        if (ports.isSinglePort()) {
            builder.add(single, ports.start());
        } else {
            builder.add(range, ports);
        }
    }

    /**
     * A class matches when any of its classifiers matches. A class without classifiers
     * matches nothing, so it never captures traffic by accident.
     */
    public static boolean matchesClass(TrafficClass trafficClass, Packet packet) {
        return trafficClass.classifiers().stream()
                .anyMatch(classifier -> fromClassifier(classifier).matches(packet));
    }

    /**
     * Returns the highest-priority class of the policy matching the packet.
     * Ties keep the declaration order.
     */
    public static Optional<TrafficClass> selectClass(QosPolicy policy, Packet packet) {
        return policy.trafficClasses().stream()
                .sorted(Comparator.comparingInt(TrafficClass::priority).reversed())
                .filter(trafficClass -> matchesClass(trafficClass, packet))
                .findFirst();
    }
}
