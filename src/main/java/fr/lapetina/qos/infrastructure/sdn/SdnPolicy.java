package fr.lapetina.qos.infrastructure.sdn;

import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.domain.model.DscpCodes;
import fr.lapetina.qos.domain.model.PortRange;
import fr.lapetina.qos.domain.model.Protocol;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.TrafficClass;
import fr.lapetina.qos.domain.model.TrafficClassifier;
import fr.lapetina.qos.infrastructure.sdn.OpenFlowRule.Action;
import fr.lapetina.qos.infrastructure.sdn.OpenFlowRule.MatchField;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A QoS policy expressed as OpenFlow primitives, ready to be installed on any switch.
 *
 * <p>Class {@code i} (1-based, in policy order) owns queue {@code i}; it also owns meter
 * {@code i} when it has a maximum bandwidth. Each classifier yields one rule per
 * protocol/port combination it needs: OpenFlow matches exact ports only, so a range becomes
 * one rule per port, and a port criterion without protocol yields a TCP and a UDP rule.
 * A class without classifiers is matched on its DSCP marking alone, or not at all when it
 * keeps the default marking.
 */
public record SdnPolicy(
        String policyId,
        String name,
        List<OpenFlowRule> flows,
        List<SdnQueue> queues,
        List<SdnMeter> meters
) {
    static final int MAX_EXPANDED_PORTS = 16;
    static final String IPV4_ETH_TYPE = "0x800";
    static final String NORMAL_PORT = "NORMAL";

    public SdnPolicy {
        Objects.requireNonNull(policyId, "Policy id is required");
        flows = flows != null ? List.copyOf(flows) : List.of();
        queues = queues != null ? List.copyOf(queues) : List.of();
        meters = meters != null ? List.copyOf(meters) : List.of();
    }

    /**
     * @throws ValidationException if a classifier cannot be expressed as OpenFlow matches
     */
    public static SdnPolicy from(QosPolicy policy) {
        List<OpenFlowRule> flows = new ArrayList<>();
        List<SdnQueue> queues = new ArrayList<>();
        List<SdnMeter> meters = new ArrayList<>();

        List<TrafficClass> classes = policy.trafficClasses();
        for (int i = 0; i < classes.size(); i++) {
            TrafficClass tc = classes.get(i);
            int id = i + 1;
            long maxKbps = tc.maxBandwidth() > 0 ? tc.maxBandwidth() : policy.bandwidthLimit();
            int dscp = tc.hasDefaultDscp() ? 0 : DscpCodes.codePoint(tc.dscp()).orElse(0);
            queues.add(new SdnQueue(id, tc.name(), tc.minBandwidth() * 1000L,
                    Math.max(maxKbps, tc.minBandwidth()) * 1000L, tc.priority(), dscp));

            List<Action> actions = new ArrayList<>();
            actions.add(Action.queue(id));
            if (tc.maxBandwidth() > 0) {
                meters.add(new SdnMeter(id, tc.maxBandwidth(), tc.burst()));
                actions.add(Action.meter(id));
            }
            actions.add(Action.output(NORMAL_PORT));

            int priority = FlowPriority.forClassPriority(tc.priority()).getValue();
            for (Map<MatchField, String> match : matchesFor(tc)) {
                flows.add(new OpenFlowRule(OpenFlowRule.ANY_SWITCH, 0, priority, match, actions, tc.name(), null));
            }
        }
        return new SdnPolicy(policy.id(), policy.name(), flows, queues, meters);
    }

    static List<Map<MatchField, String>> matchesFor(TrafficClass tc) {
        List<Map<MatchField, String>> matches = new ArrayList<>();
        if (tc.classifiers().isEmpty()) {
            if (!tc.hasDefaultDscp()) {
                Map<MatchField, String> match = ipv4Match();
                putDscp(match, tc.dscp());
                matches.add(match);
            }
            return matches;
        }
        for (TrafficClassifier classifier : tc.classifiers()) {
            Map<MatchField, String> base = ipv4Match();
            if (classifier.vlan() != null) {
                base.put(MatchField.VLAN_VID, classifier.vlan().toString());
            }
            if (classifier.sourceIp() != null) {
                base.put(MatchField.IPV4_SRC, ipv4Prefix(classifier.sourceIp()));
            }
            if (classifier.destinationIp() != null) {
                base.put(MatchField.IPV4_DST, ipv4Prefix(classifier.destinationIp()));
            }
            putDscp(base, classifier.dscpMarking() != null ? classifier.dscpMarking()
                    : tc.hasDefaultDscp() ? null : tc.dscp());
            matches.addAll(expandPorts(base, classifier));
        }
        return matches;
    }

    private static List<Map<MatchField, String>> expandPorts(Map<MatchField, String> base,
                                                            TrafficClassifier classifier) {
        boolean hasPorts = !classifier.sourcePorts().isWildcard() || !classifier.destinationPorts().isWildcard();
        List<Protocol> protocols;
        if (classifier.protocol().isWildcard()) {
            protocols = hasPorts ? List.of(Protocol.TCP, Protocol.UDP) : List.of();
        } else {
            protocols = List.of(classifier.protocol());
        }
        if (protocols.isEmpty()) {
            return List.of(base);
        }

        List<Map<MatchField, String>> result = new ArrayList<>();
        for (Protocol protocol : protocols) {
            Map<MatchField, String> withProtocol = new EnumMap<>(base);
            withProtocol.put(MatchField.IP_PROTO, Integer.toString(protocol.getIpProtocolNumber()));
            boolean transport = protocol == Protocol.TCP || protocol == Protocol.UDP;
            if (!transport || !hasPorts) {
                if (hasPorts) {
                    throw new ValidationException("Port criteria need TCP or UDP, got " + protocol);
                }
                result.add(withProtocol);
                continue;
            }
            MatchField srcField = protocol == Protocol.TCP ? MatchField.TCP_SRC : MatchField.UDP_SRC;
            MatchField dstField = protocol == Protocol.TCP ? MatchField.TCP_DST : MatchField.UDP_DST;
            for (String src : exactPorts(classifier.sourcePorts())) {
                for (String dst : exactPorts(classifier.destinationPorts())) {
                    Map<MatchField, String> match = new EnumMap<>(withProtocol);
                    if (src != null) {
                        match.put(srcField, src);
                    }
                    if (dst != null) {
                        match.put(dstField, dst);
                    }
                    result.add(match);
                }
            }
        }
        return result;
    }

    /**
     * One entry per port of the range, a single null entry for a wildcard.
     */
    private static List<String> exactPorts(PortRange range) {
        List<String> ports = new ArrayList<>();
        if (range.isWildcard()) {
            ports.add(null);
            return ports;
        }
        if (range.end() - range.start() + 1 > MAX_EXPANDED_PORTS) {
            throw new ValidationException("Port range " + range.start() + "-" + range.end()
                    + " is wider than " + MAX_EXPANDED_PORTS + " ports and cannot be matched exactly");
        }
        for (int port = range.start(); port <= range.end(); port++) {
            ports.add(Integer.toString(port));
        }
        return ports;
    }

    private static Map<MatchField, String> ipv4Match() {
        Map<MatchField, String> match = new EnumMap<>(MatchField.class);
        match.put(MatchField.ETH_TYPE, IPV4_ETH_TYPE);
        return match;
    }

    private static void putDscp(Map<MatchField, String> match, String dscp) {
        if (dscp == null) {
            return;
        }
        OptionalInt value = DscpCodes.codePoint(dscp);
        if (value.isEmpty()) {
            throw new ValidationException("Unknown DSCP marking: " + dscp);
        }
        match.put(MatchField.IP_DSCP, Integer.toString(value.getAsInt()));
    }

    private static String ipv4Prefix(String address) {
        if (address.indexOf(':') >= 0) {
            throw new ValidationException("OpenFlow rules are built for IPv4 only: " + address);
        }
        return address.indexOf('/') >= 0 ? address : address + "/32";
    }
}
