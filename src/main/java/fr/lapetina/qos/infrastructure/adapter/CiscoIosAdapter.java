package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.CongestionAlgorithm;
import fr.lapetina.qos.domain.model.CongestionParameters;
import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.PortRange;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;
import fr.lapetina.qos.domain.model.TrafficClassifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cisco IOS MQC rendering: class-maps, a policy-map and the interface service-policy.
 *
 * <p>LLQ configurations put classes of priority level 5 and above under the {@code priority}
 * command with a policer; every other class (and every class of the other algorithms) gets
 * {@code bandwidth}, {@code fair-queue} and {@code queue-limit}, plus {@code random-detect}
 * when RED, WRED or ECN is configured.
 *
 * <p>A class with several classifiers becomes a {@code match-any} class-map over one
 * {@code match-all} child class-map per classifier.
 */
public final class CiscoIosAdapter implements VendorAdapter {

    static final int STRICT_PRIORITY_LEVEL = 5;
    static final double HIGH_DSCP_WEIGHT = 0.5;

    @Override
    public DeviceVendor getVendor() {
        return DeviceVendor.CISCO_IOS;
    }

    @Override
    public List<String> generate(QosCommandRequest request) {
        boolean lowLatency = request.algorithm() == QueueAlgorithmType.LLQ;
        List<QueueConfiguration> configurations = new ArrayList<>(request.configurations());
        if (lowLatency) {
            configurations.sort(Comparator.comparingInt(
                    (QueueConfiguration qc) -> qc.queueParameters().priorityLevel()).reversed());
        }

        List<String> commands = new ArrayList<>();
        commands.add("configure terminal");
        commands.add("class-map match-any default-class");
        commands.add("match any");
        for (QueueConfiguration qc : configurations) {
            appendClassMaps(commands, qc.trafficClass());
        }

        String policyName = sanitize(request.policyName());
        commands.add("policy-map " + policyName);
        for (QueueConfiguration qc : configurations) {
            commands.add("class " + sanitize(qc.className()));
            if (lowLatency && qc.queueParameters().priorityLevel() >= STRICT_PRIORITY_LEVEL) {
                appendPriorityQueue(commands, qc);
            } else {
                appendFairQueue(commands, qc.queueParameters());
                appendCongestionAvoidance(commands, qc.congestionParameters(), lowLatency);
            }
        }
        commands.add("class class-default");
        commands.add("fair-queue");

        commands.add("interface " + request.interfaceName());
        commands.add("service-policy " + request.direction().serviceKeyword() + " " + policyName);
        commands.add("exit");
        commands.add("end");
        return commands;
    }

    @Override
    public List<String> generateRemoval(String interfaceName, String policyName, Direction direction,
                                        List<TrafficClass> trafficClasses) {
        String policy = sanitize(policyName);
        List<String> commands = new ArrayList<>();
        commands.add("configure terminal");
        commands.add("interface " + interfaceName);
        commands.add("no service-policy " + direction.serviceKeyword() + " " + policy);
        commands.add("exit");
        commands.add("no policy-map " + policy);
        for (TrafficClass tc : trafficClasses) {
            List<String> classMaps = classMapNames(tc);
            // parent first, it references the children
            for (int i = classMaps.size() - 1; i >= 0; i--) {
                commands.add("no class-map " + classMaps.get(i));
            }
        }
        commands.add("end");
        return commands;
    }

    /**
     * Standalone RED on the class-default queue of a dedicated policy-map.
     * The drop probability is expressed on the IOS 1..10 scale.
     */
    public List<String> generateRed(String interfaceName, String queueName,
                                    int minThreshold, int maxThreshold, double dropProbability) {
        return List.of(
                "configure terminal",
                "policy-map " + queueName,
                "class class-default",
                "random-detect",
                "random-detect precedence 0 " + minThreshold + " " + maxThreshold + " " + dropScale(dropProbability),
                "exit",
                "exit",
                "interface " + interfaceName,
                "service-policy output " + queueName,
                "end"
        );
    }

    private void appendClassMaps(List<String> commands, TrafficClass tc) {
        String className = sanitize(tc.name());
        List<TrafficClassifier> classifiers = tc.classifiers();

        if (classifiers.size() <= 1) {
            commands.add("class-map match-all " + className);
            appendDscpMatch(commands, tc);
            if (!classifiers.isEmpty()) {
                appendMatches(commands, classifiers.get(0));
            }
            return;
        }

        List<String> children = childClassMapNames(className, classifiers.size());
        for (int i = 0; i < children.size(); i++) {
            commands.add("class-map match-all " + children.get(i));
            appendDscpMatch(commands, tc);
            appendMatches(commands, classifiers.get(i));
        }
        commands.add("class-map match-any " + className);
        for (String child : children) {
            commands.add("match class-map " + child);
        }
    }

    /**
     * Every class-map {@link #generate} declares for the class, children before their parent.
     */
    static List<String> classMapNames(TrafficClass tc) {
        String className = sanitize(tc.name());
        int classifiers = tc.classifiers().size();
        if (classifiers <= 1) {
            return List.of(className);
        }
        List<String> names = new ArrayList<>(childClassMapNames(className, classifiers));
        names.add(className);
        return names;
    }

    private static List<String> childClassMapNames(String className, int count) {
        List<String> children = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            children.add(className + "_" + i);
        }
        return children;
    }

    private static void appendDscpMatch(List<String> commands, TrafficClass tc) {
        if (!tc.hasDefaultDscp()) {
            commands.add("match dscp " + tc.dscp().toLowerCase(Locale.ROOT));
        }
    }

    private static void appendMatches(List<String> commands, TrafficClassifier classifier) {
        if (!classifier.protocol().isWildcard()) {
            commands.add("match protocol " + classifier.protocol().configName());
        }
        PortRange ports = !classifier.destinationPorts().isWildcard()
                ? classifier.destinationPorts()
                : classifier.sourcePorts();
        if (!ports.isWildcard()) {
            commands.add(ports.isSinglePort()
                    ? "match port " + ports.start()
                    : "match port range " + ports.start() + " " + ports.end());
        }
        if (classifier.sourceIp() != null) {
            commands.add("match source-address ip " + classifier.sourceIp());
        }
        if (classifier.destinationIp() != null) {
            commands.add("match destination-address ip " + classifier.destinationIp());
        }
    }

    private static void appendPriorityQueue(List<String> commands, QueueConfiguration qc) {
        int rate = qc.queueParameters().serviceRate();
        int burst = qc.trafficClass().burst();
        commands.add("priority " + rate);
        // police takes bps and bytes
        commands.add(burst > 0
                ? "police " + (rate * 1000L) + " " + (burst * 1000L) + " conform-action transmit exceed-action drop"
                : "police " + (rate * 1000L) + " conform-action transmit exceed-action drop");
    }

    private static void appendFairQueue(List<String> commands, QueueParameters qp) {
        int percent = (int) qp.bandwidthPercent();
        commands.add(percent > 0 ? "bandwidth percent " + percent : "bandwidth " + qp.serviceRate());
        commands.add(qp.weight() > 1.0
                ? "fair-queue " + qp.queueLimit() + " weight " + (int) qp.weight()
                : "fair-queue " + qp.queueLimit());
        commands.add("queue-limit " + qp.queueLimit());
    }

    private static void appendCongestionAvoidance(List<String> commands, CongestionParameters cp,
                                                  boolean scaleByDscpWeight) {
        CongestionAlgorithm algorithm = cp.algorithm();
        int scale = dropScale(cp.dropProbability());
        switch (algorithm) {
            case RED -> {
                commands.add("random-detect");
                commands.add("random-detect precedence 0 " + cp.minThreshold() + " " + cp.maxThreshold() + " " + scale);
            }
            case WRED -> {
                commands.add("random-detect dscp-based");
                if (cp.dscpWeights().isEmpty()) {
                    commands.add("random-detect dscp-based " + cp.minThreshold() + " " + cp.maxThreshold() + " 10");
                    return;
                }
                Map<String, Double> weights = new TreeMap<>(cp.dscpWeights());
                for (Map.Entry<String, Double> entry : weights.entrySet()) {
                    int min = cp.minThreshold();
                    int max = cp.maxThreshold();
                    double weight = entry.getValue();
                    // Protected DSCPs start dropping later under low latency queuing
                    if (scaleByDscpWeight && weight > HIGH_DSCP_WEIGHT) {
                        min = (int) (min * (1 + weight));
                        max = (int) (max * (1 + weight));
                    }
                    commands.add("random-detect dscp " + entry.getKey().toLowerCase(Locale.ROOT)
                            + " " + min + " " + max + " " + scale);
                }
            }
            case ECN -> {
                commands.add("random-detect");
                commands.add("random-detect ecn");
            }
            case TAIL_DROP -> {
                // queue-limit already bounds the queue
            }
        }
    }

    static int dropScale(double dropProbability) {
        return Math.max(1, Math.min(10, (int) (dropProbability * 10)));
    }

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_-]", "_");
    }
}
