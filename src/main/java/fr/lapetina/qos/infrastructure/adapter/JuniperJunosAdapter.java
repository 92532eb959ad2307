package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.domain.model.CongestionAlgorithm;
import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.DscpCodes;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * JUNOS class-of-service rendering as {@code set} statements committed in one transaction.
 *
 * <p>Each class becomes a forwarding class bound to its own queue and scheduler; the
 * schedulers are grouped in a scheduler-map and DSCP code points are mapped by a
 * classifier. Both are bound to unit 0 of the interface: the scheduler-map shapes egress
 * and the classifier acts on ingress, so the direction does not change the output.
 */
public final class JuniperJunosAdapter implements VendorAdapter {

    static final int MAX_NAME_LENGTH = 32;
    static final int MAX_QUEUES = 8;
    static final Set<String> PREDEFINED_CLASSES = Set.of(
            "best-effort", "expedited-forwarding", "assured-forwarding", "network-control");

    @Override
    public DeviceVendor getVendor() {
        return DeviceVendor.JUNIPER_JUNOS;
    }

    @Override
    public List<String> generate(QosCommandRequest request) {
        List<QueueConfiguration> configurations = request.configurations();
        if (configurations.size() > MAX_QUEUES) {
            throw new ValidationException("JUNOS supports at most " + MAX_QUEUES
                    + " forwarding classes per interface, got " + configurations.size());
        }
        String policy = sanitize(request.policyName());
        String schedulerMap = policy + "-sched-map";
        String classifier = policy + "-classifier";
        Map<String, String> names = forwardingClassNames(request.classNames());

        List<String> commands = new ArrayList<>();
        commands.add("configure");

        for (int queue = 0; queue < configurations.size(); queue++) {
            String className = names.get(configurations.get(queue).className());
            if (!isPredefined(className)) {
                commands.add("set class-of-service forwarding-classes class " + className + " queue-num " + queue);
            }
        }

        if (usesDropProfiles(configurations)) {
            appendDropProfiles(commands, policy);
        }

        for (QueueConfiguration qc : configurations) {
            appendScheduler(commands, policy, policy + "-" + names.get(qc.className()), qc);
        }

        for (QueueConfiguration qc : configurations) {
            String className = names.get(qc.className());
            commands.add("set class-of-service scheduler-maps " + schedulerMap
                    + " forwarding-class " + className + " scheduler " + policy + "-" + className);
        }

        commands.add("set class-of-service classifiers dscp " + classifier + " import default");
        for (QueueConfiguration qc : configurations) {
            TrafficClass tc = qc.trafficClass();
            if (tc.hasDefaultDscp()) {
                continue;
            }
            codePoint(tc.dscp()).ifPresent(codePoint -> commands.add("set class-of-service classifiers dscp "
                    + classifier + " forwarding-class " + names.get(tc.name())
                    + " loss-priority low code-points " + codePoint));
        }

        String iface = request.interfaceName();
        commands.add("set class-of-service interfaces " + iface + " unit 0 scheduler-map " + schedulerMap);
        commands.add("set class-of-service interfaces " + iface + " unit 0 classifiers dscp " + classifier);

        commands.add("commit check");
        commands.add("commit");
        commands.add("exit");
        return commands;
    }

    @Override
    public List<String> generateRemoval(String interfaceName, String policyName, Direction direction,
                                        List<TrafficClass> trafficClasses) {
        String policy = sanitize(policyName);
        Map<String, String> names = forwardingClassNames(
                trafficClasses.stream().map(TrafficClass::name).toList());
        List<String> commands = new ArrayList<>();
        commands.add("configure");
        commands.add("delete class-of-service interfaces " + interfaceName + " unit 0 scheduler-map");
        commands.add("delete class-of-service interfaces " + interfaceName + " unit 0 classifiers");
        commands.add("delete class-of-service scheduler-maps " + policy + "-sched-map");
        commands.add("delete class-of-service classifiers dscp " + policy + "-classifier");
        for (TrafficClass tc : trafficClasses) {
            commands.add("delete class-of-service schedulers " + policy + "-" + names.get(tc.name()));
        }
        commands.add("delete class-of-service drop-profiles " + redProfile(policy));
        commands.add("delete class-of-service drop-profiles " + wredProfile(policy));
        for (TrafficClass tc : trafficClasses) {
            String className = names.get(tc.name());
            if (!isPredefined(className)) {
                commands.add("delete class-of-service forwarding-classes class " + className);
            }
        }
        commands.add("commit and-quit");
        return commands;
    }

    private static void appendScheduler(List<String> commands, String policy, String scheduler,
                                        QueueConfiguration qc) {
        QueueParameters qp = qc.queueParameters();
        String prefix = "set class-of-service schedulers " + scheduler;

        commands.add(prefix + " transmit-rate " + qp.serviceRate() + "k");
        commands.add(prefix + " priority " + priorityKeyword(qp.priorityLevel()));
        if (qp.bufferSize() > 0) {
            commands.add(prefix + " buffer-size temporal " + qp.bufferSize() + "k");
        }

        CongestionAlgorithm algorithm = qc.congestionParameters().algorithm();
        if (algorithm == CongestionAlgorithm.RED) {
            commands.add(prefix + " drop-profile-map loss-priority low protocol any drop-profile " + redProfile(policy));
        } else if (algorithm == CongestionAlgorithm.WRED) {
            commands.add(prefix + " drop-profile-map loss-priority low protocol any drop-profile " + wredProfile(policy));
            commands.add(prefix + " drop-profile-map loss-priority high protocol any drop-profile " + wredProfile(policy));
        }
    }

    private static void appendDropProfiles(List<String> commands, String policy) {
        String red = "set class-of-service drop-profiles " + redProfile(policy) + " interpolate";
        String wred = "set class-of-service drop-profiles " + wredProfile(policy) + " interpolate";
        commands.add(red + " fill-level 50 drop-probability 10");
        commands.add(red + " fill-level 75 drop-probability 50");
        commands.add(red + " fill-level 90 drop-probability 90");
        commands.add(wred + " fill-level 40 drop-probability 5");
        commands.add(wred + " fill-level 60 drop-probability 20");
        commands.add(wred + " fill-level 80 drop-probability 70");
    }

    static String redProfile(String policy) {
        return policy + "-red";
    }

    static String wredProfile(String policy) {
        return policy + "-wred";
    }

    private static boolean isPredefined(String className) {
        return PREDEFINED_CLASSES.contains(className.toLowerCase(Locale.ROOT));
    }

    private static boolean usesDropProfiles(List<QueueConfiguration> configurations) {
        return configurations.stream()
                .map(qc -> qc.congestionParameters().algorithm())
                .anyMatch(a -> a == CongestionAlgorithm.RED || a == CongestionAlgorithm.WRED);
    }

    static String priorityKeyword(int priorityLevel) {
        if (priorityLevel >= 7) {
            return "high";
        }
        return priorityLevel >= 4 ? "medium" : "low";
    }

    /**
     * JUNOS accepts DSCP aliases in lower case, or the 6-bit pattern for numeric values.
     */
    static Optional<String> codePoint(String dscp) {
        if (DscpCodes.isKnownName(dscp)) {
            return Optional.of(dscp.trim().toLowerCase(Locale.ROOT));
        }
        OptionalInt value = DscpCodes.codePoint(dscp);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        String bits = Integer.toBinaryString(value.getAsInt());
        return Optional.of("0".repeat(6 - bits.length()) + bits);
    }

    /**
     * Maps each class name to a distinct JUNOS identifier. Names that collide once sanitized
     * and truncated get a numeric suffix, assigned in name order so that installation and
     * removal agree whatever order the classes arrive in.
     */
    static Map<String, String> forwardingClassNames(Collection<String> classNames) {
        Map<String, String> names = new HashMap<>();
        Set<String> used = new HashSet<>();
        for (String name : new TreeSet<>(classNames)) {
            String base = sanitize(name);
            String candidate = base;
            for (int n = 2; !used.add(candidate); n++) {
                String suffix = "-" + n;
                candidate = base.substring(0, Math.min(base.length(), MAX_NAME_LENGTH - suffix.length())) + suffix;
            }
            names.put(name, candidate);
        }
        return names;
    }

    static String sanitize(String name) {
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-]", "-");
        return sanitized.length() > MAX_NAME_LENGTH ? sanitized.substring(0, MAX_NAME_LENGTH) : sanitized;
    }
}
