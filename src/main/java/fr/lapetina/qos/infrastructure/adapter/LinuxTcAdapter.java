package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.domain.model.CongestionParameters;
import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.DscpCodes;
import fr.lapetina.qos.domain.model.PortRange;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;
import fr.lapetina.qos.domain.model.TrafficClassifier;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Linux traffic control rendering.
 *
 * <p>Egress builds an HTB tree: root {@code 1:}, parent class {@code 1:1} at the policy
 * rate, one class per traffic class from {@code 1:10} upwards and a default class
 * {@code 1:30}. Leaves are {@code red} for RED/WRED, {@code fq_codel} for ECN and
 * {@code sfq} otherwise. A single-class FQ-CoDel policy becomes a root {@code fq_codel}.
 *
 * <p>Ingress cannot be shaped, so each class is policed at its maximum (or guaranteed)
 * rate under the {@code ffff:} ingress qdisc.
 *
 * <p>Filters are {@code u32}: one filter per classifier ANDing its criteria at priority
 * {@code base}, plus a DSCP filter at {@code base + 1}; {@code base} starts at 1 and grows
 * by 10 per class. Port ranges are split into aligned value/mask blocks. VLAN criteria
 * cannot be expressed by {@code u32 match ip} and are ignored.
 */
public final class LinuxTcAdapter implements VendorAdapter {

    static final int FIRST_CLASS_ID = 10;
    static final int DEFAULT_CLASS_ID = 30;
    static final int MAX_CLASSES = DEFAULT_CLASS_ID - FIRST_CLASS_ID;
    static final int DEFAULT_RATE_KBPS = 1000;
    static final int AVERAGE_PACKET_BYTES = 1000;
    static final int DEFAULT_POLICE_BURST_KB = 10;

    @Override
    public DeviceVendor getVendor() {
        return DeviceVendor.LINUX_TC;
    }

    @Override
    public List<String> generate(QosCommandRequest request) {
        if (request.configurations().size() > MAX_CLASSES) {
            throw new ValidationException("Linux tc layout supports at most " + MAX_CLASSES
                    + " classes, got " + request.configurations().size());
        }
        if (request.direction() == Direction.INGRESS) {
            return generateIngressPolicing(request);
        }
        if (request.algorithm() == QueueAlgorithmType.FQ_CODEL && request.configurations().size() == 1) {
            return generateRootFqCodel(request.interfaceName(), request.configurations().get(0));
        }
        return generateHtb(request);
    }

    @Override
    public List<String> generateRemoval(String interfaceName, String policyName, Direction direction,
                                        List<TrafficClass> trafficClasses) {
        return List.of(
                "tc qdisc del dev " + interfaceName + " root 2>/dev/null || true",
                "tc qdisc del dev " + interfaceName + " ingress 2>/dev/null || true"
        );
    }

    private List<String> generateHtb(QosCommandRequest request) {
        String dev = request.interfaceName();
        int total = request.bandwidthLimit();

        List<String> commands = new ArrayList<>();
        commands.add("tc qdisc del dev " + dev + " root 2>/dev/null || true");
        commands.add("tc qdisc add dev " + dev + " root handle 1: htb default " + DEFAULT_CLASS_ID);
        commands.add("tc class add dev " + dev + " parent 1: classid 1:1 htb rate " + total + "kbit");

        int classId = FIRST_CLASS_ID;
        int filterPriority = 1;
        for (QueueConfiguration qc : request.configurations()) {
            QueueParameters qp = qc.queueParameters();
            int rate = qp.serviceRate() > 0 ? qp.serviceRate() : DEFAULT_RATE_KBPS;
            int ceil = Math.min(rate * 2, Math.max(total, rate));
            // HTB prio 0 is served first
            int htbPriority = TrafficClass.MAX_PRIORITY - qp.priorityLevel();

            commands.add("tc class add dev " + dev + " parent 1:1 classid 1:" + classId
                    + " htb rate " + rate + "kbit ceil " + ceil + "kbit prio " + htbPriority);
            commands.add("tc qdisc add dev " + dev + " parent 1:" + classId + " handle " + classId + ": "
                    + leafQdisc(qc));
            appendFilters(commands, dev, "1:", qc.trafficClass(), filterPriority, "flowid 1:" + classId);

            classId++;
            filterPriority += 10;
        }

        commands.add("tc class add dev " + dev + " parent 1:1 classid 1:" + DEFAULT_CLASS_ID
                + " htb rate " + Math.min(DEFAULT_RATE_KBPS, total) + "kbit ceil " + total + "kbit prio 7");
        commands.add("tc qdisc add dev " + dev + " parent 1:" + DEFAULT_CLASS_ID + " handle "
                + DEFAULT_CLASS_ID + ": sfq perturb 10");
        return commands;
    }

    private List<String> generateRootFqCodel(String dev, QueueConfiguration qc) {
        return List.of(
                "tc qdisc del dev " + dev + " root 2>/dev/null || true",
                "tc qdisc add dev " + dev + " root " + fqCodel(qc.queueParameters(), qc.congestionParameters())
        );
    }

    private List<String> generateIngressPolicing(QosCommandRequest request) {
        String dev = request.interfaceName();
        List<String> commands = new ArrayList<>();
        commands.add("tc qdisc del dev " + dev + " ingress 2>/dev/null || true");
        commands.add("tc qdisc add dev " + dev + " handle ffff: ingress");

        int filterPriority = 1;
        for (QueueConfiguration qc : request.configurations()) {
            TrafficClass tc = qc.trafficClass();
            int rate = tc.maxBandwidth() > 0 ? tc.maxBandwidth()
                    : Math.max(qc.queueParameters().serviceRate(), DEFAULT_RATE_KBPS);
            int burst = tc.burst() > 0 ? tc.burst() : DEFAULT_POLICE_BURST_KB;
            String action = "police rate " + rate + "kbit burst " + burst + "k drop flowid :1";
            appendFilters(commands, dev, "ffff:", tc, filterPriority, action);
            filterPriority += 10;
        }
        return commands;
    }

    private static String leafQdisc(QueueConfiguration qc) {
        QueueParameters qp = qc.queueParameters();
        CongestionParameters cp = qc.congestionParameters();
        return switch (cp.algorithm()) {
            // tc red thresholds are in bytes, computed thresholds are in packets
            case RED, WRED -> "red limit " + (qp.queueLimit() * AVERAGE_PACKET_BYTES)
                    + " min " + (cp.minThreshold() * AVERAGE_PACKET_BYTES)
                    + " max " + (cp.maxThreshold() * AVERAGE_PACKET_BYTES)
                    + " avpkt " + AVERAGE_PACKET_BYTES
                    + " burst " + Math.max(qp.bufferSize(), 1)
                    + " probability " + cp.dropProbability();
            case ECN -> fqCodel(qp, cp);
            case TAIL_DROP -> "sfq perturb 10";
        };
    }

    private static String fqCodel(QueueParameters qp, CongestionParameters cp) {
        StringBuilder qdisc = new StringBuilder("fq_codel limit ").append(qp.queueLimit());
        if (qp.bufferSize() > 1) {
            qdisc.append(" flows ").append(qp.bufferSize() / 2);
        }
        if (qp.weight() >= 1.0) {
            qdisc.append(" quantum ").append((int) qp.weight());
        }
        return qdisc.append(" target ").append(cp.minThreshold()).append("us")
                .append(" interval ").append(cp.maxThreshold()).append("us ecn")
                .toString();
    }

    private static void appendFilters(List<String> commands, String dev, String parent, TrafficClass tc,
                                      int priority, String action) {
        String prefix = "tc filter add dev " + dev + " parent " + parent + " protocol ip prio ";
        for (TrafficClassifier classifier : tc.classifiers()) {
            for (String matches : classifierMatches(classifier)) {
                commands.add(prefix + priority + " u32 " + matches + " " + action);
            }
        }
        if (!tc.hasDefaultDscp()) {
            OptionalInt tos = DscpCodes.tosByte(tc.dscp());
            if (tos.isPresent()) {
                commands.add(prefix + (priority + 1) + " u32 match ip tos " + hex(tos.getAsInt()) + " 0xfc " + action);
            }
        }
    }

    /**
     * One u32 match expression per combination of source and destination port blocks.
     */
    static List<String> classifierMatches(TrafficClassifier classifier) {
        StringBuilder common = new StringBuilder();
        if (!classifier.protocol().isWildcard()) {
            common.append("match ip protocol ").append(classifier.protocol().getIpProtocolNumber()).append(" 0xff ");
        }
        if (classifier.sourceIp() != null) {
            common.append("match ip src ").append(ipv4Prefix(classifier.sourceIp())).append(' ');
        }
        if (classifier.destinationIp() != null) {
            common.append("match ip dst ").append(ipv4Prefix(classifier.destinationIp())).append(' ');
        }
        if (classifier.dscpMarking() != null) {
            OptionalInt tos = DscpCodes.tosByte(classifier.dscpMarking());
            if (tos.isPresent()) {
                common.append("match ip tos ").append(hex(tos.getAsInt())).append(" 0xfc ");
            }
        }

        List<String> sourceBlocks = portMatches("sport", classifier.sourcePorts());
        List<String> destinationBlocks = portMatches("dport", classifier.destinationPorts());

        List<String> matches = new ArrayList<>();
        for (String source : sourceBlocks) {
            for (String destination : destinationBlocks) {
                String expression = (common + source + destination).trim();
                // u32 needs at least one selector
                matches.add(expression.isEmpty() ? "match u32 0 0" : expression);
            }
        }
        return matches;
    }

    private static List<String> portMatches(String field, PortRange range) {
        if (range.isWildcard()) {
            return List.of("");
        }
        List<String> matches = new ArrayList<>();
        for (int[] block : portBlocks(range.start(), range.end())) {
            matches.add("match ip " + field + " " + block[0] + " " + hex16(block[1]) + " ");
        }
        return matches;
    }

    /**
     * Splits an inclusive port range into aligned {value, mask} blocks.
     */
    static List<int[]> portBlocks(int start, int end) {
        List<int[]> blocks = new ArrayList<>();
        long current = start;
        while (current <= end) {
            long size = current == 0 ? 65536 : Long.lowestOneBit(current);
            while (current + size - 1 > end) {
                size >>= 1;
            }
            blocks.add(new int[]{(int) current, (int) (0xFFFF & ~(size - 1))});
            current += size;
        }
        return blocks;
    }

    private static String ipv4Prefix(String address) {
        if (address.indexOf(':') >= 0) {
            throw new ValidationException("Linux tc u32 filters only match IPv4 addresses: " + address);
        }
        return address.indexOf('/') >= 0 ? address : address + "/32";
    }

    private static String hex(int value) {
        return String.format("0x%02x", value);
    }

    private static String hex16(int value) {
        return String.format("0x%04x", value);
    }
}
