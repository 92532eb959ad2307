package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.domain.model.CongestionParameters;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.Protocol;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.QueueParameters;
import fr.lapetina.qos.domain.model.TrafficClass;
import fr.lapetina.qos.domain.model.TrafficClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinuxTcAdapterTest {

    private final LinuxTcAdapter adapter = new LinuxTcAdapter();

    @Nested
    @DisplayName("egress HTB tree")
    class HtbTests {

        private final List<String> commands = adapter.generate(
                AdapterFixtures.request(QueueAlgorithmType.CBWFQ, Direction.EGRESS, "eth0"));

        @Test
        @DisplayName("should build root, parent and default classes")
        void shouldBuildSkeleton() {
            assertThat(commands).startsWith(
                    "tc qdisc del dev eth0 root 2>/dev/null || true",
                    "tc qdisc add dev eth0 root handle 1: htb default 30",
                    "tc class add dev eth0 parent 1: classid 1:1 htb rate 2000kbit");
            assertThat(commands).endsWith(
                    "tc class add dev eth0 parent 1:1 classid 1:30 htb rate 1000kbit ceil 2000kbit prio 7",
                    "tc qdisc add dev eth0 parent 1:30 handle 30: sfq perturb 10");
        }

        @Test
        @DisplayName("should give each class its rate, ceiling, priority and leaf qdisc")
        void shouldRenderClasses() {
            assertThat(commands).containsSubsequence(
                    "tc class add dev eth0 parent 1:1 classid 1:10 htb rate 500kbit ceil 1000kbit prio 5",
                    "tc qdisc add dev eth0 parent 1:10 handle 10: red limit 64000 min 20000 max 40000 avpkt 1000 burst 64 probability 0.1",
                    "tc class add dev eth0 parent 1:1 classid 1:11 htb rate 400kbit ceil 800kbit prio 0",
                    "tc qdisc add dev eth0 parent 1:11 handle 11: sfq perturb 10");
        }

        @Test
        @DisplayName("should emit u32 filters per classifier and per DSCP")
        void shouldRenderFilters() {
            assertThat(commands).contains(
                    "tc filter add dev eth0 parent 1: protocol ip prio 1 u32 match ip protocol 6 0xff match ip dport 80 0xffff flowid 1:10",
                    "tc filter add dev eth0 parent 1: protocol ip prio 11 u32 match ip protocol 17 0xff match ip dport 16384 0xc000 flowid 1:11",
                    "tc filter add dev eth0 parent 1: protocol ip prio 12 u32 match ip tos 0xb8 0xfc flowid 1:11");
        }
    }

    @Test
    @DisplayName("should police each class on ingress")
    void shouldPoliceIngress() {
        List<String> commands = adapter.generate(
                AdapterFixtures.request(QueueAlgorithmType.CBWFQ, Direction.INGRESS, "eth1"));

        assertThat(commands).startsWith(
                "tc qdisc del dev eth1 ingress 2>/dev/null || true",
                "tc qdisc add dev eth1 handle ffff: ingress");
        assertThat(commands).contains(
                "tc filter add dev eth1 parent ffff: protocol ip prio 1 u32 match ip protocol 6 0xff match ip dport 80 0xffff police rate 1000kbit burst 10k drop flowid :1",
                "tc filter add dev eth1 parent ffff: protocol ip prio 11 u32 match ip protocol 17 0xff match ip dport 16384 0xc000 police rate 500kbit burst 10k drop flowid :1");
        assertThat(commands).noneMatch(c -> c.contains("htb"));
    }

    @Test
    @DisplayName("should use a root fq_codel for a single FQ-CoDel class")
    void shouldRenderRootFqCodel() {
        TrafficClass bulk = TrafficClass.builder().name("bulk").priority(1).build();
        QueueConfiguration qc = new QueueConfiguration(bulk, new QueueParameters(2048, 10000, 0, 1514, 1, 0),
                CongestionParameters.ecn(5000, 100000));
        QosCommandRequest request = new QosCommandRequest("eth0", "bulk", Direction.EGRESS,
                QueueAlgorithmType.FQ_CODEL, 10000, List.of(qc));

        assertThat(adapter.generate(request)).containsExactly(
                "tc qdisc del dev eth0 root 2>/dev/null || true",
                "tc qdisc add dev eth0 root fq_codel limit 10000 flows 1024 quantum 1514 target 5000us interval 100000us ecn");
    }

    @Test
    @DisplayName("should reject more classes than the handle layout allows")
    void shouldRejectTooManyClasses() {
        QosCommandRequest request = new QosCommandRequest("eth0", "big", Direction.EGRESS,
                QueueAlgorithmType.DRR, 1000, AdapterFixtures.manyClasses(21));

        assertThatThrownBy(() -> adapter.generate(request)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should reject IPv6 classifier addresses")
    void shouldRejectIpv6() {
        TrafficClassifier v6 = TrafficClassifier.builder().protocol(Protocol.TCP).sourceIp("2001:db8::/32").build();

        assertThatThrownBy(() -> LinuxTcAdapter.classifierMatches(v6)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should match everything when a classifier has no criteria")
    void shouldMatchAllForWildcardClassifier() {
        assertThat(LinuxTcAdapter.classifierMatches(TrafficClassifier.any())).containsExactly("match u32 0 0");
    }

    @Test
    @DisplayName("should cross source and destination port blocks")
    void shouldCrossPortBlocks() {
        TrafficClassifier classifier = TrafficClassifier.builder()
                .sourceIp("192.168.1.10")
                .sourcePorts(5060, 5061)
                .destinationPorts(1024, 2047)
                .build();

        assertThat(LinuxTcAdapter.classifierMatches(classifier)).containsExactly(
                "match ip src 192.168.1.10/32 match ip sport 5060 0xfffe match ip dport 1024 0xfc00");
    }

    @Test
    @DisplayName("should split port ranges into aligned blocks")
    void shouldSplitPortRanges() {
        assertThat(LinuxTcAdapter.portBlocks(80, 80)).containsExactly(new int[]{80, 0xFFFF});
        assertThat(LinuxTcAdapter.portBlocks(0, 65535)).containsExactly(new int[]{0, 0});
        assertThat(LinuxTcAdapter.portBlocks(1000, 1003)).containsExactly(new int[]{1000, 0xFFFC});
        assertThat(LinuxTcAdapter.portBlocks(1023, 1025)).containsExactly(
                new int[]{1023, 0xFFFF}, new int[]{1024, 0xFFFE});
    }

    @Test
    @DisplayName("should remove both root and ingress qdiscs")
    void shouldGenerateRemoval() {
        assertThat(adapter.generateRemoval("eth0", "p", Direction.EGRESS, List.of())).containsExactly(
                "tc qdisc del dev eth0 root 2>/dev/null || true",
                "tc qdisc del dev eth0 ingress 2>/dev/null || true");
    }
}
