package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
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

class CiscoIosAdapterTest {

    private final CiscoIosAdapter adapter = new CiscoIosAdapter();

    @Nested
    @DisplayName("LLQ layout")
    class LowLatencyTests {

        private final List<String> commands = adapter.generate(
                AdapterFixtures.request(QueueAlgorithmType.LLQ, Direction.EGRESS, "GigabitEthernet0/1"));

        @Test
        @DisplayName("should open with the default class-map and close with end")
        void shouldFrameCommands() {
            assertThat(commands).startsWith("configure terminal", "class-map match-any default-class", "match any");
            assertThat(commands).endsWith("interface GigabitEthernet0/1",
                    "service-policy output voice_policy", "exit", "end");
        }

        @Test
        @DisplayName("should render class-maps with DSCP, protocol and port matches")
        void shouldRenderClassMaps() {
            assertThat(commands).containsSubsequence(
                    "class-map match-all voice",
                    "match dscp ef",
                    "match protocol udp",
                    "match port range 16384 32767");
            assertThat(commands).containsSubsequence(
                    "class-map match-all bulk_data",
                    "match protocol tcp",
                    "match port 80");
        }

        @Test
        @DisplayName("should put high priority classes first under a policed priority queue")
        void shouldRenderPriorityQueue() {
            assertThat(commands).containsSubsequence(
                    "policy-map voice_policy",
                    "class voice",
                    "priority 400",
                    "police 400000 10000 conform-action transmit exceed-action drop",
                    "class bulk_data",
                    "bandwidth percent 50",
                    "fair-queue 64 weight 50",
                    "queue-limit 64",
                    "class class-default",
                    "fair-queue");
        }

        @Test
        @DisplayName("should push WRED thresholds of protected DSCPs up by their weight")
        void shouldScaleWredThresholds() {
            assertThat(commands).containsSubsequence(
                    "random-detect dscp-based",
                    "random-detect dscp af11 32 64 1",
                    "random-detect dscp af12 20 40 1");
        }
    }

    @Nested
    @DisplayName("CBWFQ layout")
    class FairQueueTests {

        private final List<String> commands = adapter.generate(
                AdapterFixtures.request(QueueAlgorithmType.CBWFQ, Direction.INGRESS, "Gi0/2"));

        @Test
        @DisplayName("should give every class a bandwidth guarantee and no priority queue")
        void shouldRenderFairQueues() {
            assertThat(commands).noneMatch(c -> c.startsWith("priority "));
            assertThat(commands).containsSubsequence(
                    "class bulk_data", "bandwidth percent 50",
                    "class voice", "bandwidth 400", "fair-queue 32", "queue-limit 32");
        }

        @Test
        @DisplayName("should keep WRED thresholds unscaled and attach the policy as input")
        void shouldRenderPlainWred() {
            assertThat(commands).contains("random-detect dscp af11 20 40 1", "service-policy input voice_policy");
        }
    }

    @Test
    @DisplayName("should split a multi-classifier class into match-all children")
    void shouldRenderMatchAnyParent() {
        TrafficClass web = TrafficClass.builder()
                .name("web")
                .priority(3)
                .addClassifier(TrafficClassifier.builder().protocol(Protocol.TCP).destinationPort(80).build())
                .addClassifier(TrafficClassifier.builder().protocol(Protocol.TCP).destinationPort(443)
                        .destinationIp("10.0.0.0/8").build())
                .build();
        QosCommandRequest request = new QosCommandRequest("Gi0/3", "web", Direction.EGRESS, QueueAlgorithmType.CBWFQ,
                1000, List.of(new QueueConfiguration(web, new QueueParameters(16, 16, 300, 30, 3, 30), null)));

        List<String> commands = adapter.generate(request);

        assertThat(commands).containsSubsequence(
                "class-map match-all web_1", "match protocol tcp", "match port 80",
                "class-map match-all web_2", "match protocol tcp", "match port 443",
                "match destination-address ip 10.0.0.0/8",
                "class-map match-any web", "match class-map web_1", "match class-map web_2");
    }

    @Test
    @DisplayName("should detach the policy before deleting its definitions")
    void shouldGenerateRemoval() {
        List<String> commands = adapter.generateRemoval("Gi0/1", "voice-policy", Direction.EGRESS,
                List.of(AdapterFixtures.voice().trafficClass(), AdapterFixtures.bulkData().trafficClass()));

        assertThat(commands).containsExactly(
                "configure terminal",
                "interface Gi0/1",
                "no service-policy output voice-policy",
                "exit",
                "no policy-map voice-policy",
                "no class-map voice",
                "no class-map bulk_data",
                "end");
    }

    @Test
    @DisplayName("should delete every class-map a multi-classifier class installed")
    void shouldRemoveChildClassMaps() {
        TrafficClass web = TrafficClass.builder()
                .name("web")
                .priority(3)
                .addClassifier(TrafficClassifier.builder().protocol(Protocol.TCP).destinationPort(80).build())
                .addClassifier(TrafficClassifier.builder().protocol(Protocol.TCP).destinationPort(443).build())
                .build();
        QosCommandRequest request = new QosCommandRequest("Gi0/3", "web", Direction.EGRESS, QueueAlgorithmType.CBWFQ,
                1000, List.of(new QueueConfiguration(web, new QueueParameters(16, 16, 300, 30, 3, 30), null)));

        List<String> installed = adapter.generate(request).stream()
                .filter(command -> command.startsWith("class-map "))
                .map(command -> command.substring(command.lastIndexOf(' ') + 1))
                .filter(name -> !name.equals("default-class"))
                .toList();
        List<String> removed = adapter.generateRemoval("Gi0/3", "web", Direction.EGRESS, List.of(web)).stream()
                .filter(command -> command.startsWith("no class-map "))
                .map(command -> command.substring("no class-map ".length()))
                .toList();

        assertThat(installed).containsExactly("web_1", "web_2", "web");
        assertThat(removed).containsExactly("web", "web_2", "web_1");
    }

    @Test
    @DisplayName("should sanitize the policy-map name on install and removal alike")
    void shouldSanitizePolicyName() {
        List<String> installed = adapter.generate(
                AdapterFixtures.request(QueueAlgorithmType.CBWFQ, Direction.EGRESS, "Gi0/1"));
        List<String> removed = adapter.generateRemoval("Gi0/1", "voice policy", Direction.EGRESS, List.of());

        assertThat(installed).contains("policy-map voice_policy", "service-policy output voice_policy")
                .noneMatch(command -> command.contains("voice policy"));
        assertThat(removed).contains("no service-policy output voice_policy", "no policy-map voice_policy");
    }

    @Test
    @DisplayName("should render standalone RED on the IOS drop scale")
    void shouldGenerateRed() {
        List<String> commands = adapter.generateRed("Gi0/1", "red-queue", 20, 60, 0.35);

        assertThat(commands).contains("random-detect precedence 0 20 60 3", "service-policy output red-queue");
        assertThat(CiscoIosAdapter.dropScale(0.01)).isEqualTo(1);
        assertThat(CiscoIosAdapter.dropScale(1.0)).isEqualTo(10);
    }
}
