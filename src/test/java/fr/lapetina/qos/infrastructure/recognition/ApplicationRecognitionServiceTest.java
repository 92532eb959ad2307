package fr.lapetina.qos.infrastructure.recognition;

import fr.lapetina.qos.MutableClock;
import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.domain.model.Protocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ApplicationRecognitionServiceTest {

    private static final String SIP_INVITE = "INVITE sip:bob@example.com SIP/2.0\r\nVia: SIP/2.0/UDP 10.0.0.1\r\n";

    private MutableClock clock;
    private ApplicationRecognitionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        List<ApplicationSignature> signatures = new SignatureLoader().load(SignatureLoader.DEFAULT_RESOURCE);
        service = ApplicationRecognitionService.builder()
                .signatures(signatures)
                .clock(clock)
                .inactivityTimeout(Duration.ofMinutes(30))
                .build();
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private Packet sipPacket() {
        return Packet.builder()
                .source("192.168.1.20", 40000)
                .destination("10.0.0.5", 5060)
                .protocol(Protocol.UDP)
                .size(80)
                .payload(SIP_INVITE)
                .timestamp(clock.instant())
                .build();
    }

    @Nested
    @DisplayName("classification")
    class ClassificationTests {

        @Test
        @DisplayName("should recognise SIP from payload and port")
        void shouldRecogniseSip() {
            ApplicationClassification result = service.classify(sipPacket());

            assertThat(result.application()).isEqualTo("SIP");
            assertThat(result.category()).isEqualTo("voice");
            assertThat(result.methodsUsed())
                    .containsExactly(ClassificationMethod.PORT, ClassificationMethod.PAYLOAD);
            // 3 of 4 payload patterns: 0.75 * 0.4, port: 0.6 * 0.1
            assertThat(result.confidence()).isCloseTo(0.36, within(1e-9));
        }

        @Test
        @DisplayName("should report unknown traffic without throwing")
        void shouldReportUnknown() {
            Packet opaque = Packet.builder()
                    .source("10.9.9.9", 51000).destination("10.8.8.8", 9999)
                    .protocol(Protocol.TCP).size(60).timestamp(clock.instant())
                    .build();

            ApplicationClassification result = service.classify(opaque);

            assertThat(result.isKnown()).isFalse();
            assertThat(result.method()).isEqualTo("fusion");
        }

        @Test
        @DisplayName("should fold packets of the same 5-tuple into one flow")
        void shouldTrackFlows() {
            service.observe(sipPacket());
            service.observe(sipPacket());
            service.classify(sipPacket());

            assertThat(service.getActiveFlows()).hasSize(1);
            TrafficFlow.Snapshot flow = service.getActiveFlows().get(0);
            assertThat(flow.packetCount()).isEqualTo(3);
            assertThat(flow.byteCount()).isEqualTo(240);
            assertThat(flow.lastApplication()).isEqualTo("SIP");
            assertThat(service.getFlowStatistics().applicationFlows()).containsEntry("SIP", 1);
        }
    }

    @Nested
    @DisplayName("flow retention")
    class RetentionTests {

        @Test
        @DisplayName("should evict flows idle for longer than the inactivity timeout")
        void shouldEvictInactiveFlows() {
            service.observe(sipPacket());
            clock.advance(Duration.ofMinutes(29));
            assertThat(service.cleanupInactiveFlows()).isZero();

            clock.advance(Duration.ofMinutes(2));

            assertThat(service.cleanupInactiveFlows()).isEqualTo(1);
            assertThat(service.getActiveFlows()).isEmpty();
        }

        @Test
        @DisplayName("should keep flows refreshed by a recent packet")
        void shouldKeepActiveFlows() {
            service.observe(sipPacket());
            clock.advance(Duration.ofMinutes(20));
            service.observe(sipPacket());
            clock.advance(Duration.ofMinutes(20));

            assertThat(service.cleanupInactiveFlows()).isZero();
        }
    }

    @Nested
    @DisplayName("QoS templates")
    class TemplateTests {

        @Test
        @DisplayName("should suggest by exact key, then by keyword, then the default")
        void shouldSuggestTemplates() {
            assertThat(service.suggestQosPolicy("voice").name()).isEqualTo("Voice_Policy_voice");
            assertThat(service.suggestQosPolicy("SIP trunk").priority()).isEqualTo(7);
            assertThat(service.suggestQosPolicy("Steam").key()).isEqualTo("gaming");
            assertThat(service.suggestQosPolicy("backup").name()).isEqualTo("Default_Policy");
            assertThat(service.suggestQosPolicy(null).name()).isEqualTo("Default_Policy");
        }

        @Test
        @DisplayName("should list the known traffic classes")
        void shouldListTrafficClasses() {
            assertThat(service.getTrafficClasses()).contains("voice", "gaming", "unknown");
        }
    }
}
