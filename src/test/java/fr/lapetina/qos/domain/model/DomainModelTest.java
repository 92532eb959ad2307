package fr.lapetina.qos.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainModelTest {

    @Nested
    @DisplayName("PortRange")
    class PortRangeTests {

        @Test
        @DisplayName("should treat 0-0 as matching every port")
        void shouldMatchAnyPort() {
            assertThat(PortRange.ANY.isWildcard()).isTrue();
            assertThat(PortRange.ANY.contains(65535)).isTrue();
        }

        @Test
        @DisplayName("should include both bounds")
        void shouldBeInclusive() {
            PortRange rtp = new PortRange(16384, 32767);

            assertThat(rtp.contains(16384)).isTrue();
            assertThat(rtp.contains(32767)).isTrue();
            assertThat(rtp.contains(32768)).isFalse();
            assertThat(rtp.isSinglePort()).isFalse();
            assertThat(PortRange.single(443).isSinglePort()).isTrue();
        }

        @Test
        @DisplayName("should reject inverted or out of range bounds")
        void shouldRejectInvalidRange() {
            assertThatThrownBy(() -> new PortRange(100, 99)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new PortRange(1, 70000)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("DscpCodes")
    class DscpTests {

        @Test
        @DisplayName("should resolve names case-insensitively and decimal values")
        void shouldResolveCodePoints() {
            assertThat(DscpCodes.codePoint("EF")).hasValue(46);
            assertThat(DscpCodes.codePoint(" af41 ")).hasValue(34);
            assertThat(DscpCodes.codePoint("26")).hasValue(26);
            assertThat(DscpCodes.tosByte("EF")).hasValue(184);
        }

        @Test
        @DisplayName("should not resolve unknown names or values above 63")
        void shouldRejectUnknown() {
            assertThat(DscpCodes.codePoint("gold")).isEmpty();
            assertThat(DscpCodes.codePoint("64")).isEmpty();
            assertThat(DscpCodes.codePoint(null)).isEmpty();
            assertThat(DscpCodes.isKnownName("26")).isFalse();
        }
    }

    @Nested
    @DisplayName("names")
    class NameTests {

        @Test
        @DisplayName("should parse direction aliases and default to egress")
        void shouldParseDirection() {
            assertThat(Direction.fromName("input")).isEqualTo(Direction.INGRESS);
            assertThat(Direction.fromName("OUT")).isEqualTo(Direction.EGRESS);
            assertThat(Direction.fromName(null)).isEqualTo(Direction.EGRESS);
            assertThatThrownBy(() -> Direction.fromName("sideways")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should parse vendor short names")
        void shouldParseVendor() {
            assertThat(DeviceVendor.fromName("junos")).contains(DeviceVendor.JUNIPER_JUNOS);
            assertThat(DeviceVendor.fromName("cisco-ios")).contains(DeviceVendor.CISCO_IOS);
            assertThat(DeviceVendor.fromName("arista")).isEmpty();
            assertThat(DeviceVendor.OPENFLOW.isCommandLine()).isFalse();
        }
    }

    @Nested
    @DisplayName("policies and classes")
    class PolicyTests {

        @Test
        @DisplayName("should default the DSCP and flag priority 5 and above as low latency")
        void shouldApplyClassDefaults() {
            TrafficClass video = TrafficClass.builder().name("video").priority(5).minBandwidth(100).build();
            TrafficClass bulk = TrafficClass.builder().name("bulk").priority(4).dscp(" ").build();

            assertThat(video.hasDefaultDscp()).isTrue();
            assertThat(video.isLowLatency()).isTrue();
            assertThat(bulk.dscp()).isEqualTo(TrafficClass.DEFAULT_DSCP);
            assertThat(bulk.isLowLatency()).isFalse();
        }

        @Test
        @DisplayName("should use the name as id and sum class guarantees")
        void shouldDeriveIdentity() {
            QosPolicy policy = QosPolicy.builder()
                    .name("branch")
                    .bandwidthLimit(1000)
                    .addTrafficClass(TrafficClass.builder().name("a").minBandwidth(100).build())
                    .addTrafficClass(TrafficClass.builder().name("b").minBandwidth(250).build())
                    .build();

            assertThat(policy.id()).isEqualTo("branch");
            assertThat(policy.totalMinBandwidth()).isEqualTo(350);
            assertThat(policy.withClasses(500, policy.trafficClasses().subList(0, 1)).totalMinBandwidth())
                    .isEqualTo(100);
        }

        @Test
        @DisplayName("should reject VLAN ids outside 0-4095")
        void shouldRejectVlan() {
            assertThatThrownBy(() -> TrafficClassifier.builder().vlan(4096).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(TrafficClassifier.any().destinationPorts().isWildcard()).isTrue();
        }

        @Test
        @DisplayName("should keep the application time when deactivating")
        void shouldDeactivateAssociation() {
            Instant appliedAt = Instant.parse("2024-01-01T00:00:00Z");
            InterfaceQosPolicy active = new InterfaceQosPolicy("r1", "eth0", "p", Direction.EGRESS, true, appliedAt);

            InterfaceQosPolicy inactive = active.deactivate();

            assertThat(inactive.active()).isFalse();
            assertThat(inactive.appliedAt()).isEqualTo(appliedAt);
        }
    }

    @Test
    @DisplayName("should decode every payload byte to one character")
    void shouldDecodePayloadAsLatin1() {
        Packet packet = Packet.builder().payload(new byte[]{(byte) 0xFF, (byte) 0xFF, 'T', 'S'}).build();

        assertThat(packet.payloadText()).isEqualTo("\u00FF\u00FFTS");
        assertThat(packet.protocol()).isEqualTo(Protocol.ANY);
    }
}
