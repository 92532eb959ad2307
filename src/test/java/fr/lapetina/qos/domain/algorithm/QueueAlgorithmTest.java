package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.exception.LowLatencyValidationException;
import fr.lapetina.qos.domain.exception.QosException;
import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.domain.model.CongestionAlgorithm;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.TrafficClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class QueueAlgorithmTest {

    private static TrafficClass trafficClass(String name, int priority, int minBandwidth) {
        return TrafficClass.builder().name(name).priority(priority).minBandwidth(minBandwidth).build();
    }

    private static QosPolicy policy(int limit, TrafficClass... classes) {
        QosPolicy.Builder builder = QosPolicy.builder().name("branch-wan").bandwidthLimit(limit);
        for (TrafficClass tc : classes) {
            builder.addTrafficClass(tc);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("CBWFQ")
    class CbwfqTests {

        private final QueueAlgorithm algorithm = AlgorithmFactory.create(QueueAlgorithmType.CBWFQ);

        @Test
        @DisplayName("should guarantee each class its minimum bandwidth")
        void shouldGuaranteeMinimumBandwidth() {
            List<QueueConfiguration> configurations = algorithm.calculate(
                    policy(1000, trafficClass("voice", 7, 200), trafficClass("data", 2, 300)));

            assertThat(configurations).extracting(QueueConfiguration::className).containsExactly("voice", "data");
            assertThat(configurations.get(0).queueParameters().serviceRate()).isEqualTo(200);
            assertThat(configurations.get(1).queueParameters().serviceRate()).isEqualTo(300);
            assertThat(configurations.get(0).queueParameters().bandwidthPercent()).isCloseTo(20.0, within(1e-9));
        }

        @Test
        @DisplayName("should weight classes by priority and guarantee")
        void shouldComputeWeights() {
            List<QueueConfiguration> configurations = algorithm.calculate(
                    policy(1000, trafficClass("voice", 7, 200), trafficClass("data", 2, 300)));

            // voice: (7/7*0.7 + 200/300*0.3)*100, data: (2/7*0.7 + 300/300*0.3)*100
            assertThat(configurations.get(0).queueParameters().weight()).isCloseTo(90.0, within(1e-9));
            assertThat(configurations.get(1).queueParameters().weight()).isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("should apply floor values to small queues")
        void shouldApplyQueueFloors() {
            QueueConfiguration voice = algorithm.calculate(policy(1000, trafficClass("voice", 7, 200))).get(0);

            assertThat(voice.queueParameters().queueLimit()).isEqualTo(64);
            assertThat(voice.queueParameters().bufferSize()).isEqualTo(16);
        }

        @Test
        @DisplayName("should use WRED only for classes with an explicit DSCP")
        void shouldPickCongestionAvoidanceFromDscp() {
            TrafficClass marked = TrafficClass.builder().name("video").priority(5).minBandwidth(1000).dscp("AF41").build();
            List<QueueConfiguration> configurations = algorithm.calculate(
                    policy(10_000, marked, trafficClass("bulk", 1, 500)));

            assertThat(configurations.get(0).congestionParameters().algorithm()).isEqualTo(CongestionAlgorithm.WRED);
            assertThat(configurations.get(0).congestionParameters().dscpWeights()).containsKey("AF41");
            assertThat(configurations.get(1).congestionParameters().algorithm()).isEqualTo(CongestionAlgorithm.TAIL_DROP);
        }

        @Test
        @DisplayName("should reject guarantees above the bandwidth limit")
        void shouldRejectOversubscription() {
            assertThatThrownBy(() -> algorithm.calculate(
                    policy(1000, trafficClass("a", 3, 600), trafficClass("b", 3, 500))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("exceeds");
        }

        @Test
        @DisplayName("should accept guarantees exactly equal to the limit")
        void shouldAcceptExactSubscription() {
            assertThat(algorithm.calculate(policy(1000, trafficClass("a", 3, 500), trafficClass("b", 1, 500))))
                    .hasSize(2);
        }
    }

    @Nested
    @DisplayName("LLQ")
    class LlqTests {

        private final QueueAlgorithm algorithm = AlgorithmFactory.create(QueueAlgorithmType.LLQ);

        @Test
        @DisplayName("should reject a priority reservation above 33% of the budget")
        void shouldRejectLargePriorityReservation() {
            assertThatThrownBy(() -> algorithm.calculate(
                    policy(1000, trafficClass("voice", 7, 400), trafficClass("data", 2, 300))))
                    .isInstanceOf(LowLatencyValidationException.class)
                    .satisfies(e -> assertThat(((QosException) e).getErrorType())
                            .isEqualTo(ErrorType.LOW_LATENCY_VALIDATION_ERROR));
        }

        @Test
        @DisplayName("should put priority classes first as strict-priority queues")
        void shouldBuildPriorityQueues() {
            List<QueueConfiguration> configurations = algorithm.calculate(
                    policy(1000, trafficClass("data", 2, 500), trafficClass("voice", 7, 300)));

            QueueConfiguration voice = configurations.get(0);
            assertThat(voice.className()).isEqualTo("voice");
            assertThat(voice.queueParameters().weight()).isZero();
            assertThat(voice.queueParameters().bandwidthPercent()).isZero();
            assertThat(voice.queueParameters().queueLimit()).isEqualTo(32);
            assertThat(voice.queueParameters().bufferSize()).isEqualTo(8);
            assertThat(voice.congestionParameters().algorithm()).isEqualTo(CongestionAlgorithm.TAIL_DROP);
        }

        @Test
        @DisplayName("should size standard classes against the bandwidth left after the reservation")
        void shouldSizeStandardClassesOnRemainder() {
            QueueConfiguration data = algorithm.calculate(
                    policy(1000, trafficClass("data", 2, 500), trafficClass("voice", 7, 300))).get(1);

            assertThat(data.queueParameters().bandwidthPercent()).isCloseTo(500.0 / 700 * 100, within(1e-9));
        }

        @Test
        @DisplayName("should reject standard guarantees that do not fit after the reservation")
        void shouldRejectStandardOverflow() {
            assertThatThrownBy(() -> algorithm.calculate(
                    policy(1000, trafficClass("voice", 7, 300), trafficClass("data", 2, 800))))
                    .isInstanceOf(LowLatencyValidationException.class);
        }
    }

    @Nested
    @DisplayName("FQ-CoDel")
    class FqCodelTests {

        @Test
        @DisplayName("should derive CoDel target, interval and quantum from priority and bandwidth")
        void shouldComputeCodelParameters() {
            QueueConfiguration voice = AlgorithmFactory.create(QueueAlgorithmType.FQ_CODEL)
                    .calculate(policy(10_000, trafficClass("voice", 7, 2000))).get(0);

            assertThat(voice.congestionParameters().algorithm()).isEqualTo(CongestionAlgorithm.ECN);
            assertThat(voice.congestionParameters().minThreshold()).isEqualTo(2_000);
            assertThat(voice.congestionParameters().maxThreshold()).isEqualTo(100_000);
            assertThat(voice.queueParameters().weight()).isEqualTo(3028.0);
            assertThat(voice.queueParameters().bufferSize()).isEqualTo(1024);
            assertThat(voice.queueParameters().queueLimit()).isEqualTo(2048);
        }

        @Test
        @DisplayName("should never go below one MTU of quantum")
        void shouldFloorQuantum() {
            QueueConfiguration bulk = AlgorithmFactory.create(QueueAlgorithmType.FQ_CODEL)
                    .calculate(policy(10_000, trafficClass("bulk", 0, 100))).get(0);

            assertThat(bulk.queueParameters().weight()).isEqualTo(FqCodelAlgorithm.DEFAULT_QUANTUM);
            assertThat(bulk.congestionParameters().minThreshold()).isEqualTo(10_000);
            assertThat(bulk.congestionParameters().maxThreshold()).isEqualTo(200_000);
        }
    }

    @Nested
    @DisplayName("DRR")
    class DrrTests {

        @Test
        @DisplayName("should split the round quantum by weight and use RED for high priorities")
        void shouldComputeQuantum() {
            List<QueueConfiguration> configurations = AlgorithmFactory.create(QueueAlgorithmType.DRR)
                    .calculate(policy(1000, trafficClass("voice", 7, 200), trafficClass("data", 2, 300)));

            QueueConfiguration voice = configurations.get(0);
            assertThat(voice.queueParameters().weight()).isEqualTo(8.0);
            assertThat(voice.queueParameters().bufferSize()).isEqualTo(16);
            assertThat(voice.congestionParameters().algorithm()).isEqualTo(CongestionAlgorithm.RED);
            assertThat(voice.congestionParameters().minThreshold()).isEqualTo(8);
            assertThat(voice.congestionParameters().maxThreshold()).isEqualTo(24);

            assertThat(configurations.get(1).congestionParameters().algorithm())
                    .isEqualTo(CongestionAlgorithm.TAIL_DROP);
        }

        @Test
        @DisplayName("should clamp the quantum to its minimum")
        void shouldClampQuantum() {
            assertThat(DrrAlgorithm.quantum(3.0, 11.0, 1000)).isEqualTo(DrrAlgorithm.MIN_QUANTUM);
            assertThat(DrrAlgorithm.quantum(8.0, 11.0, 1000)).isEqualTo(1090);
            assertThat(DrrAlgorithm.quantum(1.0, 0.0, 1000)).isEqualTo(DrrAlgorithm.DEFAULT_QUANTUM);
        }

        @Test
        @DisplayName("should reject guarantees above the bandwidth limit")
        void shouldRejectOversubscription() {
            QueueAlgorithm drr = AlgorithmFactory.create(QueueAlgorithmType.DRR);

            assertThatThrownBy(() -> drr.calculate(
                    policy(500, trafficClass("voice", 7, 200), trafficClass("data", 2, 400))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Sum of guaranteed bandwidth (600 kbps) exceeds the policy bandwidth limit (500 kbps)")
                    .satisfies(e -> assertThat(((QosException) e).getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR));
        }

        @Test
        @DisplayName("should accept guarantees exactly equal to the limit")
        void shouldAcceptFullSubscription() {
            List<QueueConfiguration> configurations = AlgorithmFactory.create(QueueAlgorithmType.DRR)
                    .calculate(policy(600, trafficClass("voice", 7, 200), trafficClass("data", 2, 400)));

            assertThat(configurations).hasSize(2);
            assertThat(configurations.stream().mapToDouble(qc -> qc.queueParameters().bandwidthPercent()).sum())
                    .isCloseTo(100.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("AlgorithmFactory")
    class FactoryTests {

        @Test
        @DisplayName("should reject known but unimplemented algorithms")
        void shouldRejectUnsupported() {
            assertThatThrownBy(() -> AlgorithmFactory.create(QueueAlgorithmType.WFQ))
                    .isInstanceOf(QosException.class)
                    .satisfies(e -> assertThat(((QosException) e).getErrorType())
                            .isEqualTo(ErrorType.UNSUPPORTED_ALGORITHM));
            assertThat(AlgorithmFactory.isSupported(QueueAlgorithmType.FIFO)).isFalse();
        }

        @Test
        @DisplayName("should resolve configuration names")
        void shouldResolveNames() {
            assertThat(AlgorithmFactory.create("fq-codel")).get()
                    .extracting(QueueAlgorithm::getType).isEqualTo(QueueAlgorithmType.FQ_CODEL);
            assertThat(AlgorithmFactory.create("LLQ")).isPresent();
            assertThat(AlgorithmFactory.create("mdrr")).isEmpty();
            assertThat(AlgorithmFactory.create("nope")).isEmpty();
        }
    }

    @Nested
    @DisplayName("PolicyValidator")
    class ValidatorTests {

        @Test
        @DisplayName("should collect every structural problem")
        void shouldCollectErrors() {
            QosPolicy invalid = policy(0,
                    trafficClass("dup", 9, 10),
                    trafficClass("dup", 1, 10),
                    TrafficClass.builder().name("capped").minBandwidth(50).maxBandwidth(20).build());

            List<String> errors = PolicyValidator.validate(invalid);

            assertThat(errors).hasSize(4);
            assertThat(errors).anyMatch(e -> e.contains("Bandwidth limit"));
            assertThat(errors).anyMatch(e -> e.contains("declared twice"));
            assertThat(errors).anyMatch(e -> e.contains("priority must be between 0 and 7"));
            assertThat(errors).anyMatch(e -> e.contains("below minimum bandwidth"));
        }

        @Test
        @DisplayName("should expose all errors on the thrown exception")
        void shouldThrowWithErrors() {
            assertThatThrownBy(() -> PolicyValidator.validateOrThrow(policy(100, trafficClass("a", 1, 200))))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getErrors()).hasSize(1));
        }

        @Test
        @DisplayName("should report an oversubscribed policy only once its structure is valid")
        void shouldReportOversubscription() {
            QosPolicy oversubscribed = policy(500, trafficClass("a", 1, 300), trafficClass("b", 2, 300));

            assertThat(PolicyValidator.validate(oversubscribed)).containsExactly(
                    "Sum of guaranteed bandwidth (600 kbps) exceeds the policy bandwidth limit (500 kbps)");
            assertThatCode(() -> PolicyValidator.validateStructureOrThrow(oversubscribed))
                    .doesNotThrowAnyException();
            assertThatThrownBy(() -> PolicyValidator.requireGuaranteesWithinLimit(oversubscribed))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("600 kbps");

            QosPolicy broken = policy(500, trafficClass("a", 9, 300), trafficClass("b", 2, 300));
            assertThat(PolicyValidator.validate(broken))
                    .containsExactly("Traffic class 'a': priority must be between 0 and 7, got 9");
        }
    }

    @Nested
    @DisplayName("BandwidthAllocator")
    class AllocatorTests {

        @Test
        @DisplayName("should split the unreserved bandwidth by weight")
        void shouldShareRemainder() {
            QosPolicy policy = policy(1000, trafficClass("voice", 7, 200), trafficClass("data", 2, 300));
            List<QueueConfiguration> configurations = AlgorithmFactory.create(QueueAlgorithmType.CBWFQ).calculate(policy);

            BandwidthAllocation allocation = BandwidthAllocator.allocate(QueueAlgorithmType.CBWFQ, policy, configurations);

            assertThat(allocation.totalGuaranteed()).isEqualTo(500);
            assertThat(allocation.unreserved()).isEqualTo(500);
            BandwidthAllocation.ClassAllocation voice = allocation.classes().get(0);
            BandwidthAllocation.ClassAllocation data = allocation.classes().get(1);
            assertThat(voice.sharedRateKbps()).isCloseTo(500.0 * 90 / 140, within(1e-6));
            assertThat(data.sharedRateKbps()).isCloseTo(500.0 * 50 / 140, within(1e-6));
            assertThat(voice.sharedRateKbps() + data.sharedRateKbps()).isCloseTo(500.0, within(1e-6));
            assertThat(voice.maxRateKbps()).isCloseTo(200 + 500.0 * 90 / 140, within(1e-6));
            assertThat(voice.strictPriority()).isFalse();
        }

        @Test
        @DisplayName("should bound the maximum rate by the class maximum and flag strict priority")
        void shouldBoundByClassMaximum() {
            TrafficClass voice = TrafficClass.builder().name("voice").priority(7).minBandwidth(300).maxBandwidth(300).build();
            QosPolicy policy = policy(1000, voice, trafficClass("data", 2, 400));
            List<QueueConfiguration> configurations = AlgorithmFactory.create(QueueAlgorithmType.LLQ).calculate(policy);

            BandwidthAllocation allocation = BandwidthAllocator.allocate(QueueAlgorithmType.LLQ, policy, configurations);

            BandwidthAllocation.ClassAllocation priority = allocation.classes().get(0);
            assertThat(priority.strictPriority()).isTrue();
            assertThat(priority.sharedRateKbps()).isZero();
            assertThat(priority.maxRateKbps()).isEqualTo(300.0);
            // The only weighted class takes the whole remainder
            assertThat(allocation.classes().get(1).maxRateKbps()).isCloseTo(700.0, within(1e-6));
        }
    }
}
