package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.BandwidthAllocation;
import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.exception.LowLatencyValidationException;
import fr.lapetina.qos.domain.exception.PolicyNotFoundException;
import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.infrastructure.adapter.CommandExecutionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CalculateBandwidthAllocationUseCaseTest {

    private InMemoryRepositories.Policies policies;
    private CalculateBandwidthAllocationUseCase useCase;

    @BeforeEach
    void setUp() {
        policies = new InMemoryRepositories.Policies();
        policies.save(UseCaseFixtures.voicePolicy());
        policies.save(UseCaseFixtures.heavyVoicePolicy());
        policies.save(UseCaseFixtures.oversubscribedPolicy());
        useCase = new CalculateBandwidthAllocationUseCase(policies, null);
    }

    @Test
    @DisplayName("should share the unreserved bandwidth by weight under CBWFQ")
    void shouldAllocateCbwfq() {
        BandwidthAllocation allocation = useCase.execute("voice-policy");

        assertThat(allocation.algorithm()).isEqualTo(QueueAlgorithmType.CBWFQ);
        assertThat(allocation.bandwidthLimit()).isEqualTo(1000);
        assertThat(allocation.totalGuaranteed()).isEqualTo(500);
        assertThat(allocation.unreserved()).isEqualTo(500);
        assertThat(allocation.classes()).extracting(BandwidthAllocation.ClassAllocation::className)
                .containsExactly("voice", "data");

        BandwidthAllocation.ClassAllocation voice = allocation.classes().get(0);
        assertThat(voice.bandwidthPercent()).isCloseTo(20.0, within(1e-9));
        assertThat(voice.sharedRateKbps()).isCloseTo(500.0 * 90 / 140, within(1e-6));
        assertThat(voice.strictPriority()).isFalse();
        assertThat(allocation.classes().get(1).sharedRateKbps()).isCloseTo(500.0 * 50 / 140, within(1e-6));
    }

    @Test
    @DisplayName("should give priority classes only their guarantee under LLQ")
    void shouldAllocateLlq() {
        BandwidthAllocation allocation = useCase.execute("voice-policy", QueueAlgorithmType.LLQ);

        BandwidthAllocation.ClassAllocation voice = allocation.classes().get(0);
        assertThat(voice.strictPriority()).isTrue();
        assertThat(voice.sharedRateKbps()).isZero();
        assertThat(voice.maxRateKbps()).isEqualTo(200.0);

        BandwidthAllocation.ClassAllocation data = allocation.classes().get(1);
        assertThat(data.strictPriority()).isFalse();
        assertThat(data.sharedRateKbps()).isCloseTo(500.0, within(1e-9));
        assertThat(data.maxRateKbps()).isCloseTo(800.0, within(1e-9));
    }

    @Test
    @DisplayName("should throw for an unknown policy")
    void shouldRejectUnknownPolicy() {
        assertThatThrownBy(() -> useCase.execute("nope")).isInstanceOf(PolicyNotFoundException.class);
    }

    @Test
    @DisplayName("should throw for a policy that oversubscribes its limit")
    void shouldRejectOversubscription() {
        assertThatThrownBy(() -> useCase.execute("oversubscribed")).isInstanceOf(ValidationException.class);
    }

    @Nested
    @DisplayName("algorithm shortcuts")
    class ShortcutTests {

        private CommandExecutionService executionService;
        private ValidateAndApplyQosConfigUseCase apply;

        @BeforeEach
        void setUpApply() {
            executionService = CommandExecutionService.builder().executor(new RecordingCommandExecutor()).build();
            apply = ValidateAndApplyQosConfigUseCase.builder()
                    .policyRepository(policies)
                    .deviceRepository(new InMemoryRepositories.Devices().add(UseCaseFixtures.router()))
                    .associationRepository(new InMemoryRepositories.Associations())
                    .executionService(executionService)
                    .build();
        }

        @AfterEach
        void tearDownApply() {
            executionService.close();
        }

        @Test
        @DisplayName("should simulate CBWFQ without touching a device")
        void shouldSimulateCbwfq() {
            assertThat(new ConfigureCbwfqUseCase(apply, useCase).simulate("voice-policy").algorithm())
                    .isEqualTo(QueueAlgorithmType.CBWFQ);
        }

        @Test
        @DisplayName("should reject an LLQ simulation reserving too much priority bandwidth")
        void shouldRejectHeavyLlqSimulation() {
            assertThatThrownBy(() -> new ConfigureLlqUseCase(apply, useCase).simulate("heavy-voice"))
                    .isInstanceOf(LowLatencyValidationException.class);
        }

        @Test
        @DisplayName("should apply twice in a row by replacing the active policy")
        void shouldAlwaysReapply() {
            ConfigureCbwfqUseCase cbwfq = new ConfigureCbwfqUseCase(apply, useCase);

            assertThat(cbwfq.execute("voice-policy", UseCaseFixtures.ROUTER, UseCaseFixtures.ROUTER_INTERFACE, null)
                    .success()).isTrue();
            QosConfigurationResult second = cbwfq.execute("voice-policy", UseCaseFixtures.ROUTER,
                    UseCaseFixtures.ROUTER_INTERFACE, null);

            assertThat(second.success()).isTrue();
            assertThat(second.warnings()).hasSize(1);
        }
    }
}
