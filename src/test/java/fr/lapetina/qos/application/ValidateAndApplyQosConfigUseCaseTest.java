package fr.lapetina.qos.application;

import fr.lapetina.qos.MutableClock;
import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.InterfaceQosPolicy;
import fr.lapetina.qos.infrastructure.adapter.CommandExecutionService;
import fr.lapetina.qos.infrastructure.adapter.ExecutionResult;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import fr.lapetina.qos.infrastructure.sdn.ControllerRequest;
import fr.lapetina.qos.infrastructure.sdn.ControllerResponse;
import fr.lapetina.qos.infrastructure.sdn.ControllerType;
import fr.lapetina.qos.infrastructure.sdn.SdnIntegrationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static fr.lapetina.qos.application.UseCaseFixtures.ROUTER;
import static fr.lapetina.qos.application.UseCaseFixtures.ROUTER_INTERFACE;
import static fr.lapetina.qos.application.UseCaseFixtures.SWITCH;
import static fr.lapetina.qos.application.UseCaseFixtures.SWITCH_PORT;
import static fr.lapetina.qos.application.UseCaseFixtures.UNMANAGED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ValidateAndApplyQosConfigUseCaseTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryRepositories.Policies policies;
    private InMemoryRepositories.Devices devices;
    private InMemoryRepositories.Associations associations;
    private RecordingCommandExecutor executor;
    private CommandExecutionService executionService;
    private QosMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        policies = new InMemoryRepositories.Policies();
        policies.save(UseCaseFixtures.voicePolicy());
        policies.save(UseCaseFixtures.heavyVoicePolicy());
        policies.save(UseCaseFixtures.oversubscribedPolicy());
        devices = new InMemoryRepositories.Devices()
                .add(UseCaseFixtures.router())
                .add(UseCaseFixtures.openFlowSwitch())
                .add(UseCaseFixtures.unmanagedDevice());
        associations = new InMemoryRepositories.Associations();
        executor = new RecordingCommandExecutor();
        executionService = CommandExecutionService.builder()
                .executor(executor)
                .commandTimeout(Duration.ofMillis(500))
                .build();
        metrics = new QosMetricsRegistry("qos_test");
    }

    @AfterEach
    void tearDown() {
        executionService.close();
        metrics.close();
    }

    private ValidateAndApplyQosConfigUseCase.Builder useCase() {
        return ValidateAndApplyQosConfigUseCase.builder()
                .policyRepository(policies)
                .deviceRepository(devices)
                .associationRepository(associations)
                .executionService(executionService)
                .metricsRegistry(metrics)
                .clock(new MutableClock(NOW));
    }

    private static ApplyQosRequest onRouter(String policyId, boolean reapply) {
        return new ApplyQosRequest(policyId, ROUTER, ROUTER_INTERFACE, Direction.EGRESS, QueueAlgorithmType.CBWFQ, reapply);
    }

    @Nested
    @DisplayName("CLI devices")
    class CommandLineTests {

        @Test
        @DisplayName("should push the rendered commands and record the association")
        void shouldApplyPolicy() {
            QosConfigurationResult result = useCase().build().execute(onRouter("voice-policy", false));

            assertThat(result.success()).isTrue();
            assertThat(result.errorType()).isNull();
            assertThat(result.queueConfigurations()).hasSize(2);
            assertThat(result.commandsGenerated()).contains("service-policy output voice-policy");
            assertThat(executor.batches()).singleElement().satisfies(batch -> {
                assertThat(batch.host()).isEqualTo("10.0.0.1");
                assertThat(batch.commands()).isEqualTo(result.commandsGenerated());
            });
            assertThat(associations.findActive(ROUTER, ROUTER_INTERFACE, Direction.EGRESS)).hasValue(
                    new InterfaceQosPolicy(ROUTER, ROUTER_INTERFACE, "voice-policy", Direction.EGRESS, true, NOW));
        }

        @Test
        @DisplayName("should refuse to stack a policy on an interface that already has one")
        void shouldRejectAlreadyApplied() {
            associations.save(new InterfaceQosPolicy(ROUTER, ROUTER_INTERFACE, "voice-policy", Direction.EGRESS, true, NOW));

            QosConfigurationResult result = useCase().build().execute(onRouter("voice-policy", false));

            assertThat(result.success()).isFalse();
            assertThat(result.errorType()).isEqualTo(ErrorType.ALREADY_APPLIED);
            assertThat(result.commandsGenerated()).isNotEmpty();
            assertThat(executor.batches()).isEmpty();
            assertThat(metrics.scrape()).contains("type=\"ALREADY_APPLIED\"");
        }

        @Test
        @DisplayName("should remove the previous policy before applying the new one")
        void shouldReplaceExistingPolicy() {
            associations.save(new InterfaceQosPolicy(ROUTER, ROUTER_INTERFACE, "heavy-voice", Direction.EGRESS, true, NOW));

            QosConfigurationResult result = useCase().build().execute(onRouter("voice-policy", true));

            assertThat(result.success()).isTrue();
            assertThat(result.warnings()).singleElement().asString().contains("heavy-voice");
            assertThat(executor.batches()).hasSize(2);
            assertThat(executor.batches().get(0).commands()).contains(
                    "no service-policy output heavy-voice", "no policy-map heavy-voice", "no class-map voice");
            assertThat(associations.all()).extracting(InterfaceQosPolicy::policyId, InterfaceQosPolicy::active)
                    .containsExactlyInAnyOrder(
                            tuple("heavy-voice", false),
                            tuple("voice-policy", true));
        }

        @Test
        @DisplayName("should record nothing when the device rejects the configuration")
        void shouldReportDeviceRejection() {
            executor.respondWith(commands -> ExecutionResult.failure("% Invalid input detected"));

            QosConfigurationResult result = useCase().build().execute(onRouter("voice-policy", false));

            assertThat(result.errorType()).isEqualTo(ErrorType.CONFIGURATION_EXECUTION_ERROR);
            assertThat(result.errors()).containsExactly("% Invalid input detected");
            assertThat(result.commandsGenerated()).isNotEmpty();
            assertThat(associations.all()).isEmpty();
        }

        @Test
        @DisplayName("should report the device output when a rejection carries no error text")
        void shouldReportOutputOfSilentRejection() {
            executor.respondWith(commands -> new ExecutionResult(false, "% Invalid input detected", null));

            QosConfigurationResult result = useCase().build().execute(onRouter("voice-policy", false));

            assertThat(result.errorType()).isEqualTo(ErrorType.CONFIGURATION_EXECUTION_ERROR);
            assertThat(result.errors()).containsExactly("% Invalid input detected");
            assertThat(result.message()).isEqualTo("Device rejected configuration: % Invalid input detected");
            assertThat(associations.all()).isEmpty();
        }

        @Test
        @DisplayName("should report a device that does not answer in time")
        void shouldReportTimeout() {
            executor.respondWith(commands -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ExecutionResult.success("late");
            });

            QosConfigurationResult result = useCase().build().execute(onRouter("voice-policy", false));

            assertThat(result.errorType()).isEqualTo(ErrorType.TIMEOUT);
            assertThat(associations.all()).isEmpty();
        }

        @Test
        @DisplayName("should leave the device untouched when LLQ rejects the priority reservation")
        void shouldRejectLlqViolation() {
            ApplyQosRequest request = new ApplyQosRequest("heavy-voice", ROUTER, ROUTER_INTERFACE,
                    Direction.EGRESS, QueueAlgorithmType.LLQ, true);

            QosConfigurationResult result = useCase().build().execute(request);

            assertThat(result.errorType()).isEqualTo(ErrorType.LOW_LATENCY_VALIDATION_ERROR);
            assertThat(result.commandsGenerated()).isEmpty();
            assertThat(executor.batches()).isEmpty();
            assertThat(associations.all()).isEmpty();
        }

        @Test
        @DisplayName("should report bandwidth invariant violations as validation errors")
        void shouldRejectOversubscribedPolicy() {
            QosConfigurationResult result = useCase().build().execute(onRouter("oversubscribed", false));

            assertThat(result.errorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
            assertThat(result.errors()).singleElement().asString().contains("exceeds");
            assertThat(executor.batches()).isEmpty();
        }

        @Test
        @DisplayName("should report CLI devices as unsupported without a command executor")
        void shouldRequireExecutor() {
            QosConfigurationResult result = useCase().executionService(null).build()
                    .execute(onRouter("voice-policy", false));

            assertThat(result.errorType()).isEqualTo(ErrorType.UNSUPPORTED_DEVICE);
        }
    }

    @Nested
    @DisplayName("lookups")
    class LookupTests {

        @Test
        @DisplayName("should report a missing policy")
        void shouldReportMissingPolicy() {
            assertThat(useCase().build().execute(onRouter("nope", false)).errorType())
                    .isEqualTo(ErrorType.POLICY_NOT_FOUND);
        }

        @Test
        @DisplayName("should report a missing device")
        void shouldReportMissingDevice() {
            ApplyQosRequest request = new ApplyQosRequest("voice-policy", "ghost", "eth0", null, null, false);

            assertThat(useCase().build().execute(request).errorType()).isEqualTo(ErrorType.DEVICE_NOT_FOUND);
        }

        @Test
        @DisplayName("should report a missing interface")
        void shouldReportMissingInterface() {
            ApplyQosRequest request = new ApplyQosRequest("voice-policy", ROUTER, "Serial0/0", null, null, false);

            assertThat(useCase().build().execute(request).errorType()).isEqualTo(ErrorType.INTERFACE_NOT_FOUND);
        }

        @Test
        @DisplayName("should refuse devices without QoS capability")
        void shouldRejectIncapableDevice() {
            ApplyQosRequest request = new ApplyQosRequest("voice-policy", UNMANAGED, "eth0", null, null, false);

            assertThat(useCase().build().execute(request).errorType()).isEqualTo(ErrorType.UNSUPPORTED_DEVICE);
        }

        @Test
        @DisplayName("should clear the logging context after the call")
        void shouldClearMdc() {
            useCase().build().execute(onRouter("voice-policy", false));

            assertThat(MDC.get("policyId")).isNull();
            assertThat(MDC.get("deviceId")).isNull();
        }
    }

    @Nested
    @DisplayName("OpenFlow devices")
    class OpenFlowTests {

        private final List<ControllerRequest> sent = new CopyOnWriteArrayList<>();
        private SdnIntegrationService sdn;

        @BeforeEach
        void setUpController() {
            sdn = SdnIntegrationService.builder()
                    .controllerType(ControllerType.OPENDAYLIGHT)
                    .client(request -> {
                        sent.add(request);
                        return ControllerResponse.of(200, "{}");
                    })
                    .build();
        }

        @AfterEach
        void tearDownController() {
            sdn.close();
        }

        @Test
        @DisplayName("should deploy through the controller instead of the CLI")
        void shouldDeployThroughController() {
            ApplyQosRequest request = new ApplyQosRequest("voice-policy", SWITCH, SWITCH_PORT, null, null, false);

            QosConfigurationResult result = useCase().sdnService(sdn).build().execute(request);

            assertThat(result.success()).isTrue();
            assertThat(result.commandsGenerated()).isEmpty();
            assertThat(executor.batches()).isEmpty();
            assertThat(sent).extracting(ControllerRequest::path)
                    .anyMatch(path -> path.contains("/node/openflow:1/table/0/flow/voice-policy-1"));
            assertThat(associations.findActive(SWITCH, SWITCH_PORT, Direction.EGRESS)).isPresent();
        }

        @Test
        @DisplayName("should report a failed controller deployment")
        void shouldReportControllerFailure() {
            SdnIntegrationService refusing = SdnIntegrationService.builder()
                    .controllerType(ControllerType.OPENDAYLIGHT)
                    .client(request -> ControllerResponse.of(500, ""))
                    .build();
            try {
                ApplyQosRequest request = new ApplyQosRequest("voice-policy", SWITCH, SWITCH_PORT, null, null, false);

                QosConfigurationResult result = useCase().sdnService(refusing).build().execute(request);

                assertThat(result.errorType()).isEqualTo(ErrorType.CONTROLLER_ERROR);
                assertThat(result.errors()).singleElement().asString().startsWith("openflow:1: queue 1");
                assertThat(associations.all()).isEmpty();
            } finally {
                refusing.close();
            }
        }

        @Test
        @DisplayName("should report OpenFlow devices as unsupported without a controller")
        void shouldRequireController() {
            ApplyQosRequest request = new ApplyQosRequest("voice-policy", SWITCH, SWITCH_PORT, null, null, false);

            assertThat(useCase().build().execute(request).errorType()).isEqualTo(ErrorType.UNSUPPORTED_DEVICE);
        }
    }
}
