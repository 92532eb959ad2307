package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.exception.PolicyNotFoundException;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import fr.lapetina.qos.infrastructure.sdn.ControllerRequest;
import fr.lapetina.qos.infrastructure.sdn.ControllerResponse;
import fr.lapetina.qos.infrastructure.sdn.ControllerType;
import fr.lapetina.qos.infrastructure.sdn.PolicyStatistics;
import fr.lapetina.qos.infrastructure.sdn.SdnIntegrationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploySdnPolicyUseCaseTest {

    private final List<ControllerRequest> sent = new CopyOnWriteArrayList<>();
    private volatile Function<ControllerRequest, ControllerResponse> responder =
            request -> ControllerResponse.of(200, "{}");
    private SdnIntegrationService sdn;
    private QosMetricsRegistry metrics;
    private DeploySdnPolicyUseCase useCase;

    @BeforeEach
    void setUp() {
        InMemoryRepositories.Policies policies = new InMemoryRepositories.Policies();
        policies.save(UseCaseFixtures.voicePolicy());
        policies.save(UseCaseFixtures.oversubscribedPolicy());
        metrics = new QosMetricsRegistry("qos_test");
        sdn = SdnIntegrationService.builder()
                .controllerType(ControllerType.OPENDAYLIGHT)
                .client(request -> {
                    sent.add(request);
                    return responder.apply(request);
                })
                .metricsRegistry(metrics)
                .build();
        useCase = new DeploySdnPolicyUseCase(policies, sdn, metrics);
    }

    @AfterEach
    void tearDown() {
        sdn.close();
        metrics.close();
    }

    @Test
    @DisplayName("should summarise a full deployment")
    void shouldDeployToEverySwitch() {
        QosConfigurationResult result = useCase.execute("voice-policy", List.of("openflow:1", "openflow:2"));

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("SDN deployment succeeded: 4/4 flows installed on 2 switches (100%)");
        assertThat(result.queueConfigurations()).hasSize(2);
        assertThat(result.warnings()).isEmpty();
        assertThat(sdn.getDeployedPolicies()).containsExactly("voice-policy");
    }

    @Test
    @DisplayName("should fail when half of the switches refuse the policy")
    void shouldReportPartialDeployment() {
        responder = request -> request.path().contains("openflow:2")
                ? ControllerResponse.of(500, "")
                : ControllerResponse.of(200, "{}");

        QosConfigurationResult result = useCase.execute("voice-policy", List.of("openflow:1", "openflow:2"));

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo(ErrorType.CONTROLLER_ERROR);
        assertThat(result.message()).endsWith("2/4 flows installed on 2 switches (50%)");
        assertThat(result.errors()).singleElement().asString().startsWith("openflow:2: ");
        assertThat(metrics.scrape()).contains("operation=\"deploy_sdn_policy\"");
    }

    @Test
    @DisplayName("should report an unknown policy")
    void shouldReportUnknownPolicy() {
        assertThat(useCase.execute("nope", List.of("openflow:1")).errorType())
                .isEqualTo(ErrorType.POLICY_NOT_FOUND);
        assertThat(sent).isEmpty();
    }

    @Test
    @DisplayName("should not contact the controller for an invalid policy")
    void shouldValidateBeforeDeploying() {
        QosConfigurationResult result = useCase.execute("oversubscribed", List.of("openflow:1"));

        assertThat(result.errorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(sent).isEmpty();
    }

    @Test
    @DisplayName("should report per-switch statistics of a deployed policy")
    void shouldMonitorDeployedPolicy() {
        useCase.execute("voice-policy", List.of("openflow:1"));
        responder = request -> ControllerResponse.of(404, "");

        PolicyStatistics statistics = useCase.monitor("voice-policy");

        assertThat(statistics.switches()).containsOnlyKeys("openflow:1");
        assertThat(statistics.switches().get("openflow:1").error()).isEqualTo("HTTP 404");
        assertThat(statistics.totalFlows()).isZero();
        assertThatThrownBy(() -> useCase.monitor("nope")).isInstanceOf(PolicyNotFoundException.class);
    }
}
