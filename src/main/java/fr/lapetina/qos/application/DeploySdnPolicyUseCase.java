package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.PolicyValidator;
import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.exception.PolicyNotFoundException;
import fr.lapetina.qos.domain.exception.QosException;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import fr.lapetina.qos.infrastructure.sdn.DeploymentReport;
import fr.lapetina.qos.infrastructure.sdn.PolicyStatistics;
import fr.lapetina.qos.infrastructure.sdn.SdnIntegrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Objects;

/**
 * Deploys a stored policy to a set of OpenFlow switches.
 */
public final class DeploySdnPolicyUseCase {

    private static final Logger log = LoggerFactory.getLogger(DeploySdnPolicyUseCase.class);
    private static final String OPERATION = "deploy_sdn_policy";

    private final PolicyRepository policies;
    private final SdnIntegrationService sdnService;
    private final QosMetricsRegistry metrics;

    public DeploySdnPolicyUseCase(PolicyRepository policies, SdnIntegrationService sdnService,
                                  QosMetricsRegistry metrics) {
        this.policies = Objects.requireNonNull(policies, "Policy repository is required");
        this.sdnService = Objects.requireNonNull(sdnService, "SDN service is required");
        this.metrics = metrics;
    }

    /**
     * @param switches target switch ids; empty to deploy on every switch the controller reports
     */
    public QosConfigurationResult execute(String policyId, List<String> switches) {
        MDC.put("policyId", policyId);
        try {
            QosPolicy policy = policies.findById(policyId)
                    .orElseThrow(() -> new PolicyNotFoundException(policyId));
            PolicyValidator.validateOrThrow(policy);
            List<QueueConfiguration> configurations =
                    QueueCalculations.calculate(QueueAlgorithmType.CBWFQ, policy, metrics);

            DeploymentReport report = sdnService.deploy(policy, switches != null ? switches : List.of());
            String summary = String.format("%d/%d flows installed on %d switches (%.0f%%)",
                    report.successes(), report.attempts(), report.switches().size(), report.successRate() * 100);
            List<String> switchErrors = report.failedSwitches().stream()
                    .map(s -> s.switchId() + ": " + s.error())
                    .toList();
            if (!report.success()) {
                recordError(ErrorType.CONTROLLER_ERROR);
                return QosConfigurationResult.failure(ErrorType.CONTROLLER_ERROR,
                        "SDN deployment failed: " + summary, switchErrors, List.of(), configurations);
            }
            return QosConfigurationResult.success("SDN deployment succeeded: " + summary,
                    List.of(), configurations, switchErrors);
        } catch (QosException e) {
            log.warn("SDN deployment rejected: policy={}, errorType={}, reason={}",
                    policyId, e.getErrorType(), e.getMessage());
            recordError(e.getErrorType());
            return QosConfigurationResult.fromException(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure deploying policy: policy={}", policyId, e);
            recordError(ErrorType.INTERNAL_ERROR);
            return QosConfigurationResult.failure(ErrorType.INTERNAL_ERROR,
                    "Unexpected error: " + e.getMessage(), List.of(String.valueOf(e)));
        } finally {
            MDC.remove("policyId");
        }
    }

    /**
     * @throws PolicyNotFoundException if the policy was never deployed
     */
    public PolicyStatistics monitor(String policyId) {
        return sdnService.monitor(policyId);
    }

    private void recordError(ErrorType errorType) {
        if (metrics != null) {
            metrics.incrementErrorCount(OPERATION, errorType);
        }
    }
}
