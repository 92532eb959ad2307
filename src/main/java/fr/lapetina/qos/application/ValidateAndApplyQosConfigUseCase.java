package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.algorithm.PolicyValidator;
import fr.lapetina.qos.domain.exception.ConfigurationExecutionException;
import fr.lapetina.qos.domain.exception.DeviceNotFoundException;
import fr.lapetina.qos.domain.exception.InterfaceNotFoundException;
import fr.lapetina.qos.domain.exception.PolicyNotFoundException;
import fr.lapetina.qos.domain.exception.QosException;
import fr.lapetina.qos.domain.exception.UnsupportedDeviceException;
import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.InterfaceQosPolicy;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.QueueConfiguration;
import fr.lapetina.qos.domain.model.TrafficClass;
import fr.lapetina.qos.infrastructure.adapter.CommandExecutionService;
import fr.lapetina.qos.infrastructure.adapter.ExecutionResult;
import fr.lapetina.qos.infrastructure.adapter.QosCommandRequest;
import fr.lapetina.qos.infrastructure.adapter.VendorAdapter;
import fr.lapetina.qos.infrastructure.adapter.VendorAdapterRegistry;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import fr.lapetina.qos.infrastructure.sdn.DeploymentReport;
import fr.lapetina.qos.infrastructure.sdn.SdnIntegrationService;
import fr.lapetina.qos.infrastructure.sdn.SwitchDeploymentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates a policy against a device interface, then applies it.
 *
 * <p>The call runs in two phases. Validation looks up the policy, device and interface,
 * checks the device capability, computes the queue configurations and renders the vendor
 * commands; nothing is touched on the device or in storage until it passes. Application
 * then replaces any active association on the same interface and direction, pushes the
 * configuration and records the new association only when the device accepted it.
 *
 * <p>OpenFlow devices are configured through the SDN controller instead of CLI commands.
 */
public final class ValidateAndApplyQosConfigUseCase {

    private static final Logger log = LoggerFactory.getLogger(ValidateAndApplyQosConfigUseCase.class);
    private static final String OPERATION = "apply_policy";

    private final PolicyRepository policies;
    private final NetworkDeviceRepository devices;
    private final InterfaceQosPolicyRepository associations;
    private final VendorAdapterRegistry adapters;
    private final CommandExecutionService executionService;
    private final SdnIntegrationService sdnService;
    private final QosMetricsRegistry metrics;
    private final Clock clock;

    private ValidateAndApplyQosConfigUseCase(Builder builder) {
        this.policies = Objects.requireNonNull(builder.policies, "Policy repository is required");
        this.devices = Objects.requireNonNull(builder.devices, "Device repository is required");
        this.associations = Objects.requireNonNull(builder.associations, "Association repository is required");
        this.adapters = builder.adapters != null ? builder.adapters : VendorAdapterRegistry.withDefaults();
        this.executionService = builder.executionService;
        this.sdnService = builder.sdnService;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
    }

    public QosConfigurationResult execute(ApplyQosRequest request) {
        MDC.put("policyId", request.policyId());
        MDC.put("deviceId", request.deviceId());
        try {
            PreparedConfiguration prepared = prepare(request);
            return apply(request, prepared);
        } catch (QosException e) {
            log.warn("Policy not applied: policy={}, device={}, interface={}, errorType={}, reason={}",
                    request.policyId(), request.deviceId(), request.interfaceName(), e.getErrorType(), e.getMessage());
            recordError(e.getErrorType());
            return QosConfigurationResult.fromException(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure applying policy: policy={}, device={}, interface={}",
                    request.policyId(), request.deviceId(), request.interfaceName(), e);
            recordError(ErrorType.INTERNAL_ERROR);
            return QosConfigurationResult.failure(ErrorType.INTERNAL_ERROR,
                    "Unexpected error: " + e.getMessage(), List.of(String.valueOf(e)));
        } finally {
            MDC.remove("policyId");
            MDC.remove("deviceId");
        }
    }

    private PreparedConfiguration prepare(ApplyQosRequest request) {
        QosPolicy policy = policies.findById(request.policyId())
                .orElseThrow(() -> new PolicyNotFoundException(request.policyId()));
        NetworkDevice device = devices.findById(request.deviceId())
                .orElseThrow(() -> new DeviceNotFoundException(request.deviceId()));
        if (device.findInterface(request.interfaceName()).isEmpty()) {
            throw new InterfaceNotFoundException(request.deviceId(), request.interfaceName());
        }
        if (!device.qosCapable()) {
            throw new UnsupportedDeviceException("Device " + device.id() + " does not support QoS");
        }

        PolicyValidator.validateOrThrow(policy);
        List<QueueConfiguration> configurations = QueueCalculations.calculate(request.algorithm(), policy, metrics);

        if (device.vendor() == DeviceVendor.OPENFLOW) {
            if (sdnService == null) {
                throw new UnsupportedDeviceException("No SDN controller configured for OpenFlow device " + device.id());
            }
            // Surfaces classifiers OpenFlow cannot express before anything is deployed
            sdnService.createPolicy(policy);
            return new PreparedConfiguration(policy, device, configurations, List.of());
        }

        VendorAdapter adapter = adapters.get(device.vendor());
        if (executionService == null) {
            throw new UnsupportedDeviceException("No command executor configured for device " + device.id());
        }
        List<String> commands = adapter.generate(new QosCommandRequest(request.interfaceName(), policy.name(),
                request.direction(), request.algorithm(), policy.bandwidthLimit(), configurations));
        log.debug("Commands generated: policy={}, device={}, vendor={}, count={}",
                policy.id(), device.id(), device.vendor(), commands.size());
        return new PreparedConfiguration(policy, device, configurations, commands);
    }

    private QosConfigurationResult apply(ApplyQosRequest request, PreparedConfiguration prepared) {
        List<String> warnings = new ArrayList<>();
        Optional<InterfaceQosPolicy> existing = associations.findActive(
                request.deviceId(), request.interfaceName(), request.direction());
        if (existing.isPresent()) {
            if (!request.reapplyIfExists()) {
                String message = "Policy " + existing.get().policyId() + " is already active on "
                        + request.interfaceName() + " (" + request.direction() + ")";
                recordError(ErrorType.ALREADY_APPLIED);
                return QosConfigurationResult.failure(ErrorType.ALREADY_APPLIED, message, List.of(message),
                        prepared.commands(), prepared.configurations());
            }
            removeExisting(existing.get(), prepared.device(), request);
            warnings.add("Replaced policy " + existing.get().policyId() + " previously active on "
                    + request.interfaceName());
        }

        if (prepared.device().vendor() == DeviceVendor.OPENFLOW) {
            DeploymentReport report = sdnService.deploy(prepared.policy(),
                    List.of(prepared.device().openFlowSwitchId()));
            if (!report.success()) {
                List<String> errors = report.failedSwitches().stream()
                        .map(s -> s.switchId() + ": " + s.error())
                        .toList();
                recordError(ErrorType.CONTROLLER_ERROR);
                return QosConfigurationResult.failure(ErrorType.CONTROLLER_ERROR,
                        String.format("SDN deployment failed: %d/%d flows installed",
                                report.successes(), report.attempts()),
                        errors, List.of(), prepared.configurations());
            }
            report.switches().stream()
                    .filter(s -> !s.isSuccess())
                    .map(SwitchDeploymentResult::error)
                    .forEach(warnings::add);
        } else {
            ExecutionResult result = executionService.execute(prepared.device().id(),
                    prepared.device().managementAddress(), prepared.device().vendor(), prepared.commands());
            if (!result.success()) {
                String reason = result.failureReason();
                recordError(ErrorType.CONFIGURATION_EXECUTION_ERROR);
                return QosConfigurationResult.failure(ErrorType.CONFIGURATION_EXECUTION_ERROR,
                        "Device rejected configuration: " + reason, List.of(reason),
                        prepared.commands(), prepared.configurations());
            }
        }

        associations.save(new InterfaceQosPolicy(request.deviceId(), request.interfaceName(),
                prepared.policy().id(), request.direction(), true, clock.instant()));
        log.info("Policy applied: policy={}, device={}, interface={}, direction={}, algorithm={}, classes={}",
                prepared.policy().id(), request.deviceId(), request.interfaceName(), request.direction(),
                request.algorithm(), prepared.configurations().size());
        return QosConfigurationResult.success(
                "Policy " + prepared.policy().name() + " applied to " + request.interfaceName(),
                prepared.commands(), prepared.configurations(), warnings);
    }

    /**
     * Takes the active association off the device, then marks it inactive.
     *
     * @throws ConfigurationExecutionException if the device refuses the removal
     */
    private void removeExisting(InterfaceQosPolicy existing, NetworkDevice device, ApplyQosRequest request) {
        if (device.vendor() == DeviceVendor.OPENFLOW) {
            if (sdnService.isDeployed(existing.policyId(), device.openFlowSwitchId())
                    && !sdnService.removePolicy(existing.policyId(), device.openFlowSwitchId())) {
                throw new ConfigurationExecutionException(
                        ErrorType.CONTROLLER_ERROR, device.id(),
                        "could not remove flows of policy " + existing.policyId(), null);
            }
        } else {
            Optional<QosPolicy> previous = policies.findById(existing.policyId());
            List<TrafficClass> classes = previous.map(QosPolicy::trafficClasses).orElse(List.of());
            String policyName = previous.map(QosPolicy::name).orElse(existing.policyId());
            List<String> removal = adapters.get(device.vendor())
                    .generateRemoval(existing.interfaceName(), policyName, existing.direction(), classes);
            ExecutionResult result = executionService.execute(device.id(), device.managementAddress(),
                    device.vendor(), removal);
            if (!result.success()) {
                throw new ConfigurationExecutionException(
                        ErrorType.CONFIGURATION_EXECUTION_ERROR, device.id(),
                        "removal of policy " + existing.policyId() + " failed: " + result.failureReason(), null);
            }
        }
        associations.save(existing.deactivate());
        log.info("Previous policy removed: policy={}, device={}, interface={}",
                existing.policyId(), device.id(), request.interfaceName());
    }

    private void recordError(ErrorType errorType) {
        if (metrics != null) {
            metrics.incrementErrorCount(OPERATION, errorType);
        }
    }

    private record PreparedConfiguration(
            QosPolicy policy,
            NetworkDevice device,
            List<QueueConfiguration> configurations,
            List<String> commands
    ) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PolicyRepository policies;
        private NetworkDeviceRepository devices;
        private InterfaceQosPolicyRepository associations;
        private VendorAdapterRegistry adapters;
        private CommandExecutionService executionService;
        private SdnIntegrationService sdnService;
        private QosMetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();

        public Builder policyRepository(PolicyRepository policies) {
            this.policies = policies;
            return this;
        }

        public Builder deviceRepository(NetworkDeviceRepository devices) {
            this.devices = devices;
            return this;
        }

        public Builder associationRepository(InterfaceQosPolicyRepository associations) {
            this.associations = associations;
            return this;
        }

        public Builder adapters(VendorAdapterRegistry adapters) {
            this.adapters = adapters;
            return this;
        }

        public Builder executionService(CommandExecutionService executionService) {
            this.executionService = executionService;
            return this;
        }

        public Builder sdnService(SdnIntegrationService sdnService) {
            this.sdnService = sdnService;
            return this;
        }

        public Builder metricsRegistry(QosMetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ValidateAndApplyQosConfigUseCase build() {
            return new ValidateAndApplyQosConfigUseCase(this);
        }
    }
}
