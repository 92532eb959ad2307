package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.exception.DeviceNotFoundException;
import fr.lapetina.qos.domain.exception.QosException;
import fr.lapetina.qos.domain.exception.UnsupportedDeviceException;
import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.InterfaceQosPolicy;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.TrafficClass;
import fr.lapetina.qos.infrastructure.adapter.CommandExecutionService;
import fr.lapetina.qos.infrastructure.adapter.ExecutionResult;
import fr.lapetina.qos.infrastructure.adapter.VendorAdapterRegistry;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import fr.lapetina.qos.infrastructure.sdn.SdnIntegrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detaches the active policy from an interface and marks the association inactive.
 */
public final class RemoveQosPolicyUseCase {

    private static final Logger log = LoggerFactory.getLogger(RemoveQosPolicyUseCase.class);
    private static final String OPERATION = "remove_policy";

    private final PolicyRepository policies;
    private final NetworkDeviceRepository devices;
    private final InterfaceQosPolicyRepository associations;
    private final VendorAdapterRegistry adapters;
    private final CommandExecutionService executionService;
    private final SdnIntegrationService sdnService;
    private final QosMetricsRegistry metrics;

    public RemoveQosPolicyUseCase(PolicyRepository policies, NetworkDeviceRepository devices,
                                  InterfaceQosPolicyRepository associations, VendorAdapterRegistry adapters,
                                  CommandExecutionService executionService, SdnIntegrationService sdnService,
                                  QosMetricsRegistry metrics) {
        this.policies = Objects.requireNonNull(policies, "Policy repository is required");
        this.devices = Objects.requireNonNull(devices, "Device repository is required");
        this.associations = Objects.requireNonNull(associations, "Association repository is required");
        this.adapters = adapters != null ? adapters : VendorAdapterRegistry.withDefaults();
        this.executionService = executionService;
        this.sdnService = sdnService;
        this.metrics = metrics;
    }

    public QosConfigurationResult execute(String deviceId, String interfaceName, Direction direction) {
        Direction effective = direction != null ? direction : Direction.EGRESS;
        MDC.put("deviceId", deviceId);
        try {
            NetworkDevice device = devices.findById(deviceId)
                    .orElseThrow(() -> new DeviceNotFoundException(deviceId));
            Optional<InterfaceQosPolicy> active = associations.findActive(deviceId, interfaceName, effective);
            if (active.isEmpty()) {
                String message = "No active policy on " + interfaceName + " (" + effective + ")";
                recordError(ErrorType.POLICY_NOT_FOUND);
                return QosConfigurationResult.failure(ErrorType.POLICY_NOT_FOUND, message, List.of(message));
            }
            InterfaceQosPolicy association = active.get();
            MDC.put("policyId", association.policyId());

            List<String> commands = List.of();
            if (device.vendor() == DeviceVendor.OPENFLOW) {
                if (sdnService == null) {
                    throw new UnsupportedDeviceException("No SDN controller configured for OpenFlow device " + deviceId);
                }
                if (sdnService.isDeployed(association.policyId(), device.openFlowSwitchId())
                        && !sdnService.removePolicy(association.policyId(), device.openFlowSwitchId())) {
                    recordError(ErrorType.CONTROLLER_ERROR);
                    return QosConfigurationResult.failure(ErrorType.CONTROLLER_ERROR,
                            "Some flows of policy " + association.policyId() + " could not be removed",
                            List.of(association.policyId()));
                }
            } else {
                if (executionService == null) {
                    throw new UnsupportedDeviceException("No command executor configured for device " + deviceId);
                }
                Optional<QosPolicy> policy = policies.findById(association.policyId());
                List<TrafficClass> classes = policy.map(QosPolicy::trafficClasses).orElse(List.of());
                commands = adapters.get(device.vendor()).generateRemoval(interfaceName,
                        policy.map(QosPolicy::name).orElse(association.policyId()), effective, classes);
                ExecutionResult result = executionService.execute(deviceId, device.managementAddress(),
                        device.vendor(), commands);
                if (!result.success()) {
                    String reason = result.failureReason();
                    recordError(ErrorType.CONFIGURATION_EXECUTION_ERROR);
                    return QosConfigurationResult.failure(ErrorType.CONFIGURATION_EXECUTION_ERROR,
                            "Device rejected removal: " + reason, List.of(reason),
                            commands, List.of());
                }
            }

            associations.save(association.deactivate());
            log.info("Policy removed: policy={}, device={}, interface={}, direction={}",
                    association.policyId(), deviceId, interfaceName, effective);
            return QosConfigurationResult.success("Policy " + association.policyId() + " removed from "
                    + interfaceName, commands, List.of(), List.of());
        } catch (QosException e) {
            log.warn("Policy not removed: device={}, interface={}, errorType={}, reason={}",
                    deviceId, interfaceName, e.getErrorType(), e.getMessage());
            recordError(e.getErrorType());
            return QosConfigurationResult.fromException(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure removing policy: device={}, interface={}", deviceId, interfaceName, e);
            recordError(ErrorType.INTERNAL_ERROR);
            return QosConfigurationResult.failure(ErrorType.INTERNAL_ERROR,
                    "Unexpected error: " + e.getMessage(), List.of(String.valueOf(e)));
        } finally {
            MDC.remove("policyId");
            MDC.remove("deviceId");
        }
    }

    private void recordError(ErrorType errorType) {
        if (metrics != null) {
            metrics.incrementErrorCount(OPERATION, errorType);
        }
    }
}
