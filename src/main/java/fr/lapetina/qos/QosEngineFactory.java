package fr.lapetina.qos;

import fr.lapetina.qos.application.CalculateBandwidthAllocationUseCase;
import fr.lapetina.qos.application.ConfigureCbwfqUseCase;
import fr.lapetina.qos.application.ConfigureLlqUseCase;
import fr.lapetina.qos.application.DeploySdnPolicyUseCase;
import fr.lapetina.qos.application.InterfaceQosPolicyRepository;
import fr.lapetina.qos.application.NetworkDeviceRepository;
import fr.lapetina.qos.application.PolicyRepository;
import fr.lapetina.qos.application.RemoveQosPolicyUseCase;
import fr.lapetina.qos.application.ValidateAndApplyQosConfigUseCase;
import fr.lapetina.qos.infrastructure.adapter.CommandExecutionService;
import fr.lapetina.qos.infrastructure.adapter.CommandExecutor;
import fr.lapetina.qos.infrastructure.adapter.VendorAdapterRegistry;
import fr.lapetina.qos.infrastructure.config.ConfigLoader;
import fr.lapetina.qos.infrastructure.config.QosConfig;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import fr.lapetina.qos.infrastructure.recognition.ApplicationRecognitionService;
import fr.lapetina.qos.infrastructure.recognition.ApplicationSignature;
import fr.lapetina.qos.infrastructure.recognition.SignatureLoader;
import fr.lapetina.qos.infrastructure.recognition.ingestion.FlowIngestionPipeline;
import fr.lapetina.qos.infrastructure.sdn.ControllerClient;
import fr.lapetina.qos.infrastructure.sdn.JdkControllerClient;
import fr.lapetina.qos.infrastructure.sdn.SdnIntegrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Wires the QoS engine from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (QosEngineFactory factory = QosEngineFactory.builder()
 *         .configPath("qos-config.yaml")
 *         .policyRepository(policies)
 *         .deviceRepository(devices)
 *         .associationRepository(associations)
 *         .commandExecutor(sshExecutor)
 *         .build()
 *         .start()) {
 *     QosConfigurationResult result = factory.getConfigureCbwfq()
 *             .execute("voice-policy", "router-1", "GigabitEthernet0/1", Direction.EGRESS);
 * }
 * }</pre>
 *
 * <p>Without a {@link CommandExecutor} CLI devices are reported as unsupported; the SDN
 * service exists only when the {@code sdn} section is enabled.
 */
public class QosEngineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QosEngineFactory.class);

    private final ConfigLoader configLoader;
    private final QosConfig config;
    private final QosMetricsRegistry metricsRegistry;
    private final ApplicationRecognitionService recognitionService;
    private final FlowIngestionPipeline ingestionPipeline;
    private final VendorAdapterRegistry adapters;
    private final CommandExecutionService executionService;
    private final SdnIntegrationService sdnService;

    private final ValidateAndApplyQosConfigUseCase applyUseCase;
    private final CalculateBandwidthAllocationUseCase allocationUseCase;
    private final ConfigureCbwfqUseCase configureCbwfq;
    private final ConfigureLlqUseCase configureLlq;
    private final RemoveQosPolicyUseCase removeUseCase;
    private final DeploySdnPolicyUseCase deploySdnUseCase;

    protected QosEngineFactory(Builder builder) {
        log.info("Initializing QosEngineFactory from config: {}", builder.configPath);

        this.configLoader = new ConfigLoader(builder.configPath);
        this.config = configLoader.load();

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new QosMetricsRegistry(config.getMetrics().getPrefix())
                : null;

        List<ApplicationSignature> signatures = new SignatureLoader(config.getRecognition().getConfidenceThreshold())
                .load(config.getRecognition().getSignaturesResource());
        this.recognitionService = ApplicationRecognitionService.builder()
                .fromConfig(config.getRecognition())
                .signatures(signatures)
                .metricsRegistry(metricsRegistry)
                .clock(builder.clock)
                .build();
        this.ingestionPipeline = FlowIngestionPipeline.builder()
                .fromConfig(config.getIngestion())
                .recognitionService(recognitionService)
                .build();

        this.adapters = VendorAdapterRegistry.withDefaults();
        this.executionService = builder.commandExecutor != null
                ? CommandExecutionService.builder()
                        .fromConfig(config.getExecution())
                        .executor(builder.commandExecutor)
                        .metricsRegistry(metricsRegistry)
                        .clock(builder.clock)
                        .build()
                : null;
        this.sdnService = config.getSdn().isEnabled() ? createSdnService(builder) : null;

        this.applyUseCase = ValidateAndApplyQosConfigUseCase.builder()
                .policyRepository(builder.policies)
                .deviceRepository(builder.devices)
                .associationRepository(builder.associations)
                .adapters(adapters)
                .executionService(executionService)
                .sdnService(sdnService)
                .metricsRegistry(metricsRegistry)
                .clock(builder.clock)
                .build();
        this.allocationUseCase = new CalculateBandwidthAllocationUseCase(builder.policies, metricsRegistry);
        this.configureCbwfq = new ConfigureCbwfqUseCase(applyUseCase, allocationUseCase);
        this.configureLlq = new ConfigureLlqUseCase(applyUseCase, allocationUseCase);
        this.removeUseCase = new RemoveQosPolicyUseCase(builder.policies, builder.devices, builder.associations,
                adapters, executionService, sdnService, metricsRegistry);
        this.deploySdnUseCase = sdnService != null
                ? new DeploySdnPolicyUseCase(builder.policies, sdnService, metricsRegistry)
                : null;

        configLoader.addListener(this::onConfigChanged);

        log.info("QosEngineFactory initialized: signatures={}, cliExecution={}, sdn={}",
                signatures.size(), executionService != null, sdnService != null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts flow cleanup, the ingestion pipeline and configuration watching.
     */
    public QosEngineFactory start() {
        recognitionService.start();
        ingestionPipeline.start();
        configLoader.startWatching();
        log.info("QoS engine started");
        return this;
    }

    public QosConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * @return the registry, or null when metrics are disabled
     */
    public QosMetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ApplicationRecognitionService getRecognitionService() {
        return recognitionService;
    }

    public FlowIngestionPipeline getIngestionPipeline() {
        return ingestionPipeline;
    }

    public VendorAdapterRegistry getAdapters() {
        return adapters;
    }

    public SdnIntegrationService getSdnService() {
        return sdnService;
    }

    public ValidateAndApplyQosConfigUseCase getApplyUseCase() {
        return applyUseCase;
    }

    public CalculateBandwidthAllocationUseCase getAllocationUseCase() {
        return allocationUseCase;
    }

    public ConfigureCbwfqUseCase getConfigureCbwfq() {
        return configureCbwfq;
    }

    public ConfigureLlqUseCase getConfigureLlq() {
        return configureLlq;
    }

    public RemoveQosPolicyUseCase getRemoveUseCase() {
        return removeUseCase;
    }

    /**
     * @return the use case, or null when the SDN section is disabled
     */
    public DeploySdnPolicyUseCase getDeploySdnUseCase() {
        return deploySdnUseCase;
    }

    private SdnIntegrationService createSdnService(Builder builder) {
        ControllerClient client = builder.controllerClient != null
                ? builder.controllerClient
                : JdkControllerClient.fromConfig(config.getSdn());
        return SdnIntegrationService.builder()
                .fromConfig(config.getSdn())
                .client(client)
                .metricsRegistry(metricsRegistry)
                .clock(builder.clock)
                .build();
    }

    private void onConfigChanged(QosConfig oldConfig, QosConfig newConfig) {
        if (oldConfig != null && !Objects.equals(oldConfig.getSdn().getBaseUrl(), newConfig.getSdn().getBaseUrl())) {
            log.warn("SDN controller URL changed to {}, restart the engine to apply it",
                    newConfig.getSdn().getBaseUrl());
        }
        if (oldConfig != null && oldConfig.getExecution().getMaxParallelDevices()
                != newConfig.getExecution().getMaxParallelDevices()) {
            log.warn("Execution pool size changed to {}, restart the engine to apply it",
                    newConfig.getExecution().getMaxParallelDevices());
        }
    }

    @Override
    public void close() {
        log.info("Closing QosEngineFactory");
        ingestionPipeline.close();
        recognitionService.close();
        if (executionService != null) {
            executionService.close();
        }
        if (sdnService != null) {
            sdnService.close();
        }
        configLoader.close();
        if (metricsRegistry != null) {
            metricsRegistry.close();
        }
    }

    public static final class Builder {
        private String configPath = ConfigLoader.DEFAULT_LOCATION;
        private PolicyRepository policies;
        private NetworkDeviceRepository devices;
        private InterfaceQosPolicyRepository associations;
        private CommandExecutor commandExecutor;
        private ControllerClient controllerClient;
        private Clock clock = Clock.systemUTC();

        public Builder configPath(String configPath) {
            this.configPath = configPath;
            return this;
        }

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

        public Builder commandExecutor(CommandExecutor commandExecutor) {
            this.commandExecutor = commandExecutor;
            return this;
        }

        /**
         * Replaces the HTTP client built from the {@code sdn} section.
         */
        public Builder controllerClient(ControllerClient controllerClient) {
            this.controllerClient = controllerClient;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public QosEngineFactory build() {
            if (policies == null || devices == null || associations == null) {
                throw new IllegalStateException("Policy, device and association repositories are required");
            }
            return new QosEngineFactory(this);
        }
    }
}
