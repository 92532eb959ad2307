package fr.lapetina.qos.infrastructure.sdn;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.qos.domain.exception.ConfigurationExecutionException;
import fr.lapetina.qos.domain.exception.PolicyNotFoundException;
import fr.lapetina.qos.domain.exception.QosException;
import fr.lapetina.qos.domain.exception.UnsupportedDeviceException;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.infrastructure.config.QosConfig;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralised QoS enforcement through an SDN controller.
 *
 * <p>Deployment installs, per switch, every queue, then every meter, then every flow of an
 * {@link SdnPolicy}. Switches are handled by a fixed pool of workers under an overall deadline;
 * a switch that fails never stops the others, and a switch whose queue or meter install fails
 * gets none of its flows. Only reads (topology, statistics) are retried.
 *
 * <p>Deployed policies are remembered by id so they can be monitored and removed later.
 */
public final class SdnIntegrationService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SdnIntegrationService.class);

    private final ControllerClient client;
    private final ControllerPayloads payloads;
    private final ExecutorService workers;
    private final Duration deploymentTimeout;
    private final int readRetries;
    private final double successThreshold;
    private final QosMetricsRegistry metrics;
    private final Clock clock;

    private final Map<String, Deployment> deployments = new ConcurrentHashMap<>();
    private final AtomicReference<SdnTopology> topologyCache = new AtomicReference<>();

    private SdnIntegrationService(Builder builder) {
        this.client = builder.client;
        this.payloads = ControllerPayloads.forType(builder.controllerType, builder.objectMapper);
        this.deploymentTimeout = builder.deploymentTimeout;
        this.readRetries = builder.readRetries;
        this.successThreshold = builder.successThreshold;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.workers = Executors.newFixedThreadPool(builder.maxConcurrentSwitches,
                new SwitchThreadFactory("sdn-deploy"));

        log.info("SdnIntegrationService created: controller={}, maxConcurrentSwitches={}, deploymentTimeout={}",
                builder.controllerType, builder.maxConcurrentSwitches, deploymentTimeout);
    }

    /**
     * @throws fr.lapetina.qos.domain.exception.ValidationException if a classifier has no OpenFlow equivalent
     */
    public SdnPolicy createPolicy(QosPolicy policy) {
        SdnPolicy sdnPolicy = SdnPolicy.from(policy);
        log.debug("SDN policy built: policyId={}, flows={}, queues={}, meters={}",
                sdnPolicy.policyId(), sdnPolicy.flows().size(), sdnPolicy.queues().size(), sdnPolicy.meters().size());
        return sdnPolicy;
    }

    public DeploymentReport deploy(QosPolicy policy, List<String> switches) {
        return deploy(createPolicy(policy), switches);
    }

    /**
     * Installs the policy on the given switches, or on every switch of the topology when the list is empty.
     *
     * @throws ConfigurationExecutionException if the topology has to be discovered and the controller fails
     */
    public DeploymentReport deploy(SdnPolicy policy, List<String> switches) {
        Instant start = clock.instant();
        List<String> targets = switches == null || switches.isEmpty()
                ? discoverTopology().switches()
                : List.copyOf(switches);
        log.info("SDN deployment started: policyId={}, switches={}, flowsPerSwitch={}",
                policy.policyId(), targets.size(), policy.flows().size());

        List<Callable<SwitchDeploymentResult>> tasks = new ArrayList<>(targets.size());
        for (String target : targets) {
            tasks.add(() -> deployToSwitch(policy, target));
        }

        List<SwitchDeploymentResult> results = new ArrayList<>(targets.size());
        try {
            // invokeAll cancels whatever has not finished at the deadline
            List<Future<SwitchDeploymentResult>> futures =
                    workers.invokeAll(tasks, deploymentTimeout.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(futures.get(i), targets.get(i), policy));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (int i = results.size(); i < targets.size(); i++) {
                results.add(SwitchDeploymentResult.failed(targets.get(i), policy.flows().size(), "deployment interrupted"));
            }
        }

        Map<String, List<String>> accepted = new LinkedHashMap<>();
        for (SwitchDeploymentResult result : results) {
            if (!result.flowIds().isEmpty()) {
                accepted.put(result.switchId(), result.flowIds());
            }
        }
        if (!accepted.isEmpty()) {
            deployments.merge(policy.policyId(), new Deployment(accepted), Deployment::plus);
        }

        DeploymentReport report = DeploymentReport.of(policy.policyId(), results, successThreshold,
                Duration.between(start, clock.instant()));
        if (metrics != null) {
            metrics.recordSdnDeployment(report.success(), report.successRate());
        }
        if (report.success()) {
            log.info("SDN deployment finished: policyId={}, successRate={}, attempts={}",
                    policy.policyId(), report.successRate(), report.attempts());
        } else {
            log.warn("SDN deployment failed: policyId={}, successRate={}, attempts={}, failedSwitches={}",
                    policy.policyId(), report.successRate(), report.attempts(), report.failedSwitches().size());
        }
        return report;
    }

    private SwitchDeploymentResult collect(Future<SwitchDeploymentResult> future, String switchId, SdnPolicy policy) {
        try {
            return future.get();
        } catch (CancellationException e) {
            log.warn("Switch deployment cancelled at deadline: switchId={}, timeout={}", switchId, deploymentTimeout);
            return SwitchDeploymentResult.failed(switchId, policy.flows().size(), "deployment deadline exceeded");
        } catch (ExecutionException e) {
            log.error("Switch deployment crashed: switchId={}", switchId, e.getCause());
            return SwitchDeploymentResult.failed(switchId, policy.flows().size(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SwitchDeploymentResult.failed(switchId, policy.flows().size(), "deployment interrupted");
        }
    }

    private SwitchDeploymentResult deployToSwitch(SdnPolicy policy, String switchId) {
        int flowCount = policy.flows().size();
        int queues = 0;
        for (SdnQueue queue : policy.queues()) {
            String error = install(payloads.installQueue(switchId, queue)).orElse(null);
            if (error != null) {
                log.warn("Queue install failed, skipping flows: switchId={}, queueId={}, error={}",
                        switchId, queue.queueId(), error);
                return new SwitchDeploymentResult(switchId, queues, 0, flowCount, 0, List.of(),
                        "queue " + queue.queueId() + ": " + error);
            }
            queues++;
        }

        int meters = 0;
        for (SdnMeter meter : policy.meters()) {
            String error = install(payloads.installMeter(switchId, meter)).orElse(null);
            if (error != null) {
                log.warn("Meter install failed, skipping flows: switchId={}, meterId={}, error={}",
                        switchId, meter.meterId(), error);
                return new SwitchDeploymentResult(switchId, queues, meters, flowCount, 0, List.of(),
                        "meter " + meter.meterId() + ": " + error);
            }
            meters++;
        }

        List<String> flowIds = new ArrayList<>();
        String firstError = null;
        int installed = 0;
        int index = 0;
        for (OpenFlowRule template : policy.flows()) {
            OpenFlowRule rule = template.onSwitch(switchId);
            String flowKey = policy.policyId() + "-" + (++index);
            String error;
            try {
                ControllerResponse response = client.send(payloads.installFlow(rule, flowKey));
                if (isInstalled(response)) {
                    installed++;
                    String flowId = payloads.installedFlowId(response, flowKey);
                    if (flowId != null) {
                        flowIds.add(flowId);
                    } else {
                        log.warn("Flow installed without identifier, it cannot be removed later: switchId={}, class={}",
                                switchId, rule.className());
                    }
                    continue;
                }
                error = "HTTP " + response.statusCode();
            } catch (QosException e) {
                error = e.getMessage();
            }
            log.debug("Flow install failed: switchId={}, flowKey={}, error={}", switchId, flowKey, error);
            if (firstError == null) {
                firstError = "flow " + flowKey + ": " + error;
            }
        }
        log.debug("Switch deployed: switchId={}, queues={}, meters={}, flows={}/{}",
                switchId, queues, meters, installed, flowCount);
        return new SwitchDeploymentResult(switchId, queues, meters, flowCount, installed, flowIds, firstError);
    }

    /**
     * @return the failure description, empty when the controller accepted the install
     */
    private Optional<String> install(ControllerRequest request) {
        try {
            ControllerResponse response = client.send(request);
            return isInstalled(response) ? Optional.empty() : Optional.of("HTTP " + response.statusCode());
        } catch (QosException e) {
            return Optional.of(e.getMessage());
        }
    }

    private static boolean isInstalled(ControllerResponse response) {
        return response.statusCode() == 200 || response.statusCode() == 201;
    }

    /**
     * Queries the controller for switches and links and refreshes the cached topology.
     *
     * @throws ConfigurationExecutionException if the controller keeps failing after retries
     */
    public SdnTopology discoverTopology() {
        List<String> bodies = new ArrayList<>();
        for (ControllerRequest request : payloads.topologyRequests()) {
            ControllerResponse response = readWithRetry(request);
            if (!response.isSuccess()) {
                throw new ConfigurationExecutionException(ErrorType.CONTROLLER_ERROR, payloads.type().name(),
                        "topology query " + request.path() + " answered HTTP " + response.statusCode(), null);
            }
            bodies.add(response.body());
        }
        SdnTopology topology = payloads.parseTopology(bodies, clock.instant());
        topologyCache.set(topology);
        log.info("Topology discovered: switches={}, links={}", topology.switches().size(), topology.links().size());
        return topology;
    }

    public Optional<SdnTopology> getCachedTopology() {
        return Optional.ofNullable(topologyCache.get());
    }

    /**
     * Collects flow counters of every switch the policy was deployed to.
     *
     * @throws PolicyNotFoundException if the policy was never deployed by this service
     */
    public PolicyStatistics monitor(String policyId) {
        Deployment deployment = deployments.get(policyId);
        if (deployment == null) {
            throw new PolicyNotFoundException(policyId);
        }
        Map<String, PolicyStatistics.SwitchStatistics> perSwitch = new LinkedHashMap<>();
        for (String switchId : deployment.flowIds().keySet()) {
            perSwitch.put(switchId, switchStatistics(switchId));
        }
        PolicyStatistics statistics = PolicyStatistics.aggregate(policyId, perSwitch, clock.instant());
        log.debug("Policy statistics collected: policyId={}, flows={}, bytes={}, packets={}",
                policyId, statistics.totalFlows(), statistics.totalBytes(), statistics.totalPackets());
        return statistics;
    }

    private PolicyStatistics.SwitchStatistics switchStatistics(String switchId) {
        try {
            ControllerResponse response = readWithRetry(payloads.flowStatistics(switchId));
            if (!response.isSuccess()) {
                return PolicyStatistics.SwitchStatistics.failed("HTTP " + response.statusCode());
            }
            return payloads.parseFlowStatistics(response.body());
        } catch (QosException e) {
            log.warn("Switch statistics unavailable: switchId={}, error={}", switchId, e.getMessage());
            return PolicyStatistics.SwitchStatistics.failed(e.getMessage());
        }
    }

    /**
     * Deletes every flow the policy installed, on every switch. The policy is forgotten once all
     * deletions succeed; flows whose deletion failed stay recorded.
     *
     * @return true if every known flow was deleted
     * @throws PolicyNotFoundException if the policy was never deployed by this service
     */
    public boolean removePolicy(String policyId) {
        Deployment deployment = deployments.get(policyId);
        if (deployment == null) {
            throw new PolicyNotFoundException(policyId);
        }
        boolean allRemoved = true;
        for (String switchId : deployment.flowIds().keySet()) {
            allRemoved &= removeFromSwitch(policyId, switchId);
        }
        return allRemoved;
    }

    /**
     * Deletes the flows the policy installed on one switch, leaving its other switches untouched.
     *
     * @return true if every flow known on that switch was deleted
     * @throws PolicyNotFoundException if the policy has no flow recorded on the switch
     */
    public boolean removePolicy(String policyId, String switchId) {
        if (!isDeployed(policyId, switchId)) {
            throw new PolicyNotFoundException(policyId);
        }
        return removeFromSwitch(policyId, switchId);
    }

    private boolean removeFromSwitch(String policyId, String switchId) {
        Deployment deployment = deployments.get(policyId);
        List<String> flowIds = deployment != null ? deployment.flowIds().getOrDefault(switchId, List.of()) : List.of();
        List<String> remaining = new ArrayList<>();
        for (String flowId : flowIds) {
            ControllerRequest request = payloads.removeFlow(switchId, 0, flowId);
            try {
                int status = client.send(request).statusCode();
                if (status != 200 && status != 204) {
                    remaining.add(flowId);
                    log.warn("Flow removal refused: switchId={}, flowId={}, status={}", switchId, flowId, status);
                }
            } catch (QosException e) {
                remaining.add(flowId);
                log.warn("Flow removal failed: switchId={}, flowId={}, error={}", switchId, flowId, e.getMessage());
            }
        }
        deployments.computeIfPresent(policyId, (id, current) -> current.withSwitch(switchId, remaining));
        if (remaining.isEmpty()) {
            log.info("SDN policy removed from switch: policyId={}, switchId={}", policyId, switchId);
        }
        return remaining.isEmpty();
    }

    public Set<String> getDeployedPolicies() {
        return Set.copyOf(deployments.keySet());
    }

    public boolean isDeployed(String policyId, String switchId) {
        Deployment deployment = deployments.get(policyId);
        return deployment != null && deployment.flowIds().containsKey(switchId);
    }

    private ControllerResponse readWithRetry(ControllerRequest request) {
        if (!request.method().isIdempotentRead()) {
            throw new IllegalArgumentException("Only GET requests are retried");
        }
        QosException lastError = null;
        ControllerResponse lastResponse = null;
        for (int attempt = 0; attempt <= readRetries; attempt++) {
            try {
                lastResponse = client.send(request);
                if (!lastResponse.isServerError()) {
                    return lastResponse;
                }
            } catch (QosException e) {
                lastError = e;
            }
            log.debug("Controller read failed, retrying: path={}, attempt={}", request.path(), attempt + 1);
        }
        if (lastResponse != null) {
            return lastResponse;
        }
        throw lastError;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Flow identifiers accepted by the controller, per switch. Switches without flows are not kept.
     */
    private record Deployment(Map<String, List<String>> flowIds) {

        Deployment plus(Deployment other) {
            Map<String, List<String>> merged = new LinkedHashMap<>(flowIds);
            other.flowIds.forEach((switchId, ids) -> merged.merge(switchId, ids, (known, added) -> {
                List<String> all = new ArrayList<>(known);
                added.stream().filter(id -> !all.contains(id)).forEach(all::add);
                return all;
            }));
            return new Deployment(merged);
        }

        /**
         * @return the deployment with the switch's flows replaced, or null when no switch is left
         */
        Deployment withSwitch(String switchId, List<String> remaining) {
            Map<String, List<String>> updated = new LinkedHashMap<>(flowIds);
            if (remaining.isEmpty()) {
                updated.remove(switchId);
            } else {
                updated.put(switchId, List.copyOf(remaining));
            }
            return updated.isEmpty() ? null : new Deployment(updated);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class SwitchThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        SwitchThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    public static final class Builder {
        private ControllerClient client;
        private ControllerType controllerType = ControllerType.ONOS;
        private ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        private int maxConcurrentSwitches = 8;
        private Duration deploymentTimeout = Duration.ofMinutes(2);
        private int readRetries = 2;
        private double successThreshold = 0.8;
        private QosMetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();

        public Builder client(ControllerClient client) {
            this.client = client;
            return this;
        }

        public Builder controllerType(ControllerType controllerType) {
            this.controllerType = controllerType;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder maxConcurrentSwitches(int maxConcurrentSwitches) {
            this.maxConcurrentSwitches = maxConcurrentSwitches;
            return this;
        }

        public Builder deploymentTimeout(Duration deploymentTimeout) {
            this.deploymentTimeout = deploymentTimeout;
            return this;
        }

        public Builder readRetries(int readRetries) {
            this.readRetries = readRetries;
            return this;
        }

        public Builder successThreshold(double successThreshold) {
            this.successThreshold = successThreshold;
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

        /**
         * Applies the SDN section. The controller client is still supplied separately.
         *
         * @throws UnsupportedDeviceException if the controller type is unknown
         */
        public Builder fromConfig(QosConfig.SdnConfig config) {
            this.controllerType = ControllerType.fromName(config.getControllerType())
                    .orElseThrow(() -> new UnsupportedDeviceException(
                            "Unknown SDN controller type: " + config.getControllerType()));
            this.maxConcurrentSwitches = config.getMaxConcurrentSwitches();
            this.deploymentTimeout = Duration.ofMillis(config.getDeploymentTimeoutMs());
            this.readRetries = config.getReadRetries();
            this.successThreshold = config.getSuccessThreshold();
            return this;
        }

        /**
         * @throws UnsupportedDeviceException if the controller type has no payload shapes
         */
        public SdnIntegrationService build() {
            if (client == null) {
                throw new IllegalStateException("ControllerClient is required");
            }
            if (maxConcurrentSwitches < 1 || readRetries < 0 || deploymentTimeout.isNegative()) {
                throw new IllegalStateException("Invalid SDN settings");
            }
            return new SdnIntegrationService(this);
        }
    }
}
