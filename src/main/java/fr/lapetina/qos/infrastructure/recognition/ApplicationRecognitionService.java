package fr.lapetina.qos.infrastructure.recognition;

import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.infrastructure.config.QosConfig;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks live flows and identifies the application behind them.
 *
 * Every packet is folded into its flow (keyed by 5-tuple); classification runs the port,
 * payload, behavioral and header classifiers on a snapshot of the flow and fuses their
 * results. Flows idle for longer than the inactivity window are evicted by a background
 * {@code flow-cleanup} task once {@link #start()} has been called.
 *
 * Thread-safe: the flow table is a concurrent map updated per key through {@code compute}.
 */
public final class ApplicationRecognitionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApplicationRecognitionService.class);

    private final ConcurrentHashMap<FlowKey, TrafficFlow> flows = new ConcurrentHashMap<>();
    private final List<ApplicationSignature> signatures;
    private final List<ApplicationClassifier> classifiers;
    private final QosTemplateCatalog templates;
    private final QosMetricsRegistry metrics;
    private final Clock clock;
    private final Duration inactivityTimeout;
    private final Duration cleanupInterval;
    private final int maxPayloadSamples;
    private final int payloadSampleBytes;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService cleanupExecutor;

    private ApplicationRecognitionService(Builder builder) {
        this.signatures = List.copyOf(builder.signatures);
        this.classifiers = List.copyOf(builder.classifiers);
        this.templates = builder.templates;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.inactivityTimeout = builder.inactivityTimeout;
        this.cleanupInterval = builder.cleanupInterval;
        this.maxPayloadSamples = builder.maxPayloadSamples;
        this.payloadSampleBytes = builder.payloadSampleBytes;

        log.info("ApplicationRecognitionService created: signatures={}, inactivityTimeout={}, cleanupInterval={}",
                signatures.size(), inactivityTimeout, cleanupInterval);
    }

    /**
     * Schedules periodic eviction of inactive flows.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "flow-cleanup");
                t.setDaemon(true);
                return t;
            });
            long periodMs = cleanupInterval.toMillis();
            cleanupExecutor.scheduleAtFixedRate(this::runCleanup, periodMs, periodMs, TimeUnit.MILLISECONDS);
            log.info("Flow cleanup scheduled every {}", cleanupInterval);
        }
    }

    private void runCleanup() {
        try {
            cleanupInactiveFlows();
        } catch (RuntimeException e) {
            log.error("Flow cleanup failed", e);
        }
    }

    /**
     * Folds a packet into its flow, creating the flow on first sight.
     *
     * @return the key of the updated flow
     */
    public FlowKey observe(Packet packet) {
        FlowKey key = FlowKey.of(packet);
        flows.compute(key, (k, flow) -> {
            TrafficFlow target = flow != null ? flow : new TrafficFlow(packet, maxPayloadSamples, payloadSampleBytes);
            target.record(packet);
            return target;
        });
        if (metrics != null) {
            metrics.setActiveFlows(flows.size());
        }
        return key;
    }

    /**
     * Records the packet and classifies its flow.
     *
     * Never throws: an unexpected failure yields {@link ApplicationClassification#error(String)}.
     */
    public ApplicationClassification classify(Packet packet) {
        try {
            FlowKey key = observe(packet);
            return classifyFlow(key).orElseGet(() -> ApplicationClassification.unknown("Flow evicted before classification"));
        } catch (RuntimeException e) {
            log.warn("Traffic classification failed: source={}:{}, destination={}:{}",
                    packet.sourceIp(), packet.sourcePort(), packet.destinationIp(), packet.destinationPort(), e);
            if (metrics != null) {
                metrics.incrementErrorCount("classify", ErrorType.INTERNAL_ERROR);
            }
            return ApplicationClassification.error(String.valueOf(e.getMessage()));
        }
    }

    /**
     * Classifies an already tracked flow, or returns empty when the flow is unknown.
     */
    public Optional<ApplicationClassification> classifyFlow(FlowKey key) {
        TrafficFlow flow = flows.get(key);
        if (flow == null) {
            return Optional.empty();
        }
        TrafficFlow.Snapshot snapshot = flow.snapshot();

        List<ClassificationResult> results = new ArrayList<>(classifiers.size());
        for (ApplicationClassifier classifier : classifiers) {
            classifier.classify(snapshot, signatures).ifPresent(results::add);
        }
        ApplicationClassification classification = ConfidenceFusion.fuse(results);

        if (classification.isKnown()) {
            flow.setLastApplication(classification.application());
        }
        if (metrics != null) {
            metrics.incrementClassification(classification.application(), classification.method());
        }
        log.debug("Flow classified: flowId={}, application={}, confidence={}, methods={}",
                snapshot.flowId(), classification.application(), classification.confidence(),
                classification.methodsUsed());
        return Optional.of(classification);
    }

    /**
     * Suggests a QoS template for a traffic class or recognized category.
     */
    public QosTemplate suggestQosPolicy(String trafficClass) {
        QosTemplate template = templates.suggest(trafficClass);
        log.info("QoS template suggested: trafficClass={}, template={}", trafficClass, template.name());
        return template;
    }

    public List<String> getTrafficClasses() {
        return QosTemplateCatalog.TRAFFIC_CLASSES;
    }

    /**
     * Evicts every flow whose last packet is older than the inactivity window.
     *
     * @return number of evicted flows
     */
    public int cleanupInactiveFlows() {
        Instant cutoff = clock.instant().minus(inactivityTimeout);
        int removed = 0;
        for (Map.Entry<FlowKey, TrafficFlow> entry : flows.entrySet()) {
            // remove(key, value) keeps a flow that was replaced concurrently
            if (entry.getValue().lastSeen().isBefore(cutoff) && flows.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (metrics != null) {
            metrics.setActiveFlows(flows.size());
        }
        if (removed > 0) {
            log.info("Inactive flows evicted: removed={}, remaining={}", removed, flows.size());
        }
        return removed;
    }

    /**
     * Snapshots of all tracked flows, most recently active first.
     */
    public List<TrafficFlow.Snapshot> getActiveFlows() {
        return flows.values().stream()
                .map(TrafficFlow::snapshot)
                .sorted(Comparator.comparing(TrafficFlow.Snapshot::lastSeen).reversed())
                .toList();
    }

    public FlowStatistics getFlowStatistics() {
        long packets = 0;
        long bytes = 0;
        Map<String, Integer> perApplication = new TreeMap<>();
        for (TrafficFlow flow : flows.values()) {
            TrafficFlow.Snapshot snapshot = flow.snapshot();
            packets += snapshot.packetCount();
            bytes += snapshot.byteCount();
            String application = snapshot.lastApplication() != null
                    ? snapshot.lastApplication()
                    : ApplicationClassification.UNKNOWN_APPLICATION;
            perApplication.merge(application, 1, Integer::sum);
        }
        return new FlowStatistics(flows.size(), packets, bytes, perApplication);
    }

    public List<ApplicationSignature> getSignatures() {
        return signatures;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            cleanupExecutor.shutdown();
            try {
                if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    cleanupExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                cleanupExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("ApplicationRecognitionService stopped: trackedFlows={}", flows.size());
        }
    }

    /**
     * Aggregate view over the flow table.
     *
     * @param applicationFlows number of flows per last recognized application
     */
    public record FlowStatistics(int activeFlows, long totalPackets, long totalBytes,
                                 Map<String, Integer> applicationFlows) {
        public FlowStatistics {
            applicationFlows = Map.copyOf(applicationFlows);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<ApplicationSignature> signatures = List.of();
        // Order matters: it is the first-seen order fusion uses to break ties
        private List<ApplicationClassifier> classifiers = List.of(
                new PortClassifier(), new PayloadClassifier(), new BehavioralClassifier(), new HeaderClassifier());
        private QosTemplateCatalog templates = QosTemplateCatalog.builtIn();
        private QosMetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();
        private Duration inactivityTimeout = Duration.ofMinutes(30);
        private Duration cleanupInterval = Duration.ofSeconds(60);
        private int maxPayloadSamples = 10;
        private int payloadSampleBytes = 200;

        public Builder signatures(List<ApplicationSignature> signatures) {
            this.signatures = signatures;
            return this;
        }

        public Builder classifiers(List<ApplicationClassifier> classifiers) {
            this.classifiers = classifiers;
            return this;
        }

        public Builder templates(QosTemplateCatalog templates) {
            this.templates = templates;
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

        public Builder inactivityTimeout(Duration inactivityTimeout) {
            this.inactivityTimeout = inactivityTimeout;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder maxPayloadSamples(int maxPayloadSamples) {
            this.maxPayloadSamples = maxPayloadSamples;
            return this;
        }

        public Builder payloadSampleBytes(int payloadSampleBytes) {
            this.payloadSampleBytes = payloadSampleBytes;
            return this;
        }

        public Builder fromConfig(QosConfig.RecognitionConfig config) {
            this.inactivityTimeout = Duration.ofMinutes(config.getFlowInactivityMinutes());
            this.cleanupInterval = Duration.ofSeconds(config.getCleanupIntervalSeconds());
            this.maxPayloadSamples = config.getMaxPayloadSamples();
            this.payloadSampleBytes = config.getPayloadSampleBytes();
            return this;
        }

        public ApplicationRecognitionService build() {
            if (signatures == null || classifiers == null || templates == null || clock == null) {
                throw new IllegalStateException("Signatures, classifiers, templates and clock are required");
            }
            if (inactivityTimeout.isNegative() || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
                throw new IllegalStateException("Invalid flow retention settings");
            }
            return new ApplicationRecognitionService(this);
        }
    }
}
