package fr.lapetina.qos.infrastructure.metrics;

import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized QoS metrics using Micrometer.
 *
 * Provides:
 * - Algorithm calculation counters and latency per algorithm
 * - Classification counters per application and method
 * - Command execution counters per vendor
 * - SDN deployment outcome counters and last success rate
 * - Prometheus exposition
 */
public final class QosMetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QosMetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> calculationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> calculationTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> classificationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> deploymentCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    private final AtomicInteger activeFlows = new AtomicInteger(0);
    // Success rate scaled by 1000 to keep an atomic integral value
    private final AtomicLong sdnSuccessRatePermille = new AtomicLong(0);

    public QosMetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_active_flows", activeFlows, AtomicInteger::get)
                .description("Flows currently tracked by application recognition")
                .register(registry);

        Gauge.builder(prefix + "_sdn_success_rate", sdnSuccessRatePermille, v -> v.get() / 1000.0)
                .description("Success rate of the last SDN deployment")
                .register(registry);

        log.info("QosMetricsRegistry initialized with prefix: {}", prefix);
    }

    public QosMetricsRegistry() {
        this("qos");
    }

    /**
     * Records one queue algorithm evaluation.
     */
    public void recordCalculation(QueueAlgorithmType algorithm, boolean success, Duration latency) {
        String outcome = success ? "success" : "rejected";
        calculationCounters.computeIfAbsent(algorithm.name() + ":" + outcome, k ->
                Counter.builder(prefix + "_algorithm_calculations_total")
                        .description("Queue algorithm evaluations")
                        .tag("algorithm", algorithm.getConfigName())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
        calculationTimers.computeIfAbsent(algorithm.name(), k ->
                Timer.builder(prefix + "_algorithm_latency")
                        .description("Queue algorithm evaluation latency")
                        .tag("algorithm", algorithm.getConfigName())
                        .register(registry)
        ).record(latency);
    }

    public void incrementClassification(String application, String method) {
        classificationCounters.computeIfAbsent(application + ":" + method, k ->
                Counter.builder(prefix + "_classifications_total")
                        .description("Traffic classifications")
                        .tag("application", application)
                        .tag("method", method)
                        .register(registry)
        ).increment();
    }

    public void incrementCommandExecution(String vendor, boolean success) {
        String outcome = success ? "success" : "failure";
        commandCounters.computeIfAbsent(vendor + ":" + outcome, k ->
                Counter.builder(prefix + "_commands_executed_total")
                        .description("Command batches executed on devices")
                        .tag("vendor", vendor)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordSdnDeployment(boolean success, double successRate) {
        String outcome = success ? "success" : "failure";
        deploymentCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_sdn_deployments_total")
                        .description("SDN policy deployments")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
        sdnSuccessRatePermille.set(Math.round(successRate * 1000));
    }

    public void incrementErrorCount(String operation, ErrorType errorType) {
        errorCounters.computeIfAbsent(operation + ":" + errorType.name(), k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Failed QoS operations")
                        .tag("operation", operation)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void setActiveFlows(int value) {
        activeFlows.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
