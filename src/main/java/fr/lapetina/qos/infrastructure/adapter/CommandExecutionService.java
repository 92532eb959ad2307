package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.exception.ConfigurationExecutionException;
import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.infrastructure.config.QosConfig;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs generated command batches on devices through a {@link CommandExecutor}.
 *
 * Each batch runs on a bounded worker pool and is abandoned (interrupted) once the
 * command timeout expires, so an unresponsive device never blocks its caller for
 * longer than that. Every device has its own {@link CircuitBreaker}: once open,
 * batches for that device are rejected immediately.
 */
public final class CommandExecutionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutionService.class);

    private final CommandExecutor executor;
    private final ExecutorService workers;
    private final Duration commandTimeout;
    private final QosConfig.CircuitBreakerConfig breakerConfig;
    private final QosMetricsRegistry metrics;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private CommandExecutionService(Builder builder) {
        this.executor = builder.executor;
        this.commandTimeout = builder.commandTimeout;
        this.breakerConfig = builder.breakerConfig;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.workers = Executors.newFixedThreadPool(builder.maxParallelDevices,
                new WorkerThreadFactory("command-executor"));

        log.info("CommandExecutionService created: maxParallelDevices={}, commandTimeout={}",
                builder.maxParallelDevices, commandTimeout);
    }

    /**
     * Runs the batch on the device and returns the executor's answer.
     *
     * A failed {@link ExecutionResult} is returned as is (and counted against the breaker).
     *
     * @throws ConfigurationExecutionException with {@link ErrorType#CIRCUIT_OPEN} when the device's breaker
     *         is open, {@link ErrorType#TIMEOUT} when the batch outlives the command timeout, or
     *         {@link ErrorType#CONFIGURATION_EXECUTION_ERROR} when the executor itself throws
     */
    public ExecutionResult execute(String deviceId, String host, DeviceVendor vendor, List<String> commands) {
        CircuitBreaker breaker = breakerFor(deviceId);
        if (!breaker.allowRequest()) {
            log.warn("Command batch rejected, circuit open: deviceId={}", deviceId);
            countError(ErrorType.CIRCUIT_OPEN);
            throw new ConfigurationExecutionException(ErrorType.CIRCUIT_OPEN, deviceId,
                    "circuit breaker open after repeated failures", null);
        }

        log.debug("Executing command batch: deviceId={}, host={}, vendor={}, commands={}",
                deviceId, host, vendor, commands.size());
        long start = System.nanoTime();
        Future<ExecutionResult> future = workers.submit(() -> executor.execute(host, commands));
        try {
            ExecutionResult result = future.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                result = ExecutionResult.failure("executor returned no result");
            }
            record(breaker, vendor, result.success());
            log.info("Command batch finished: deviceId={}, success={}, commands={}, durationMs={}",
                    deviceId, result.success(), commands.size(), (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            record(breaker, vendor, false);
            countError(ErrorType.TIMEOUT);
            log.warn("Command batch timed out: deviceId={}, timeout={}", deviceId, commandTimeout);
            throw new ConfigurationExecutionException(ErrorType.TIMEOUT, deviceId,
                    "no answer within " + commandTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            record(breaker, vendor, false);
            countError(ErrorType.CONFIGURATION_EXECUTION_ERROR);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Command executor failed: deviceId={}, error={}", deviceId, cause.getMessage());
            throw new ConfigurationExecutionException(ErrorType.CONFIGURATION_EXECUTION_ERROR, deviceId,
                    String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConfigurationExecutionException(ErrorType.CONFIGURATION_EXECUTION_ERROR, deviceId,
                    "interrupted while waiting for the device", e);
        }
    }

    public CircuitBreaker.State getCircuitState(String deviceId) {
        CircuitBreaker breaker = breakers.get(deviceId);
        return breaker != null ? breaker.getState() : CircuitBreaker.State.CLOSED;
    }

    CircuitBreaker breakerFor(String deviceId) {
        return breakers.computeIfAbsent(deviceId, id -> CircuitBreaker.fromConfig(id, breakerConfig, clock));
    }

    private void record(CircuitBreaker breaker, DeviceVendor vendor, boolean success) {
        if (success) {
            breaker.recordSuccess();
        } else {
            breaker.recordFailure();
        }
        if (metrics != null) {
            metrics.incrementCommandExecution(vendor.name(), success);
        }
    }

    private void countError(ErrorType errorType) {
        if (metrics != null) {
            metrics.incrementErrorCount("execute_commands", errorType);
        }
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

    public static Builder builder() {
        return new Builder();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
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
        private CommandExecutor executor;
        private Duration commandTimeout = Duration.ofSeconds(30);
        private int maxParallelDevices = 4;
        private QosConfig.CircuitBreakerConfig breakerConfig = new QosConfig.CircuitBreakerConfig();
        private QosMetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();

        public Builder executor(CommandExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder maxParallelDevices(int maxParallelDevices) {
            this.maxParallelDevices = maxParallelDevices;
            return this;
        }

        public Builder circuitBreaker(QosConfig.CircuitBreakerConfig breakerConfig) {
            this.breakerConfig = breakerConfig;
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

        public Builder fromConfig(QosConfig.ExecutionConfig config) {
            this.commandTimeout = Duration.ofMillis(config.getCommandTimeoutMs());
            this.maxParallelDevices = config.getMaxParallelDevices();
            this.breakerConfig = config.getCircuitBreaker();
            return this;
        }

        public CommandExecutionService build() {
            if (executor == null) {
                throw new IllegalStateException("CommandExecutor is required");
            }
            if (maxParallelDevices < 1 || commandTimeout.isZero() || commandTimeout.isNegative()) {
                throw new IllegalStateException("Invalid execution settings");
            }
            return new CommandExecutionService(this);
        }
    }
}
