package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.infrastructure.config.QosConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-device circuit breaker guarding command execution.
 *
 * States:
 * - CLOSED: commands are sent to the device
 * - OPEN: the device failed too often, commands are rejected without a connection attempt
 * - HALF_OPEN: the recovery timeout elapsed, trial commands are let through
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String deviceId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThreshold;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(String deviceId, int failureThreshold, Duration recoveryTimeout,
                          int successThreshold, Clock clock) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be at least 1");
        }
        this.deviceId = deviceId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThreshold = successThreshold;
        this.clock = clock;
    }

    public static CircuitBreaker fromConfig(String deviceId, QosConfig.CircuitBreakerConfig config, Clock clock) {
        return new CircuitBreaker(deviceId, config.getFailureThreshold(),
                Duration.ofMillis(config.getRecoveryTimeoutMs()), config.getSuccessThreshold(), clock);
    }

    /**
     * @return true if a command may be sent to the device now
     */
    public boolean allowRequest() {
        return switch (currentState()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> false;
        };
    }

    public void recordSuccess() {
        State current = currentState();
        if (current == State.CLOSED) {
            consecutiveFailures.set(0);
        } else if (current == State.HALF_OPEN
                && halfOpenSuccesses.incrementAndGet() >= successThreshold
                && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            consecutiveFailures.set(0);
            log.info("Circuit breaker CLOSED after recovery: deviceId={}", deviceId);
        }
    }

    public void recordFailure() {
        State current = currentState();
        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED (trial command failed): deviceId={}", deviceId);
            }
            return;
        }
        if (current == State.CLOSED) {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED: deviceId={}, failures={}", deviceId, failures);
            }
        }
    }

    public State getState() {
        return currentState();
    }

    /**
     * Moves OPEN to HALF_OPEN once the recovery timeout has elapsed.
     */
    private State currentState() {
        Instant opened = openedAt;
        if (state.get() == State.OPEN && opened != null
                && !clock.instant().isBefore(opened.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            halfOpenSuccesses.set(0);
            log.info("Circuit breaker HALF_OPEN: deviceId={}", deviceId);
        }
        return state.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getDeviceId() {
        return deviceId;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{deviceId='" + deviceId + "', state=" + state.get()
                + ", failures=" + consecutiveFailures.get() + '}';
    }
}
