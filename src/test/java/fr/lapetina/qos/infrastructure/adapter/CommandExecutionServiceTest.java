package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.exception.ConfigurationExecutionException;
import fr.lapetina.qos.domain.model.DeviceVendor;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.infrastructure.config.QosConfig;
import fr.lapetina.qos.infrastructure.metrics.QosMetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandExecutionServiceTest {

    private static final List<String> COMMANDS = List.of("configure terminal", "end");

    private QosMetricsRegistry metrics;
    private final List<CommandExecutionService> services = new ArrayList<>();

    @BeforeEach
    void setUp() {
        metrics = new QosMetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        services.forEach(CommandExecutionService::close);
        metrics.close();
    }

    private CommandExecutionService service(CommandExecutor executor, Duration timeout, int failureThreshold) {
        QosConfig.CircuitBreakerConfig breaker = new QosConfig.CircuitBreakerConfig();
        breaker.setFailureThreshold(failureThreshold);
        CommandExecutionService service = CommandExecutionService.builder()
                .executor(executor)
                .commandTimeout(timeout)
                .maxParallelDevices(2)
                .circuitBreaker(breaker)
                .metricsRegistry(metrics)
                .build();
        services.add(service);
        return service;
    }

    private double counter(String name, String... tags) {
        return metrics.getRegistry().get(name).tags(tags).counter().count();
    }

    @Test
    @DisplayName("should pass host and commands to the executor")
    void shouldRunBatch() {
        List<String> received = new CopyOnWriteArrayList<>();
        CommandExecutionService service = service((host, commands) -> {
            received.add(host);
            received.addAll(commands);
            return ExecutionResult.success("ok");
        }, Duration.ofSeconds(5), 3);

        ExecutionResult result = service.execute("r1", "10.0.0.1", DeviceVendor.CISCO_IOS, COMMANDS);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("ok");
        assertThat(received).containsExactly("10.0.0.1", "configure terminal", "end");
        assertThat(counter("test_commands_executed_total", "vendor", "CISCO_IOS", "outcome", "success"))
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return a failed result without throwing and count it against the breaker")
    void shouldReturnFailedResult() {
        CommandExecutionService service = service((host, commands) -> ExecutionResult.failure("% Invalid input"),
                Duration.ofSeconds(5), 2);

        ExecutionResult first = service.execute("r1", "h", DeviceVendor.CISCO_IOS, COMMANDS);
        service.execute("r1", "h", DeviceVendor.CISCO_IOS, COMMANDS);

        assertThat(first.success()).isFalse();
        assertThat(first.error()).isEqualTo("% Invalid input");
        assertThat(service.getCircuitState("r1")).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("should reject batches once the device circuit is open")
    void shouldRejectWhenCircuitOpen() {
        List<String> calls = new CopyOnWriteArrayList<>();
        CommandExecutionService service = service((host, commands) -> {
            calls.add(host);
            return ExecutionResult.failure("refused");
        }, Duration.ofSeconds(5), 1);

        service.execute("r1", "h1", DeviceVendor.JUNIPER_JUNOS, COMMANDS);

        assertThatThrownBy(() -> service.execute("r1", "h1", DeviceVendor.JUNIPER_JUNOS, COMMANDS))
                .isInstanceOf(ConfigurationExecutionException.class)
                .satisfies(e -> assertThat(((ConfigurationExecutionException) e).getErrorType())
                        .isEqualTo(ErrorType.CIRCUIT_OPEN));
        assertThat(calls).hasSize(1);
        // Other devices keep their own breaker
        assertThat(service.getCircuitState("r2")).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("should time out and interrupt a hanging executor")
    void shouldTimeOut() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        CommandExecutionService service = service((host, commands) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return ExecutionResult.success("late");
        }, Duration.ofMillis(100), 3);

        assertThatThrownBy(() -> service.execute("r1", "h1", DeviceVendor.LINUX_TC, COMMANDS))
                .isInstanceOf(ConfigurationExecutionException.class)
                .satisfies(e -> assertThat(((ConfigurationExecutionException) e).getErrorType())
                        .isEqualTo(ErrorType.TIMEOUT));
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(counter("test_errors_total", "operation", "execute_commands", "type", "TIMEOUT"))
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should wrap executor exceptions")
    void shouldWrapExecutorException() {
        CommandExecutionService service = service((host, commands) -> {
            throw new IllegalStateException("ssh handshake failed");
        }, Duration.ofSeconds(5), 3);

        assertThatThrownBy(() -> service.execute("r1", "h1", DeviceVendor.CISCO_IOS, COMMANDS))
                .isInstanceOf(ConfigurationExecutionException.class)
                .hasMessageContaining("ssh handshake failed")
                .satisfies(e -> assertThat(((ConfigurationExecutionException) e).getErrorType())
                        .isEqualTo(ErrorType.CONFIGURATION_EXECUTION_ERROR));
    }

    @Test
    @DisplayName("should require an executor")
    void shouldRequireExecutor() {
        assertThatThrownBy(() -> CommandExecutionService.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }
}
