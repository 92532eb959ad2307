package fr.lapetina.qos.infrastructure.config;

/**
 * Root configuration object for the QoS engine.
 * Populated from YAML.
 */
public class QosConfig {

    private RecognitionConfig recognition = new RecognitionConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private SdnConfig sdn = new SdnConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public RecognitionConfig getRecognition() { return recognition; }
    public void setRecognition(RecognitionConfig recognition) { this.recognition = recognition; }

    public IngestionConfig getIngestion() { return ingestion; }
    public void setIngestion(IngestionConfig ingestion) { this.ingestion = ingestion; }

    public ExecutionConfig getExecution() { return execution; }
    public void setExecution(ExecutionConfig execution) { this.execution = execution; }

    public SdnConfig getSdn() { return sdn; }
    public void setSdn(SdnConfig sdn) { this.sdn = sdn; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Application recognition settings.
     */
    public static class RecognitionConfig {
        private String signaturesResource = "application-signatures.yaml";
        private long flowInactivityMinutes = 30;
        private long cleanupIntervalSeconds = 60;
        private int maxPayloadSamples = 10;
        private int payloadSampleBytes = 200;
        private double confidenceThreshold = 0.7;

        public String getSignaturesResource() { return signaturesResource; }
        public void setSignaturesResource(String signaturesResource) { this.signaturesResource = signaturesResource; }

        public long getFlowInactivityMinutes() { return flowInactivityMinutes; }
        public void setFlowInactivityMinutes(long flowInactivityMinutes) { this.flowInactivityMinutes = flowInactivityMinutes; }

        public long getCleanupIntervalSeconds() { return cleanupIntervalSeconds; }
        public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) { this.cleanupIntervalSeconds = cleanupIntervalSeconds; }

        public int getMaxPayloadSamples() { return maxPayloadSamples; }
        public void setMaxPayloadSamples(int maxPayloadSamples) { this.maxPayloadSamples = maxPayloadSamples; }

        public int getPayloadSampleBytes() { return payloadSampleBytes; }
        public void setPayloadSampleBytes(int payloadSampleBytes) { this.payloadSampleBytes = payloadSampleBytes; }

        public double getConfidenceThreshold() { return confidenceThreshold; }
        public void setConfidenceThreshold(double confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; }
    }

    /**
     * Packet ingestion ring buffer settings.
     */
    public static class IngestionConfig {
        private int ringBufferSize = 4096;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Device command execution settings.
     */
    public static class ExecutionConfig {
        private long commandTimeoutMs = 30000;
        private int maxParallelDevices = 4;
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        public long getCommandTimeoutMs() { return commandTimeoutMs; }
        public void setCommandTimeoutMs(long commandTimeoutMs) { this.commandTimeoutMs = commandTimeoutMs; }

        public int getMaxParallelDevices() { return maxParallelDevices; }
        public void setMaxParallelDevices(int maxParallelDevices) { this.maxParallelDevices = maxParallelDevices; }

        public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
        public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    }

    /**
     * Per-device circuit breaker thresholds.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 3;
        private long recoveryTimeoutMs = 60000;
        private int successThreshold = 1;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }
    }

    /**
     * SDN controller settings.
     */
    public static class SdnConfig {
        private boolean enabled = false;
        private String controllerType = "ONOS";
        private String baseUrl = "http://localhost:8181";
        private String username;
        private String password;
        private long requestTimeoutMs = 10000;
        private int maxConcurrentSwitches = 8;
        private long deploymentTimeoutMs = 120000;
        private int readRetries = 2;
        private double successThreshold = 0.8;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getControllerType() { return controllerType; }
        public void setControllerType(String controllerType) { this.controllerType = controllerType; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getMaxConcurrentSwitches() { return maxConcurrentSwitches; }
        public void setMaxConcurrentSwitches(int maxConcurrentSwitches) { this.maxConcurrentSwitches = maxConcurrentSwitches; }

        public long getDeploymentTimeoutMs() { return deploymentTimeoutMs; }
        public void setDeploymentTimeoutMs(long deploymentTimeoutMs) { this.deploymentTimeoutMs = deploymentTimeoutMs; }

        public int getReadRetries() { return readRetries; }
        public void setReadRetries(int readRetries) { this.readRetries = readRetries; }

        public double getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(double successThreshold) { this.successThreshold = successThreshold; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "qos";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
