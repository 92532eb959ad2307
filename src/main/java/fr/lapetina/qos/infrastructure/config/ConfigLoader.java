package fr.lapetina.qos.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link QosConfig} from YAML, with optional hot reload.
 *
 * The location is looked up on the file system first, then on the classpath. An empty
 * document yields the defaults. Every successful load is checked by {@link #validate}
 * and then announced to the registered listeners.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_LOCATION = "qos-config.yaml";

    private final AtomicReference<QosConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(QosConfig.class, new LoaderOptions()));
    }

    public ConfigLoader() {
        this(DEFAULT_LOCATION);
    }

    /**
     * Loads the configuration and makes it current.
     *
     * @throws ConfigurationException if the document is missing, unreadable or invalid
     */
    public QosConfig load() {
        return publish(readFromLocation());
    }

    /**
     * Loads the configuration from a stream and makes it current.
     */
    public QosConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    public QosConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Reloads the configuration, keeping the current one when the new document is rejected.
     */
    public QosConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration reload rejected, keeping current: location={}", configPath, e);
            return currentConfig.get();
        }
    }

    /**
     * Polls the configuration file for modifications on a daemon {@code config-watcher} thread.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });
            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to watch configuration file: " + configPath, e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed != null && changed.equals(configPath.getFileName())
                        && Files.getLastModifiedTime(configPath).toMillis() > lastModified) {
                    log.info("Configuration file changed, reloading: {}", configPath);
                    reload();
                }
            }
            key.reset();
        } catch (IOException | RuntimeException e) {
            log.error("Error checking for configuration changes", e);
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private QosConfig publish(QosConfig config) {
        QosConfig previous = currentConfig.getAndSet(config);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
        return config;
    }

    private QosConfig readFromLocation() {
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                log.info("Loading configuration from file: {}", configPath);
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Configuration file not found: " + configPath);
            }
            log.info("Loading configuration from classpath: {}", resource);
            return parse(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }
    }

    private QosConfig parse(InputStream inputStream, String source) {
        QosConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source, e);
        }
        if (config == null) {
            config = createDefault();
        }
        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + String.join("; ", problems));
        }
        return config;
    }

    /**
     * Checks the values that would otherwise fail late, deep inside a service.
     */
    static List<String> validate(QosConfig config) {
        List<String> problems = new ArrayList<>();
        int ringBufferSize = config.getIngestion().getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            problems.add("ingestion.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
        double threshold = config.getRecognition().getConfidenceThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            problems.add("recognition.confidenceThreshold must be within [0, 1]: " + threshold);
        }
        if (config.getRecognition().getCleanupIntervalSeconds() <= 0) {
            problems.add("recognition.cleanupIntervalSeconds must be positive");
        }
        if (config.getExecution().getCommandTimeoutMs() <= 0) {
            problems.add("execution.commandTimeoutMs must be positive");
        }
        if (config.getExecution().getMaxParallelDevices() <= 0) {
            problems.add("execution.maxParallelDevices must be positive");
        }
        if (config.getSdn().getMaxConcurrentSwitches() <= 0) {
            problems.add("sdn.maxConcurrentSwitches must be positive");
        }
        if (config.getSdn().getReadRetries() < 0) {
            problems.add("sdn.readRetries must not be negative");
        }
        return problems;
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    public static QosConfig createDefault() {
        return new QosConfig();
    }

    /**
     * Raised for missing, unreadable or invalid configuration and signature catalogues.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
