package fr.lapetina.chat.recovery.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link RecoveryConfig} from YAML and reloads it when the file changes.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of retry, history and log store settings
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "recovery.yaml";

    private final AtomicReference<RecoveryConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(RecoveryConfig.class, new LoaderOptions()));
    }

    public ConfigLoader() {
        this(DEFAULT_RESOURCE);
    }

    /**
     * Loads configuration from file or classpath and notifies listeners.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public RecoveryConfig load() {
        RecoveryConfig config = validate(loadFromPath());
        RecoveryConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private RecoveryConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading recovery configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private RecoveryConfig loadFromFile(Path path) {
        log.info("Loading recovery configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private RecoveryConfig parse(InputStream is, String source) {
        try {
            RecoveryConfig config = yaml.load(is);
            // An empty document means "all defaults"
            return config != null ? config : new RecoveryConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public RecoveryConfig loadFromStream(InputStream inputStream) {
        RecoveryConfig config = validate(parse(inputStream, "stream"));
        RecoveryConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Returns the current configuration, or null before the first load.
     */
    public RecoveryConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     * Classpath-only configurations cannot be watched.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist on disk, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "recovery-config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
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
                if (changed.equals(configPath.getFileName())) {
                    // Debounce
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Recovery configuration changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. On failure the previous configuration stays active.
     */
    public RecoveryConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RecoveryConfig oldConfig, RecoveryConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Rejects settings the recovery components cannot run with.
     */
    static RecoveryConfig validate(RecoveryConfig config) {
        if (config.getRetry() == null) {
            config.setRetry(new RecoveryConfig.RetryConfig());
        }
        if (config.getHistory() == null) {
            config.setHistory(new RecoveryConfig.HistoryConfig());
        }
        if (config.getLogStore() == null) {
            config.setLogStore(new RecoveryConfig.LogStoreConfig());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new RecoveryConfig.MetricsConfig());
        }

        RecoveryConfig.RetryConfig retry = config.getRetry();
        if (retry.getMaxAttempts() < 0) {
            throw new ConfigurationException("retry.maxAttempts must be >= 0, got " + retry.getMaxAttempts());
        }
        if (retry.getBaseDelayMs() < 0) {
            throw new ConfigurationException("retry.baseDelayMs must be >= 0, got " + retry.getBaseDelayMs());
        }
        if (config.getHistory().getCapacity() <= 0) {
            throw new ConfigurationException("history.capacity must be > 0, got " + config.getHistory().getCapacity());
        }

        RecoveryConfig.LogStoreConfig store = config.getLogStore();
        if (store.getMaxFiles() <= 0) {
            throw new ConfigurationException("logStore.maxFiles must be > 0, got " + store.getMaxFiles());
        }
        if (store.getMaxFileSizeBytes() <= 0) {
            throw new ConfigurationException("logStore.maxFileSizeBytes must be > 0, got " + store.getMaxFileSizeBytes());
        }
        if (Integer.bitCount(store.getRingBufferSize()) != 1) {
            throw new ConfigurationException("logStore.ringBufferSize must be a power of 2, got " + store.getRingBufferSize());
        }
        return config;
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

    /**
     * Creates a default configuration.
     */
    public static RecoveryConfig createDefault() {
        return new RecoveryConfig();
    }

    /**
     * Exception for configuration errors.
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
