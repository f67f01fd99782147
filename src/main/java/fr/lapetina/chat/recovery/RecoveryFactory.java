package fr.lapetina.chat.recovery;

import fr.lapetina.chat.recovery.coordinator.ErrorCoordinator;
import fr.lapetina.chat.recovery.coordinator.RetryPolicy;
import fr.lapetina.chat.recovery.infrastructure.collaborator.CrashReporter;
import fr.lapetina.chat.recovery.infrastructure.collaborator.LoggingCrashReporter;
import fr.lapetina.chat.recovery.infrastructure.collaborator.RecoveryRequestBus;
import fr.lapetina.chat.recovery.infrastructure.config.ConfigLoader;
import fr.lapetina.chat.recovery.infrastructure.config.RecoveryConfig;
import fr.lapetina.chat.recovery.infrastructure.logstore.LogStore;
import fr.lapetina.chat.recovery.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for a fully-wired error recovery subsystem built from configuration.
 * This is the primary entry point for embedding applications.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RecoveryFactory recovery = RecoveryFactory.create("recovery.yaml").start()) {
 *     recovery.getRequestBus().addListener(request -> ...);
 *     recovery.getCoordinator().handle(ChatError.networkTimeout(), ErrorContext.of("sendMessage", this::send));
 * }
 * }</pre>
 */
public class RecoveryFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecoveryFactory.class);

    private final ConfigLoader configLoader;
    private final MetricsRegistry metricsRegistry;
    private final LogStore logStore;
    private final RecoveryRequestBus requestBus;
    private final ErrorCoordinator coordinator;

    protected RecoveryFactory(String configPath, CrashReporter crashReporter) {
        log.info("Initializing RecoveryFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        RecoveryConfig config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(),
                config.getMetrics().isEnabled());

        this.logStore = LogStore.builder()
                .fromConfig(config.getLogStore())
                .metricsRegistry(metricsRegistry)
                .build();

        this.requestBus = new RecoveryRequestBus();

        this.coordinator = ErrorCoordinator.builder()
                .logStore(logStore)
                .metricsRegistry(metricsRegistry)
                .requestBus(requestBus)
                .crashReporter(crashReporter != null ? crashReporter : new LoggingCrashReporter())
                .retryPolicy(RetryPolicy.fromConfig(config.getRetry()))
                .historyCapacity(config.getHistory().getCapacity())
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("RecoveryFactory initialized: logDirectory={}", logStore.getDirectory());
    }

    public static RecoveryFactory create(String configPath) {
        return new RecoveryFactory(configPath, null);
    }

    public static RecoveryFactory create(String configPath, CrashReporter crashReporter) {
        return new RecoveryFactory(configPath, crashReporter);
    }

    /**
     * Creates a factory from the bundled defaults ({@value ConfigLoader#DEFAULT_RESOURCE}).
     */
    public static RecoveryFactory create() {
        return create(ConfigLoader.DEFAULT_RESOURCE);
    }

    /**
     * Starts the log writer and configuration watching, and records system info.
     */
    public RecoveryFactory start() {
        logStore.start();
        configLoader.startWatching();
        coordinator.logSystemInfo();
        log.info("Error recovery started");
        return this;
    }

    public ErrorCoordinator getCoordinator() {
        return coordinator;
    }

    public LogStore getLogStore() {
        return logStore;
    }

    public RecoveryRequestBus getRequestBus() {
        return requestBus;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * The configuration in effect, including hot reloads.
     */
    public RecoveryConfig getConfig() {
        return configLoader.getCurrentConfig();
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private void onConfigChanged(RecoveryConfig oldConfig, RecoveryConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        RetryPolicy policy = RetryPolicy.fromConfig(newConfig.getRetry());
        if (!policy.equals(coordinator.getRetryPolicy())) {
            coordinator.setRetryPolicy(policy);
        }

        if (oldConfig.getHistory().getCapacity() != newConfig.getHistory().getCapacity()
                || !oldConfig.getLogStore().getDirectory().equals(newConfig.getLogStore().getDirectory())) {
            log.warn("History and log store settings take effect on restart only");
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down RecoveryFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            coordinator.close();
        } catch (Exception e) {
            log.warn("Error closing coordinator", e);
        }

        try {
            requestBus.close();
        } catch (Exception e) {
            log.warn("Error closing recovery request bus", e);
        }

        try {
            logStore.close();
        } catch (Exception e) {
            log.warn("Error closing log store", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("RecoveryFactory shut down");
    }
}
