package fr.lapetina.chat.recovery.infrastructure.metrics;

import fr.lapetina.chat.recovery.domain.model.ClassifiedError;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;
import fr.lapetina.chat.recovery.domain.model.RetryOutcome;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Error counters by code, category and severity
 * - Retry counters by outcome
 * - Recovery action counters
 * - Log store write counters and ring buffer gauge
 * - JVM memory and processor metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String LOG_WRITTEN = "written";
    public static final String LOG_DROPPED = "dropped";
    public static final String LOG_FAILED = "failed";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> actionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> logCounters = new ConcurrentHashMap<>();

    private final AtomicInteger historySize = new AtomicInteger(0);
    private final AtomicInteger pendingRetries = new AtomicInteger(0);
    private final AtomicInteger logRingRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_history_size", historySize, AtomicInteger::get)
                .description("Number of entries in the in-memory error history")
                .register(registry);

        Gauge.builder(prefix + "_pending_retries", pendingRetries, AtomicInteger::get)
                .description("Number of error codes with a retry timer armed")
                .register(registry);

        Gauge.builder(prefix + "_log_ring_remaining", logRingRemaining, AtomicInteger::get)
                .description("Remaining capacity in the log store ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("chat_recovery");
    }

    /**
     * Counts one handled error.
     */
    public void incrementErrorCount(ClassifiedError error) {
        String code = error.code();
        String category = error.category().name();
        String severity = error.severity().name();
        errorCounters.computeIfAbsent(code + ":" + category + ":" + severity, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of handled errors")
                        .tag("code", code)
                        .tag("category", category)
                        .tag("severity", severity)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a retry transition. {@link RetryOutcome#PENDING} counts an attempt being started.
     */
    public void incrementRetryCount(String code, RetryOutcome outcome) {
        retryCounters.computeIfAbsent(code + ":" + outcome.name(), k ->
                Counter.builder(prefix + "_retries_total")
                        .description("Total number of retry transitions")
                        .tag("code", code)
                        .tag("outcome", outcome.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRecoveryActionCount(RecoveryAction action) {
        String type = action.type().name();
        actionCounters.computeIfAbsent(type, k ->
                Counter.builder(prefix + "_recovery_actions_total")
                        .description("Total number of executed recovery actions")
                        .tag("action", type)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a log store outcome: {@link #LOG_WRITTEN}, {@link #LOG_DROPPED} or {@link #LOG_FAILED}.
     */
    public void incrementLogEntryCount(String result) {
        logCounters.computeIfAbsent(result, k ->
                Counter.builder(prefix + "_log_entries_total")
                        .description("Total number of log store entries by result")
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    public void setHistorySize(int value) {
        historySize.set(value);
    }

    public void setPendingRetries(int value) {
        pendingRetries.set(value);
    }

    public void setLogRingRemaining(int value) {
        logRingRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
