package fr.lapetina.chat.recovery.coordinator;

import fr.lapetina.chat.recovery.domain.event.CoordinatorEvent;
import fr.lapetina.chat.recovery.domain.model.ChatError;
import fr.lapetina.chat.recovery.domain.model.ClassifiedError;
import fr.lapetina.chat.recovery.domain.model.ErrorContext;
import fr.lapetina.chat.recovery.domain.model.ErrorLogEntry;
import fr.lapetina.chat.recovery.domain.model.ErrorStatistics;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;
import fr.lapetina.chat.recovery.domain.model.RetryOperation;
import fr.lapetina.chat.recovery.domain.model.RetryOutcome;
import fr.lapetina.chat.recovery.infrastructure.collaborator.CrashReporter;
import fr.lapetina.chat.recovery.infrastructure.collaborator.LoggingCrashReporter;
import fr.lapetina.chat.recovery.infrastructure.collaborator.RecoveryRequestBus;
import fr.lapetina.chat.recovery.infrastructure.diagnostics.DiagnosticReport;
import fr.lapetina.chat.recovery.infrastructure.diagnostics.DiagnosticReportWriter;
import fr.lapetina.chat.recovery.infrastructure.logging.DiagnosticLogger;
import fr.lapetina.chat.recovery.infrastructure.logging.SystemInfo;
import fr.lapetina.chat.recovery.infrastructure.logstore.LogStore;
import fr.lapetina.chat.recovery.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Orchestration root of error recovery.
 *
 * <p>Every handled error is recorded in the history, logged, and then routed by severity:
 * <ul>
 *   <li>CRITICAL - presented, reported to the {@link CrashReporter} once</li>
 *   <li>HIGH - presented</li>
 *   <li>MEDIUM - retried automatically with backoff when retryable and a retry operation
 *       is supplied, presented once the attempt ceiling is reached; presented otherwise</li>
 *   <li>LOW - logged only</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * History, retry state and presentation are confined to one daemon thread
 * ({@code error-coordinator}). Public operations are queued onto it and return a future
 * completed once the operation has been applied. Retry timers fire on the same thread.
 * Retry operations themselves run on a cached {@code retry-worker} pool; only their
 * bookkeeping comes back to the coordinator thread, and anything they throw, {@link Error}s
 * included, is handled as a new failure. Called from the coordinator thread
 * (for example from a listener), operations run inline.
 *
 * <p>No public method throws. Failures of logging, metrics or listeners are logged and dropped.
 */
public final class ErrorCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ErrorCoordinator.class);

    static final int REPORT_LOG_LINES = 50;

    private final ScheduledThreadPoolExecutor actor;
    private final ExecutorService retryWorkers;
    private final RetryScheduler retryScheduler;
    private final ErrorHistory history;

    private final DiagnosticLogger diagnosticLogger;
    private final LogStore logStore;
    private final MetricsRegistry metricsRegistry;
    private final RecoveryRequestBus requestBus;
    private final CrashReporter crashReporter;
    private final DiagnosticReportWriter reportWriter;
    private final Supplier<SystemInfo> systemInfo;
    private final Clock clock;

    private final List<Consumer<CoordinatorEvent>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Thread actorThread;
    private volatile ClassifiedError currentError;

    private ErrorCoordinator(Builder builder) {
        this.logStore = builder.logStore;
        this.metricsRegistry = builder.metricsRegistry;
        this.requestBus = builder.requestBus;
        this.crashReporter = builder.crashReporter;
        this.systemInfo = builder.systemInfo;
        this.clock = builder.clock;
        this.diagnosticLogger = new DiagnosticLogger(logStore, systemInfo);
        this.reportWriter = new DiagnosticReportWriter(clock);
        this.history = new ErrorHistory(builder.historyCapacity);

        this.actor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "error-coordinator");
            t.setDaemon(true);
            actorThread = t;
            return t;
        });
        this.actor.setRemoveOnCancelPolicy(true);
        this.actor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        AtomicInteger workerCounter = new AtomicInteger(0);
        this.retryWorkers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "retry-worker-" + workerCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        this.retryScheduler = new RetryScheduler(actor, builder.retryPolicy);

        log.info("ErrorCoordinator created: retryPolicy={}, historyCapacity={}",
                builder.retryPolicy, builder.historyCapacity);
    }

    // Error intake

    /**
     * Records, logs and routes an error. Throwables that are not {@link ClassifiedError}s
     * are handled as unexpected errors.
     *
     * @param error   the failure, never rethrown
     * @param context call-site context, may be null
     * @return future completed once the error has been routed
     */
    public CompletableFuture<Void> handle(Throwable error, ErrorContext context) {
        ClassifiedError classified = ChatError.classify(
                error != null ? error : new IllegalArgumentException("null error handed to coordinator"));
        return submit(() -> handleOnActor(classified, context));
    }

    public CompletableFuture<Void> handle(Throwable error) {
        return handle(error, null);
    }

    private void handleOnActor(ClassifiedError error, ErrorContext context) {
        history.add(ErrorLogEntry.of(error, context, clock.instant()));
        metricsRegistry.setHistorySize(history.size());

        try {
            diagnosticLogger.logError(error, context);
            metricsRegistry.incrementErrorCount(error);
        } catch (RuntimeException e) {
            log.warn("Failed to record error: code={}", error.code(), e);
        }

        MDC.put("errorCode", error.code());
        try {
            switch (error.severity()) {
                case CRITICAL -> {
                    present(error);
                    reportCrash(error);
                }
                case HIGH -> present(error);
                case MEDIUM -> {
                    if (error.isRetryable() && context != null && context.hasRetryOperation()) {
                        autoRetry(error, context);
                    } else {
                        present(error);
                    }
                }
                case LOW -> log.debug("Low severity error logged only: code={}", error.code());
            }
        } finally {
            MDC.remove("errorCode");
        }
    }

    private void reportCrash(ClassifiedError error) {
        try {
            diagnosticLogger.logCriticalError(error);
        } catch (RuntimeException e) {
            log.warn("Failed to log critical error: code={}", error.code(), e);
        }
        requestBus.dispatch("crash report " + error.code(), () -> crashReporter.report(error));
    }

    // Retry

    private void autoRetry(ClassifiedError error, ErrorContext context) {
        String code = error.code();
        RetryDecision decision = retryScheduler.scheduleAutoRetry(code, () -> executeRetry(error, context));
        if (decision.scheduled()) {
            diagnosticLogger.logRetryAttempt(code, decision.attempt(), decision.delay());
            notifyListeners(new CoordinatorEvent(
                    CoordinatorEvent.Type.RETRY_SCHEDULED, code, decision.attempt(), decision.delay()));
        } else {
            log.info("Giving up automatic retry: code={}, attempts={}", code, decision.attempt());
            notifyListeners(new CoordinatorEvent(
                    CoordinatorEvent.Type.RETRY_GAVE_UP, code, decision.attempt(), null));
            present(error);
        }
        updateRetryGauge();
    }

    /**
     * Clears the presented error and re-runs the operation now. The attempt counts
     * against the same ceiling as automatic retries.
     */
    public CompletableFuture<Void> manualRetry(ClassifiedError error, ErrorContext context) {
        return submit(() -> manualRetryOnActor(error, context));
    }

    private void manualRetryOnActor(ClassifiedError error, ErrorContext context) {
        clearPresentation();
        RetryDecision decision = retryScheduler.claimManualAttempt(error.code());
        updateRetryGauge();
        if (decision.gaveUp()) {
            notifyListeners(new CoordinatorEvent(
                    CoordinatorEvent.Type.RETRY_GAVE_UP, error.code(), decision.attempt(), null));
            present(error);
            return;
        }
        diagnosticLogger.logRetryAttempt(error.code(), decision.attempt(), Duration.ZERO);
        executeRetry(error, context);
    }

    private void executeRetry(ClassifiedError error, ErrorContext context) {
        String code = error.code();
        updateRetryGauge();
        history.updateLast(entry -> entry.errorCode().equals(code), ErrorLogEntry::markRetried);
        metricsRegistry.incrementRetryCount(code, RetryOutcome.PENDING);

        if (context == null || !context.hasRetryOperation()) {
            log.warn("Retry requested without a retry operation: code={}", code);
            diagnosticLogger.logError(
                    ChatError.configurationError("No retry operation provided for " + code), context);
            recordOutcome(code, RetryOutcome.FAILED);
            return;
        }

        RetryOperation operation = context.retryOperation();
        try {
            retryWorkers.execute(() -> {
                try {
                    operation.run();
                    submit(() -> onRetrySucceeded(code));
                } catch (Throwable t) {
                    submit(() -> onRetryFailed(code, t, context));
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Retry workers shut down, retry dropped: code={}", code);
            recordOutcome(code, RetryOutcome.FAILED);
        }
    }

    private void onRetrySucceeded(String code) {
        retryScheduler.recordSuccess(code);
        updateRetryGauge();
        recordOutcome(code, RetryOutcome.SUCCEEDED);
        diagnosticLogger.logRetrySuccess(code);
        notifyListeners(CoordinatorEvent.of(CoordinatorEvent.Type.RETRY_SUCCEEDED, code));
    }

    private void onRetryFailed(String code, Throwable failure, ErrorContext context) {
        recordOutcome(code, RetryOutcome.FAILED);
        log.info("Retry failed: code={}, failure={}", code, failure.toString());
        notifyListeners(CoordinatorEvent.of(CoordinatorEvent.Type.RETRY_FAILED, code));
        handleOnActor(ChatError.classify(failure), context);
    }

    private void recordOutcome(String code, RetryOutcome outcome) {
        history.updateLast(
                entry -> entry.errorCode().equals(code) && entry.retryOutcome() == RetryOutcome.PENDING,
                entry -> entry.withRetryOutcome(outcome));
        if (outcome != RetryOutcome.PENDING) {
            metricsRegistry.incrementRetryCount(code, outcome);
        }
    }

    // Recovery actions

    /**
     * Carries out a recovery action chosen by the user (or by policy) for an error.
     */
    public CompletableFuture<Void> executeRecoveryAction(
            RecoveryAction action,
            ClassifiedError error,
            ErrorContext context
    ) {
        return submit(() -> executeRecoveryActionOnActor(action, error, context));
    }

    private void executeRecoveryActionOnActor(RecoveryAction action, ClassifiedError error, ErrorContext context) {
        try {
            diagnosticLogger.logRecoveryAction(action, error);
            metricsRegistry.incrementRecoveryActionCount(action);
        } catch (RuntimeException e) {
            log.warn("Failed to record recovery action: action={}", action, e);
        }

        switch (action.type()) {
            case RETRY -> manualRetryOnActor(error, context);
            case RETRY_WITH_DELAY -> {
                clearPresentation();
                retryScheduler.scheduleFixedDelay(error.code(), action.delay(), () -> executeRetry(error, context));
                notifyListeners(new CoordinatorEvent(CoordinatorEvent.Type.RETRY_SCHEDULED,
                        error.code(), retryScheduler.attempts(error.code()), action.delay()));
                updateRetryGauge();
            }
            case REDOWNLOAD_MODEL -> requestBus.requestRedownload(action.modelName());
            case CLEAR_CACHE -> requestBus.requestClearCache();
            case FREE_MEMORY -> requestBus.requestFreeMemory();
            case RESTART_APP -> requestBus.requestRestart();
            case CHECK_STORAGE -> requestBus.requestNavigateToStorage();
            case CHECK_NETWORK, OPEN_SETTINGS -> requestBus.requestOpenSettings();
            case SWITCH_FALLBACK_MODEL -> requestBus.requestSwitchFallbackModel();
            case CONTACT_SUPPORT -> requestContactSupport(error);
            case DISMISS -> dismissOnActor(error);
        }
    }

    private void requestContactSupport(ClassifiedError error) {
        List<ErrorLogEntry> snapshot = history.snapshot();
        ErrorStatistics statistics = StatisticsCalculator.compute(snapshot, clock.instant());
        // Log reads and serialization stay off the coordinator thread
        requestBus.dispatch("contact support " + error.code(), () -> {
            DiagnosticReport report = reportWriter.build(
                    error, statistics, snapshot, logStore.getRecent(REPORT_LOG_LINES), systemInfo.get());
            requestBus.requestContactSupport(reportWriter.toJson(report));
        });
    }

    // Presentation

    /**
     * Dismisses the presented error and cancels the pending retry of its code.
     */
    public CompletableFuture<Void> dismissError() {
        return submit(() -> dismissOnActor(null));
    }

    /**
     * Clears the presentation and drops the retry state of both the presented error
     * and {@code owner}, which may be null.
     */
    private void dismissOnActor(ClassifiedError owner) {
        ClassifiedError dismissed = currentError;
        clearPresentation();
        if (dismissed != null) {
            retryScheduler.cancel(dismissed.code());
        }
        if (owner != null) {
            retryScheduler.cancel(owner.code());
        }
        updateRetryGauge();
    }

    private void present(ClassifiedError error) {
        currentError = error;
        log.info("Presenting error: code={}, severity={}", error.code(), error.severity());
        notifyListeners(CoordinatorEvent.of(CoordinatorEvent.Type.PRESENTED, error.code()));
    }

    private void clearPresentation() {
        ClassifiedError previous = currentError;
        currentError = null;
        if (previous != null) {
            notifyListeners(CoordinatorEvent.of(CoordinatorEvent.Type.DISMISSED, previous.code()));
        }
    }

    public boolean isShowingError() {
        return currentError != null;
    }

    public Optional<ClassifiedError> currentError() {
        return Optional.ofNullable(currentError);
    }

    // History and statistics

    /**
     * Snapshot of the history, oldest first.
     */
    public List<ErrorLogEntry> getHistory() {
        return call(history::snapshot);
    }

    /**
     * Recomputed from the history on every call.
     */
    public ErrorStatistics getStatistics() {
        return call(() -> StatisticsCalculator.compute(history.snapshot(), clock.instant()));
    }

    /**
     * Empties the history and drops all retry state.
     */
    public CompletableFuture<Void> clearHistory() {
        return submit(() -> {
            history.clear();
            retryScheduler.cancelAll();
            metricsRegistry.setHistorySize(0);
            updateRetryGauge();
            log.info("Error history cleared");
        });
    }

    /**
     * Attempts already spent on a code.
     */
    public int retryAttempts(String errorCode) {
        return call(() -> retryScheduler.attempts(errorCode));
    }

    public boolean hasPendingRetry(String errorCode) {
        return call(() -> retryScheduler.hasPending(errorCode));
    }

    /**
     * Builds the JSON diagnostic report for an error, as sent with a contact-support request.
     */
    public String diagnosticReportJson(ClassifiedError error) {
        ErrorStatistics statistics = getStatistics();
        List<ErrorLogEntry> snapshot = getHistory();
        DiagnosticReport report = reportWriter.build(
                error, statistics, snapshot, logStore.getRecent(REPORT_LOG_LINES), systemInfo.get());
        return reportWriter.toJson(report);
    }

    /**
     * Writes a SYSTEM_INFO line to both logs.
     */
    public void logSystemInfo() {
        try {
            diagnosticLogger.logSystemInfo();
        } catch (RuntimeException e) {
            log.warn("Failed to log system info", e);
        }
    }

    // Configuration

    public void setRetryPolicy(RetryPolicy policy) {
        retryScheduler.setPolicy(policy);
    }

    public RetryPolicy getRetryPolicy() {
        return retryScheduler.getPolicy();
    }

    // Listeners

    public void addListener(Consumer<CoordinatorEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<CoordinatorEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(CoordinatorEvent event) {
        for (Consumer<CoordinatorEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying coordinator listener: event={}", event, e);
            }
        }
    }

    private void updateRetryGauge() {
        metricsRegistry.setPendingRetries(retryScheduler.pendingCount());
    }

    // Actor plumbing

    private boolean onActorThread() {
        return Thread.currentThread() == actorThread;
    }

    private CompletableFuture<Void> submit(Runnable task) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unexpected failure on coordinator thread", e);
            }
        };
        if (onActorThread()) {
            guarded.run();
            return CompletableFuture.completedFuture(null);
        }
        if (closed.get()) {
            log.debug("Coordinator closed, operation dropped");
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(guarded, actor);
        } catch (RejectedExecutionException e) {
            log.debug("Coordinator shut down, operation dropped");
            return CompletableFuture.completedFuture(null);
        }
    }

    private <T> T call(Supplier<T> query) {
        if (onActorThread() || actor.isShutdown()) {
            return query.get();
        }
        try {
            return CompletableFuture.supplyAsync(query, actor).join();
        } catch (RejectedExecutionException e) {
            return query.get();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    /**
     * Cancels all timers and stops the coordinator and retry worker threads.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Shutting down ErrorCoordinator...");
            try {
                actor.execute(retryScheduler::cancelAll);
            } catch (RejectedExecutionException e) {
                log.debug("Coordinator already shut down");
            }
            actor.shutdown();
            retryWorkers.shutdown();
            try {
                if (!actor.awaitTermination(5, TimeUnit.SECONDS)) {
                    actor.shutdownNow();
                }
                if (!retryWorkers.awaitTermination(5, TimeUnit.SECONDS)) {
                    retryWorkers.shutdownNow();
                }
            } catch (InterruptedException e) {
                actor.shutdownNow();
                retryWorkers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("ErrorCoordinator shut down");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ErrorCoordinator.
     */
    public static final class Builder {
        private LogStore logStore;
        private MetricsRegistry metricsRegistry;
        private RecoveryRequestBus requestBus;
        private CrashReporter crashReporter = new LoggingCrashReporter();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private int historyCapacity = ErrorHistory.DEFAULT_CAPACITY;
        private Supplier<SystemInfo> systemInfo = SystemInfo::collect;
        private Clock clock = Clock.systemUTC();

        public Builder logStore(LogStore logStore) {
            this.logStore = logStore;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder requestBus(RecoveryRequestBus requestBus) {
            this.requestBus = requestBus;
            return this;
        }

        public Builder crashReporter(CrashReporter crashReporter) {
            this.crashReporter = crashReporter;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder historyCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("History capacity must be positive");
            }
            this.historyCapacity = capacity;
            return this;
        }

        public Builder systemInfo(Supplier<SystemInfo> systemInfo) {
            this.systemInfo = systemInfo;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ErrorCoordinator build() {
            if (logStore == null) {
                throw new IllegalStateException("LogStore is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (requestBus == null) {
                throw new IllegalStateException("RecoveryRequestBus is required");
            }
            if (crashReporter == null) {
                throw new IllegalStateException("CrashReporter is required");
            }
            if (retryPolicy == null) {
                throw new IllegalStateException("RetryPolicy is required");
            }
            return new ErrorCoordinator(this);
        }
    }
}
