package fr.lapetina.chat.recovery.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.chat.recovery.domain.event.CoordinatorEvent;
import fr.lapetina.chat.recovery.domain.event.RecoveryRequest;
import fr.lapetina.chat.recovery.domain.model.ChatError;
import fr.lapetina.chat.recovery.domain.model.ClassifiedError;
import fr.lapetina.chat.recovery.domain.model.ErrorCategory;
import fr.lapetina.chat.recovery.domain.model.ErrorContext;
import fr.lapetina.chat.recovery.domain.model.ErrorLogEntry;
import fr.lapetina.chat.recovery.domain.model.ErrorStatistics;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;
import fr.lapetina.chat.recovery.domain.model.RetryOutcome;
import fr.lapetina.chat.recovery.infrastructure.collaborator.RecoveryRequestBus;
import fr.lapetina.chat.recovery.infrastructure.logging.SystemInfo;
import fr.lapetina.chat.recovery.infrastructure.logstore.LogStore;
import fr.lapetina.chat.recovery.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

class ErrorCoordinatorTest {

    private static final Duration BASE_DELAY = Duration.ofMillis(50);

    private static final SystemInfo SYSTEM_INFO = new SystemInfo(
            "aarch64", "Linux", "6.1", "17.0.9", "1.0.0", 8,
            1L << 30, 1L << 29, 1L << 36, 1L << 35, Instant.parse("2026-03-01T00:00:00Z"));

    @TempDir
    Path tempDir;

    private MetricsRegistry metricsRegistry;
    private LogStore logStore;
    private RecoveryRequestBus requestBus;
    private ErrorCoordinator coordinator;

    private final BlockingQueue<CoordinatorEvent> events = new LinkedBlockingQueue<>();
    private final BlockingQueue<RecoveryRequest> requests = new LinkedBlockingQueue<>();
    private final List<ClassifiedError> crashReports = new CopyOnWriteArrayList<>();
    private final CountDownLatch crashReported = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("test", false);
        logStore = LogStore.builder()
                .directory(tempDir.resolve("logs"))
                .ringBufferSize(256)
                .metricsRegistry(metricsRegistry)
                .build();
        logStore.start();

        requestBus = new RecoveryRequestBus();
        requestBus.addListener(requests::add);

        coordinator = ErrorCoordinator.builder()
                .logStore(logStore)
                .metricsRegistry(metricsRegistry)
                .requestBus(requestBus)
                .crashReporter(error -> {
                    crashReports.add(error);
                    crashReported.countDown();
                })
                .retryPolicy(new RetryPolicy(3, BASE_DELAY))
                .systemInfo(() -> SYSTEM_INFO)
                .build();
        coordinator.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
        requestBus.close();
        logStore.close();
        metricsRegistry.close();
    }

    private void handle(Throwable error, ErrorContext context) throws Exception {
        coordinator.handle(error, context).get(5, TimeUnit.SECONDS);
    }

    /**
     * Consumes events until one of the given type arrives.
     */
    private CoordinatorEvent awaitEvent(CoordinatorEvent.Type type) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (true) {
            long remaining = deadline - System.nanoTime();
            CoordinatorEvent event = remaining > 0 ? events.poll(remaining, TimeUnit.NANOSECONDS) : null;
            if (event == null) {
                return fail("No " + type + " event received");
            }
            if (event.type() == type) {
                return event;
            }
        }
    }

    private RecoveryRequest awaitRequest() throws InterruptedException {
        RecoveryRequest request = requests.poll(5, TimeUnit.SECONDS);
        if (request == null) {
            return fail("No recovery request received");
        }
        return request;
    }

    @Nested
    @DisplayName("Severity routing")
    class RoutingTests {

        @Test
        @DisplayName("should only log low severity errors")
        void shouldLogLowOnly() throws Exception {
            handle(ChatError.operationCancelled(), ErrorContext.of("sendMessage"));

            assertThat(coordinator.isShowingError()).isFalse();
            assertThat(events).isEmpty();
            assertThat(coordinator.getHistory()).extracting(ErrorLogEntry::errorCode).containsExactly("USR_002");
        }

        @Test
        @DisplayName("should present high severity errors")
        void shouldPresentHigh() throws Exception {
            handle(ChatError.diskFull(), ErrorContext.of("saveConversation"));

            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("STG_005");
            assertThat(coordinator.currentError()).map(ClassifiedError::code).contains("STG_005");
        }

        @Test
        @DisplayName("should present and report critical errors once")
        void shouldReportCritical() throws Exception {
            handle(new IllegalStateException("boom"), ErrorContext.of("startup"));

            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("SYS_004");
            assertThat(crashReported.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(100);
            assertThat(crashReports).hasSize(1);
            assertThat(crashReports.get(0).code()).isEqualTo("SYS_004");

            logStore.flush(Duration.ofSeconds(5));
            assertThat(logStore.getRecent(10))
                    .anyMatch(line -> line.contains("CRITICAL_ERROR: [SYS_004]"))
                    .anyMatch(line -> line.contains("Device: aarch64 | OS: Linux 6.1"));
        }

        @Test
        @DisplayName("should present retryable errors without a retry operation")
        void shouldPresentWithoutRetryOperation() throws Exception {
            handle(ChatError.networkTimeout(), ErrorContext.of("fetchModels"));

            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("NET_002");
            assertThat(coordinator.hasPendingRetry("NET_002")).isFalse();
        }

        @Test
        @DisplayName("should handle a null error as unexpected")
        void shouldHandleNullError() throws Exception {
            handle(null, null);

            assertThat(coordinator.currentError()).map(ClassifiedError::code).contains("SYS_004");
        }

        @Test
        @DisplayName("should record and present a classified error missing its category")
        void shouldFailClosedOnIncompleteError() throws Exception {
            handle(new IncompleteError(), ErrorContext.of("loadPlugin"));

            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("SYS_004");
            assertThat(coordinator.getHistory()).extracting(ErrorLogEntry::errorCode).containsExactly("SYS_004");
            assertThat(crashReported.await(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("should keep notifying listeners after one fails")
        void shouldIsolateListenerFailures() throws Exception {
            coordinator.addListener(event -> {
                throw new IllegalStateException("listener failure");
            });

            handle(ChatError.diskFull(), null);

            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("STG_005");
        }
    }

    @Nested
    @DisplayName("Automatic retries")
    class AutoRetryTests {

        @Test
        @DisplayName("should retry with backoff until the operation succeeds")
        void shouldRetryUntilSuccess() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ErrorContext context = ErrorContext.of("fetchModels", () -> {
                if (calls.incrementAndGet() == 1) {
                    throw ChatError.networkTimeout();
                }
            });

            handle(ChatError.networkTimeout(), context);

            CoordinatorEvent first = awaitEvent(CoordinatorEvent.Type.RETRY_SCHEDULED);
            assertThat(first.attempt()).isEqualTo(1);
            assertThat(first.delay()).isEqualTo(BASE_DELAY);
            awaitEvent(CoordinatorEvent.Type.RETRY_FAILED);
            CoordinatorEvent second = awaitEvent(CoordinatorEvent.Type.RETRY_SCHEDULED);
            assertThat(second.attempt()).isEqualTo(2);
            assertThat(second.delay()).isEqualTo(BASE_DELAY.multipliedBy(2));
            awaitEvent(CoordinatorEvent.Type.RETRY_SUCCEEDED);

            List<ErrorLogEntry> history = coordinator.getHistory();
            assertThat(history).hasSize(2);
            assertThat(history).extracting(ErrorLogEntry::retryOutcome)
                    .containsExactly(RetryOutcome.FAILED, RetryOutcome.SUCCEEDED);

            ErrorStatistics stats = coordinator.getStatistics();
            assertThat(stats.retriesAttempted()).isEqualTo(2);
            assertThat(stats.retriesSucceeded()).isEqualTo(1);
            assertThat(stats.retrySuccessRate()).isEqualTo(0.5);

            assertThat(coordinator.isShowingError()).isFalse();
            assertThat(coordinator.retryAttempts("NET_002")).isZero();
            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should present the error once the attempts are spent")
        void shouldGiveUpAfterThreeAttempts() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ErrorContext context = ErrorContext.of("fetchModels", () -> {
                calls.incrementAndGet();
                throw ChatError.networkTimeout();
            });

            handle(ChatError.networkTimeout(), context);

            CoordinatorEvent gaveUp = awaitEvent(CoordinatorEvent.Type.RETRY_GAVE_UP);
            assertThat(gaveUp.attempt()).isEqualTo(3);
            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("NET_002");
            assertThat(calls.get()).isEqualTo(3);
            assertThat(coordinator.getHistory()).hasSize(4);
            assertThat(coordinator.retryAttempts("NET_002")).isEqualTo(3);

            coordinator.dismissError().get(5, TimeUnit.SECONDS);

            assertThat(coordinator.isShowingError()).isFalse();
            assertThat(coordinator.retryAttempts("NET_002")).isZero();
        }

        @Test
        @DisplayName("should classify an opaque retry failure as unexpected")
        void shouldClassifyOpaqueRetryFailure() throws Exception {
            ErrorContext context = ErrorContext.of("generateReply", () -> {
                throw new IOException("disk read failed");
            });

            handle(ChatError.inferenceFailed(null), context);

            awaitEvent(CoordinatorEvent.Type.RETRY_FAILED);
            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("SYS_004");
            assertThat(crashReported.await(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("should route an Error thrown by the retry operation back as unexpected")
        void shouldRouteRetryOperationErrors() throws Exception {
            ErrorContext context = ErrorContext.of("fetchModels", () -> {
                throw new AssertionError("native bridge assertion");
            });

            handle(ChatError.networkTimeout(), context);

            awaitEvent(CoordinatorEvent.Type.RETRY_FAILED);
            assertThat(awaitEvent(CoordinatorEvent.Type.PRESENTED).errorCode()).isEqualTo("SYS_004");

            List<ErrorLogEntry> history = coordinator.getHistory();
            assertThat(history).extracting(ErrorLogEntry::errorCode).containsExactly("NET_002", "SYS_004");
            assertThat(history.get(0).retryOutcome()).isEqualTo(RetryOutcome.FAILED);
            assertThat(crashReported.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(crashReports.get(0).cause()).isInstanceOf(AssertionError.class);
        }

        @Test
        @DisplayName("should cancel the pending retry when its error is dismissed")
        void shouldCancelOnDismiss() throws Exception {
            coordinator.setRetryPolicy(new RetryPolicy(3, Duration.ofSeconds(30)));
            AtomicInteger calls = new AtomicInteger();
            ChatError error = ChatError.networkTimeout();
            ErrorContext context = ErrorContext.of("fetchModels", calls::incrementAndGet);

            handle(error, context);
            assertThat(coordinator.hasPendingRetry("NET_002")).isTrue();

            coordinator.executeRecoveryAction(RecoveryAction.DISMISS, error, context).get(5, TimeUnit.SECONDS);

            assertThat(coordinator.hasPendingRetry("NET_002")).isFalse();
            assertThat(coordinator.retryAttempts("NET_002")).isZero();
            assertThat(calls.get()).isZero();
        }
    }

    @Nested
    @DisplayName("Recovery actions")
    class RecoveryActionTests {

        @Test
        @DisplayName("should retry immediately and clear the presented error")
        void shouldRetryManually() throws Exception {
            ChatError error = ChatError.diskFull();
            handle(error, null);
            awaitEvent(CoordinatorEvent.Type.PRESENTED);

            coordinator.executeRecoveryAction(RecoveryAction.RETRY, error, ErrorContext.of("save", () -> { }))
                    .get(5, TimeUnit.SECONDS);

            awaitEvent(CoordinatorEvent.Type.RETRY_SUCCEEDED);
            assertThat(coordinator.isShowingError()).isFalse();
            ErrorLogEntry entry = coordinator.getHistory().get(0);
            assertThat(entry.wasRetried()).isTrue();
            assertThat(entry.retryOutcome()).isEqualTo(RetryOutcome.SUCCEEDED);
        }

        @Test
        @DisplayName("should fail a retry that has no operation")
        void shouldFailRetryWithoutOperation() throws Exception {
            ChatError error = ChatError.diskFull();
            handle(error, null);

            coordinator.manualRetry(error, null).get(5, TimeUnit.SECONDS);

            ErrorLogEntry entry = coordinator.getHistory().get(0);
            assertThat(entry.wasRetried()).isTrue();
            assertThat(entry.retryOutcome()).isEqualTo(RetryOutcome.FAILED);
        }

        @Test
        @DisplayName("should wait the requested delay before a delayed retry")
        void shouldWaitBeforeDelayedRetry() throws Exception {
            ChatError error = ChatError.networkUnavailable();
            CountDownLatch ran = new CountDownLatch(1);
            AtomicLong ranAt = new AtomicLong();
            ErrorContext context = ErrorContext.of("fetchModels", () -> {
                ranAt.set(System.nanoTime());
                ran.countDown();
            });
            Duration delay = Duration.ofMillis(300);

            long start = System.nanoTime();
            coordinator.executeRecoveryAction(RecoveryAction.retryWithDelay(delay), error, context)
                    .get(5, TimeUnit.SECONDS);

            assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(Duration.ofNanos(ranAt.get() - start)).isGreaterThanOrEqualTo(delay);
            assertThat(coordinator.retryAttempts("NET_001")).isZero();
        }

        @Test
        @DisplayName("should forward external actions as recovery requests")
        void shouldForwardRequests() throws Exception {
            ChatError error = ChatError.modelCorrupted("llama-3.2-1b");

            coordinator.executeRecoveryAction(RecoveryAction.redownloadModel("llama-3.2-1b"), error, null);
            coordinator.executeRecoveryAction(RecoveryAction.CLEAR_CACHE, error, null);
            coordinator.executeRecoveryAction(RecoveryAction.FREE_MEMORY, error, null);
            coordinator.executeRecoveryAction(RecoveryAction.RESTART_APP, error, null);
            coordinator.executeRecoveryAction(RecoveryAction.CHECK_STORAGE, error, null);
            coordinator.executeRecoveryAction(RecoveryAction.CHECK_NETWORK, error, null);
            coordinator.executeRecoveryAction(RecoveryAction.SWITCH_FALLBACK_MODEL, error, null);

            RecoveryRequest redownload = awaitRequest();
            assertThat(redownload.type()).isEqualTo(RecoveryRequest.Type.REDOWNLOAD_MODEL);
            assertThat(redownload.payload()).isEqualTo("llama-3.2-1b");
            assertThat(List.of(awaitRequest(), awaitRequest(), awaitRequest(), awaitRequest(), awaitRequest(),
                    awaitRequest()))
                    .extracting(RecoveryRequest::type)
                    .containsExactly(
                            RecoveryRequest.Type.CLEAR_CACHE,
                            RecoveryRequest.Type.FREE_MEMORY,
                            RecoveryRequest.Type.RESTART_APP,
                            RecoveryRequest.Type.NAVIGATE_TO_STORAGE,
                            RecoveryRequest.Type.OPEN_SETTINGS,
                            RecoveryRequest.Type.SWITCH_FALLBACK_MODEL);
        }

        @Test
        @DisplayName("should send a sanitized diagnostic report to support")
        void shouldContactSupport() throws Exception {
            ChatError error = ChatError.fileNotFound("/Users/jane/Documents/chat.json");
            handle(error, ErrorContext.builder("importChat").parameter("owner", "jane@example.com").build());

            coordinator.executeRecoveryAction(RecoveryAction.CONTACT_SUPPORT, error, null);

            RecoveryRequest request = awaitRequest();
            assertThat(request.type()).isEqualTo(RecoveryRequest.Type.CONTACT_SUPPORT);
            assertThat(request.payload()).doesNotContain("jane");

            JsonNode report = new ObjectMapper().readTree(request.payload());
            assertThat(report.get("error_code").asText()).isEqualTo("STG_003");
            assertThat(report.get("error_message").asText()).contains("[PATH]");
            assertThat(report.get("statistics").get("total_errors").asInt()).isEqualTo(1);
            assertThat(report.get("recent_errors")).hasSize(1);
            assertThat(report.get("system").get("java_version").asText()).isEqualTo("17.0.9");
        }

        @Test
        @DisplayName("should dismiss the presented error")
        void shouldDismiss() throws Exception {
            ChatError error = ChatError.diskFull();
            handle(error, null);

            coordinator.executeRecoveryAction(RecoveryAction.DISMISS, error, null).get(5, TimeUnit.SECONDS);

            assertThat(awaitEvent(CoordinatorEvent.Type.DISMISSED).errorCode()).isEqualTo("STG_005");
            assertThat(coordinator.isShowingError()).isFalse();
        }
    }

    @Nested
    @DisplayName("History")
    class HistoryTests {

        @Test
        @DisplayName("should compute statistics over handled errors")
        void shouldComputeStatistics() throws Exception {
            handle(ChatError.diskFull(), null);
            handle(ChatError.diskFull(), null);
            handle(ChatError.invalidInput("empty"), null);

            ErrorStatistics stats = coordinator.getStatistics();

            assertThat(stats.totalErrors()).isEqualTo(3);
            assertThat(stats.errorsLast24Hours()).isEqualTo(3);
            assertThat(stats.mostCommonErrorCode()).isEqualTo("STG_005");
            assertThat(stats.retrySuccessRate()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("should empty the history on clear")
        void shouldClearHistory() throws Exception {
            handle(ChatError.diskFull(), null);

            coordinator.clearHistory().get(5, TimeUnit.SECONDS);

            assertThat(coordinator.getHistory()).isEmpty();
            assertThat(coordinator.getStatistics().totalErrors()).isZero();
        }

        @Test
        @DisplayName("should drop operations after close")
        void shouldDropAfterClose() throws Exception {
            coordinator.close();

            coordinator.handle(ChatError.diskFull()).get(5, TimeUnit.SECONDS);

            assertThat(coordinator.getHistory()).isEmpty();
        }
    }

    private static final class IncompleteError extends RuntimeException implements ClassifiedError {

        IncompleteError() {
            super("plugin error without category");
        }

        @Override
        public String code() {
            return "EXT_003";
        }

        @Override
        public String message() {
            return getMessage();
        }

        @Override
        public ErrorCategory category() {
            return null;
        }
    }
}
