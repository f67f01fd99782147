package fr.lapetina.chat.recovery.infrastructure.logging;

import fr.lapetina.chat.recovery.domain.model.ChatError;
import fr.lapetina.chat.recovery.domain.model.ErrorContext;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;
import fr.lapetina.chat.recovery.infrastructure.logstore.LogStore;
import fr.lapetina.chat.recovery.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticLoggerTest {

    private static final SystemInfo SYSTEM_INFO = new SystemInfo(
            "x86_64", "Linux", "6.1", "17.0.9", "1.0.0", 4,
            1L << 30, 1L << 28, 1L << 36, 1L << 34, Instant.parse("2026-03-01T00:00:00Z"));

    @TempDir
    Path tempDir;

    private MetricsRegistry metricsRegistry;
    private LogStore logStore;
    private DiagnosticLogger diagnosticLogger;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("test", false);
        logStore = LogStore.builder()
                .directory(tempDir)
                .ringBufferSize(64)
                .metricsRegistry(metricsRegistry)
                .build();
        logStore.start();
        diagnosticLogger = new DiagnosticLogger(logStore, () -> SYSTEM_INFO);
    }

    @AfterEach
    void tearDown() {
        logStore.close();
        metricsRegistry.close();
    }

    private String lastLine() {
        logStore.flush(Duration.ofSeconds(5));
        return logStore.getRecent(1).get(0);
    }

    @Nested
    @DisplayName("Error line format")
    class FormatTests {

        @Test
        @DisplayName("should join code, category, severity and message")
        void shouldFormatBareError() {
            assertThat(DiagnosticLogger.formatError(ChatError.diskFull(), null)).isEqualTo(
                    "[STG_005] | [Storage] | [High] | Device storage is full. Please free up space and try again.");
        }

        @Test
        @DisplayName("should append operation and sorted parameters")
        void shouldFormatContext() {
            ErrorContext context = ErrorContext.builder("importChat")
                    .parameter("size", 12)
                    .parameter("format", "json")
                    .build();

            assertThat(DiagnosticLogger.formatError(ChatError.fileNotFound("chat.json"), context)).isEqualTo(
                    "[STG_003] | [Storage] | [Medium] | The file 'chat.json' could not be found."
                            + " | Operation: importChat | Parameters: {format=json, size=12}");
        }

        @Test
        @DisplayName("should omit empty parameters")
        void shouldOmitEmptyParameters() {
            assertThat(DiagnosticLogger.formatError(ChatError.networkTimeout(), ErrorContext.of("fetch")))
                    .endsWith(" | Operation: fetch")
                    .doesNotContain("Parameters");
        }

        @Test
        @DisplayName("should describe the underlying cause")
        void shouldDescribeCause() {
            String withMessage = DiagnosticLogger.formatError(
                    ChatError.inferenceFailed(new IllegalStateException("context overflow")), null);
            String withoutMessage = DiagnosticLogger.formatError(
                    ChatError.inferenceFailed(new FileNotFoundException()), null);

            assertThat(withMessage).endsWith(" | Underlying: context overflow");
            assertThat(withoutMessage).endsWith(" | Underlying: FileNotFoundException");
        }
    }

    @Nested
    @DisplayName("Persisted lines")
    class PersistedTests {

        @Test
        @DisplayName("should sanitize before persisting")
        void shouldSanitize() {
            diagnosticLogger.logError(ChatError.fileNotFound("/home/jane/chats/today.json"),
                    ErrorContext.builder("importChat").parameter("account", "jane@example.com").build());

            String line = lastLine();
            assertThat(line).contains("[MEDIUM]", "[PATH]", "{account=[EMAIL]}").doesNotContain("jane");
        }

        @Test
        @DisplayName("should add device and OS to critical errors")
        void shouldAddSystemInfoToCritical() {
            diagnosticLogger.logError(ChatError.unexpected(new IllegalStateException("boom")), null);

            assertThat(lastLine())
                    .contains("[CRITICAL] [SYS_004]")
                    .endsWith(" | Underlying: boom | Device: x86_64 | OS: Linux 6.1");
        }

        @Test
        @DisplayName("should log retry attempts with their delay")
        void shouldLogRetryAttempt() {
            diagnosticLogger.logRetryAttempt("NET_002", 2, Duration.ofSeconds(4));

            assertThat(lastLine()).endsWith("[MEDIUM] RETRY_ATTEMPT: [NET_002] Attempt 2 after 4.0s delay");
        }

        @Test
        @DisplayName("should log retry successes")
        void shouldLogRetrySuccess() {
            diagnosticLogger.logRetrySuccess("NET_002");

            assertThat(lastLine()).endsWith("[LOW] RETRY_SUCCESS: [NET_002] Operation succeeded after retry");
        }

        @Test
        @DisplayName("should log recovery actions by title")
        void shouldLogRecoveryAction() {
            diagnosticLogger.logRecoveryAction(RecoveryAction.CLEAR_CACHE, ChatError.diskFull());

            assertThat(lastLine()).endsWith("[MEDIUM] RECOVERY_ACTION: [STG_005] Executing 'Clear Cache'");
        }

        @Test
        @DisplayName("should log system information")
        void shouldLogSystemInfo() {
            diagnosticLogger.logSystemInfo();

            assertThat(lastLine()).contains("[LOW] SYSTEM_INFO: Device: x86_64; OS: Linux 6.1; Java: 17.0.9");
        }
    }

    @Test
    @DisplayName("should format byte counts with binary units")
    void shouldFormatBytes() {
        assertThat(SystemInfo.formatBytes(512)).isEqualTo("512 B");
        assertThat(SystemInfo.formatBytes(1536)).isEqualTo("1.5 KiB");
        assertThat(SystemInfo.formatBytes(1L << 30)).isEqualTo("1.0 GiB");
    }
}
