package fr.lapetina.chat.recovery.infrastructure.metrics;

import fr.lapetina.chat.recovery.domain.model.ChatError;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;
import fr.lapetina.chat.recovery.domain.model.RetryOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test", false);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count errors by code, category and severity")
    void shouldCountErrors() {
        metrics.incrementErrorCount(ChatError.diskFull());
        metrics.incrementErrorCount(ChatError.diskFull());

        double count = metrics.getRegistry().get("test_errors_total")
                .tag("code", "STG_005")
                .tag("category", "STORAGE")
                .tag("severity", "HIGH")
                .counter().count();
        assertThat(count).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should count retries by outcome")
    void shouldCountRetries() {
        metrics.incrementRetryCount("NET_002", RetryOutcome.PENDING);
        metrics.incrementRetryCount("NET_002", RetryOutcome.SUCCEEDED);

        assertThat(metrics.getRegistry().get("test_retries_total")
                .tag("outcome", "SUCCEEDED").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().find("test_retries_total").counters()).hasSize(2);
    }

    @Test
    @DisplayName("should count recovery actions by type")
    void shouldCountActions() {
        metrics.incrementRecoveryActionCount(RecoveryAction.retryWithDelaySeconds(5));

        assertThat(metrics.getRegistry().get("test_recovery_actions_total")
                .tag("action", "RETRY_WITH_DELAY").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose gauges in the scrape output")
    void shouldExposeGauges() {
        metrics.setHistorySize(42);
        metrics.setPendingRetries(2);
        metrics.incrementLogEntryCount(MetricsRegistry.LOG_DROPPED);

        String scrape = metrics.scrape();

        assertThat(scrape).contains("test_history_size 42.0");
        assertThat(scrape).contains("test_pending_retries 2.0");
        assertThat(scrape).contains("test_log_entries_total{result=\"dropped\"");
    }
}
