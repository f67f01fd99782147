package fr.lapetina.chat.recovery.coordinator;

import fr.lapetina.chat.recovery.domain.model.ErrorCategory;
import fr.lapetina.chat.recovery.domain.model.ErrorLogEntry;
import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;
import fr.lapetina.chat.recovery.domain.model.RetryOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHistoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    private static ErrorLogEntry entry(String code, int second) {
        return new ErrorLogEntry(code, ErrorSeverity.MEDIUM, ErrorCategory.NETWORK, "message",
                T0.plusSeconds(second), "op", false, RetryOutcome.NONE);
    }

    @Test
    @DisplayName("should keep the most recent entries up to capacity")
    void shouldEvictOldest() {
        ErrorHistory history = new ErrorHistory();

        for (int i = 0; i < 150; i++) {
            history.add(entry("NET_00" + (i % 5), i));
        }

        List<ErrorLogEntry> snapshot = history.snapshot();
        assertThat(history.size()).isEqualTo(100);
        assertThat(snapshot).hasSize(100);
        assertThat(snapshot.get(0).timestamp()).isEqualTo(T0.plusSeconds(50));
        assertThat(snapshot.get(99).timestamp()).isEqualTo(T0.plusSeconds(149));
    }

    @Test
    @DisplayName("should return an immutable snapshot")
    void shouldReturnImmutableSnapshot() {
        ErrorHistory history = new ErrorHistory(3);
        history.add(entry("NET_001", 0));

        List<ErrorLogEntry> snapshot = history.snapshot();
        history.add(entry("NET_002", 1));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(entry("NET_003", 2)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should update only the newest matching entry")
    void shouldUpdateNewestMatch() {
        ErrorHistory history = new ErrorHistory(3);
        history.add(entry("NET_002", 0));
        history.add(entry("MDL_002", 1));
        history.add(entry("NET_002", 2));
        history.add(entry("NET_002", 3));

        boolean updated = history.updateLast(e -> e.errorCode().equals("NET_002"), ErrorLogEntry::markRetried);

        List<ErrorLogEntry> snapshot = history.snapshot();
        assertThat(updated).isTrue();
        assertThat(snapshot.get(2).wasRetried()).isTrue();
        assertThat(snapshot.get(2).retryOutcome()).isEqualTo(RetryOutcome.PENDING);
        assertThat(snapshot.get(1).wasRetried()).isFalse();
    }

    @Test
    @DisplayName("should report no update when nothing matches")
    void shouldReportMissingMatch() {
        ErrorHistory history = new ErrorHistory(3);
        history.add(entry("NET_002", 0));

        assertThat(history.updateLast(e -> e.errorCode().equals("GPU_001"), ErrorLogEntry::markRetried)).isFalse();
    }

    @Test
    @DisplayName("should empty the ring on clear")
    void shouldClear() {
        ErrorHistory history = new ErrorHistory(2);
        history.add(entry("NET_001", 0));
        history.add(entry("NET_002", 1));
        history.add(entry("NET_003", 2));

        history.clear();
        history.add(entry("NET_004", 3));

        assertThat(history.snapshot()).extracting(ErrorLogEntry::errorCode).containsExactly("NET_004");
        assertThat(history.capacity()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject a non-positive capacity")
    void shouldRejectZeroCapacity() {
        assertThatThrownBy(() -> new ErrorHistory(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
