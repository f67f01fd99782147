package fr.lapetina.chat.recovery.infrastructure.diagnostics;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.chat.recovery.coordinator.StatisticsCalculator;
import fr.lapetina.chat.recovery.domain.model.ChatError;
import fr.lapetina.chat.recovery.domain.model.ErrorCategory;
import fr.lapetina.chat.recovery.domain.model.ErrorLogEntry;
import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;
import fr.lapetina.chat.recovery.domain.model.RetryOutcome;
import fr.lapetina.chat.recovery.infrastructure.logging.SystemInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticReportWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static final SystemInfo SYSTEM_INFO = new SystemInfo(
            "arm64", "Mac OS X", "14.4", "17.0.9", "1.0.0", 10,
            1L << 32, 1L << 30, 1L << 39, 1L << 38, NOW);

    @TempDir
    Path tempDir;

    private DiagnosticReportWriter writer;

    @BeforeEach
    void setUp() {
        writer = new DiagnosticReportWriter(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ErrorLogEntry entry(int index, String message) {
        return new ErrorLogEntry("NET_00" + (index % 5 + 1), ErrorSeverity.MEDIUM, ErrorCategory.NETWORK,
                message, NOW.minusSeconds(100 - index), "op-" + index, index % 2 == 0, RetryOutcome.NONE);
    }

    private DiagnosticReport build(List<ErrorLogEntry> history) {
        return writer.build(ChatError.fileNotFound("/Users/jane/Desktop/export.md"),
                StatisticsCalculator.compute(history, NOW), history, List.of("[ts] [LOW] line"), SYSTEM_INFO);
    }

    @Test
    @DisplayName("should serialize the report with snake case fields")
    void shouldSerialize() throws Exception {
        List<ErrorLogEntry> history = List.of(entry(1, "Failed to download model"));

        JsonNode json = writer.getObjectMapper().readTree(writer.toJson(build(history)));

        assertThat(json.get("generated_at").asText()).isEqualTo("2026-03-01T12:00:00Z");
        assertThat(json.get("error_code").asText()).isEqualTo("STG_003");
        assertThat(json.get("system").get("os").asText()).isEqualTo("Mac OS X 14.4");
        assertThat(json.get("statistics").get("total_errors").asInt()).isEqualTo(1);
        assertThat(json.get("statistics").get("errors_by_category").get("NETWORK").asInt()).isEqualTo(1);
        assertThat(json.get("recent_errors").get(0).get("was_retried").asBoolean()).isFalse();
        assertThat(json.get("recent_log_lines").get(0).asText()).isEqualTo("[ts] [LOW] line");
    }

    @Test
    @DisplayName("should sanitize error and history messages")
    void shouldSanitizeMessages() {
        List<ErrorLogEntry> history = List.of(entry(1, "Upload by jane@example.com failed"));

        String json = writer.toJson(build(history));

        assertThat(json).doesNotContain("jane").contains("[PATH]", "[EMAIL]");
    }

    @Test
    @DisplayName("should keep only the twenty most recent errors")
    void shouldTruncateHistory() {
        List<ErrorLogEntry> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(entry(i, "message " + i));
        }

        DiagnosticReport report = build(history);

        assertThat(report.getRecentErrors()).hasSize(DiagnosticReportWriter.MAX_RECENT_ERRORS);
        assertThat(report.getRecentErrors().get(0).operation()).isEqualTo("op-10");
        assertThat(report.getStatistics().totalErrors()).isEqualTo(30);
    }

    @Test
    @DisplayName("should omit the error section when no error is given")
    void shouldOmitMissingError() {
        DiagnosticReport report = writer.build(null, StatisticsCalculator.compute(List.of(), NOW),
                List.of(), List.of(), SYSTEM_INFO);

        assertThat(writer.toJson(report)).doesNotContain("error_code").doesNotContain("most_common_error_code");
    }

    @Test
    @DisplayName("should write the report to a timestamped file")
    void shouldWriteFile() throws Exception {
        Optional<Path> written = writer.writeTo(build(List.of()), tempDir.resolve("reports"));

        assertThat(written).isPresent();
        assertThat(written.get().getFileName().toString())
                .isEqualTo("diagnostic-report-" + NOW.toEpochMilli() + ".json");
        assertThat(Files.readString(written.get())).contains("\"error_code\" : \"STG_003\"");
    }
}
