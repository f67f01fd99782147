package fr.lapetina.chat.recovery.infrastructure.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.chat.recovery.domain.model.ClassifiedError;
import fr.lapetina.chat.recovery.domain.model.ErrorLogEntry;
import fr.lapetina.chat.recovery.domain.model.ErrorStatistics;
import fr.lapetina.chat.recovery.infrastructure.logging.Sanitizer;
import fr.lapetina.chat.recovery.infrastructure.logging.SystemInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds {@link DiagnosticReport}s and serializes them to JSON.
 */
public final class DiagnosticReportWriter {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticReportWriter.class);

    static final int MAX_RECENT_ERRORS = 20;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DiagnosticReportWriter(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public DiagnosticReportWriter() {
        this(Clock.systemUTC());
    }

    /**
     * Assembles a report. Messages from the error and the history are sanitized;
     * {@code recentLogLines} are expected to come from the log store, which only holds sanitized text.
     *
     * @param error          the error the user is asking about, may be null
     * @param history        history snapshot, oldest first
     */
    public DiagnosticReport build(
            ClassifiedError error,
            ErrorStatistics statistics,
            List<ErrorLogEntry> history,
            List<String> recentLogLines,
            SystemInfo systemInfo
    ) {
        DiagnosticReport report = new DiagnosticReport();
        report.setGeneratedAt(clock.instant());

        if (error != null) {
            report.setErrorCode(error.code());
            report.setErrorMessage(Sanitizer.sanitize(error.message()));
        }

        report.setSystem(new DiagnosticReport.SystemSection(
                systemInfo.device(),
                systemInfo.os(),
                systemInfo.javaVersion(),
                systemInfo.appVersion(),
                systemInfo.processorCount(),
                systemInfo.maxMemoryBytes(),
                systemInfo.usedMemoryBytes(),
                systemInfo.diskTotalBytes(),
                systemInfo.diskAvailableBytes()
        ));

        report.setStatistics(toSection(statistics));

        int from = Math.max(0, history.size() - MAX_RECENT_ERRORS);
        report.setRecentErrors(history.subList(from, history.size()).stream()
                .map(entry -> new DiagnosticReport.HistoryEntry(
                        entry.errorCode(),
                        entry.severity().name(),
                        entry.category().name(),
                        Sanitizer.sanitize(entry.message()),
                        entry.timestamp(),
                        entry.contextOperation(),
                        entry.wasRetried(),
                        entry.retryOutcome().name()))
                .toList());

        report.setRecentLogLines(List.copyOf(recentLogLines));
        return report;
    }

    private DiagnosticReport.StatisticsSection toSection(ErrorStatistics statistics) {
        Map<String, Integer> byCategory = new TreeMap<>();
        statistics.errorsByCategory().forEach((k, v) -> byCategory.put(k.name(), v));
        Map<String, Integer> bySeverity = new TreeMap<>();
        statistics.errorsBySeverity().forEach((k, v) -> bySeverity.put(k.name(), v));

        return new DiagnosticReport.StatisticsSection(
                statistics.totalErrors(),
                statistics.errorsLast24Hours(),
                statistics.errorsLast7Days(),
                byCategory,
                bySeverity,
                statistics.mostCommonErrorCode(),
                statistics.retriesAttempted(),
                statistics.retriesSucceeded(),
                statistics.retrySuccessRate()
        );
    }

    /**
     * Serializes a report. Falls back to a minimal JSON object if serialization fails.
     */
    public String toJson(DiagnosticReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize diagnostic report", e);
            return "{\"error_code\":" + (report.getErrorCode() != null ? "\"" + report.getErrorCode() + "\"" : "null") + "}";
        }
    }

    /**
     * Writes the report as {@code diagnostic-report-<epochMillis>.json} into a directory.
     *
     * @return the written file, or empty on I/O failure
     */
    public Optional<Path> writeTo(DiagnosticReport report, Path directory) {
        Path target = directory.resolve("diagnostic-report-" + clock.millis() + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(target, toJson(report), StandardCharsets.UTF_8);
            log.info("Diagnostic report written to {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("Failed to write diagnostic report: target={}, error={}", target, e.toString());
            return Optional.empty();
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
