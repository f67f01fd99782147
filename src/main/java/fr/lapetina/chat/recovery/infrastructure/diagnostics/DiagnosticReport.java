package fr.lapetina.chat.recovery.infrastructure.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Support bundle sent with a contact-support request. Every free-text field is sanitized
 * before it is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosticReport {

    @JsonProperty("generated_at")
    private Instant generatedAt;

    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    private SystemSection system;

    private StatisticsSection statistics;

    @JsonProperty("recent_errors")
    private List<HistoryEntry> recentErrors;

    @JsonProperty("recent_log_lines")
    private List<String> recentLogLines;

    // Getters and setters
    public Instant getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }

    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public SystemSection getSystem() { return system; }
    public void setSystem(SystemSection system) { this.system = system; }

    public StatisticsSection getStatistics() { return statistics; }
    public void setStatistics(StatisticsSection statistics) { this.statistics = statistics; }

    public List<HistoryEntry> getRecentErrors() { return recentErrors; }
    public void setRecentErrors(List<HistoryEntry> recentErrors) { this.recentErrors = recentErrors; }

    public List<String> getRecentLogLines() { return recentLogLines; }
    public void setRecentLogLines(List<String> recentLogLines) { this.recentLogLines = recentLogLines; }

    public record SystemSection(
            String device,
            String os,
            @JsonProperty("java_version") String javaVersion,
            @JsonProperty("app_version") String appVersion,
            @JsonProperty("processor_count") int processorCount,
            @JsonProperty("max_memory_bytes") long maxMemoryBytes,
            @JsonProperty("used_memory_bytes") long usedMemoryBytes,
            @JsonProperty("disk_total_bytes") long diskTotalBytes,
            @JsonProperty("disk_available_bytes") long diskAvailableBytes
    ) {
    }

    public record StatisticsSection(
            @JsonProperty("total_errors") int totalErrors,
            @JsonProperty("errors_last_24_hours") int errorsLast24Hours,
            @JsonProperty("errors_last_7_days") int errorsLast7Days,
            @JsonProperty("errors_by_category") Map<String, Integer> errorsByCategory,
            @JsonProperty("errors_by_severity") Map<String, Integer> errorsBySeverity,
            @JsonProperty("most_common_error_code") String mostCommonErrorCode,
            @JsonProperty("retries_attempted") int retriesAttempted,
            @JsonProperty("retries_succeeded") int retriesSucceeded,
            @JsonProperty("retry_success_rate") double retrySuccessRate
    ) {
    }

    public record HistoryEntry(
            String code,
            String severity,
            String category,
            String message,
            Instant timestamp,
            String operation,
            @JsonProperty("was_retried") boolean wasRetried,
            @JsonProperty("retry_outcome") String retryOutcome
    ) {
    }
}
