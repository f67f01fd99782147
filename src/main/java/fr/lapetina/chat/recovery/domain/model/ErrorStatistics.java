package fr.lapetina.chat.recovery.domain.model;

import java.util.Map;

/**
 * Aggregate view of the error history. Always derived, never stored.
 *
 * @param mostCommonErrorCode code with the highest count, null when history is empty
 * @param retrySuccessRate    retriesSucceeded / retriesAttempted, 0.0 when nothing was retried
 */
public record ErrorStatistics(
        int totalErrors,
        int errorsLast24Hours,
        int errorsLast7Days,
        Map<ErrorCategory, Integer> errorsByCategory,
        Map<ErrorSeverity, Integer> errorsBySeverity,
        String mostCommonErrorCode,
        int retriesAttempted,
        int retriesSucceeded,
        double retrySuccessRate
) {
    public ErrorStatistics {
        errorsByCategory = Map.copyOf(errorsByCategory);
        errorsBySeverity = Map.copyOf(errorsBySeverity);
    }

    public int countFor(ErrorCategory category) {
        return errorsByCategory.getOrDefault(category, 0);
    }

    public int countFor(ErrorSeverity severity) {
        return errorsBySeverity.getOrDefault(severity, 0);
    }
}
