package fr.lapetina.chat.recovery.coordinator;

import fr.lapetina.chat.recovery.domain.model.ErrorCategory;
import fr.lapetina.chat.recovery.domain.model.ErrorLogEntry;
import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;
import fr.lapetina.chat.recovery.domain.model.ErrorStatistics;
import fr.lapetina.chat.recovery.domain.model.RetryOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives {@link ErrorStatistics} from a history snapshot.
 */
public final class StatisticsCalculator {

    private StatisticsCalculator() {
    }

    public static ErrorStatistics compute(List<ErrorLogEntry> history, Instant now) {
        Instant last24Hours = now.minus(Duration.ofHours(24));
        Instant last7Days = now.minus(Duration.ofDays(7));

        int recent24h = 0;
        int recent7d = 0;
        int retried = 0;
        int succeeded = 0;
        Map<ErrorCategory, Integer> byCategory = new EnumMap<>(ErrorCategory.class);
        Map<ErrorSeverity, Integer> bySeverity = new EnumMap<>(ErrorSeverity.class);
        Map<String, Integer> byCode = new HashMap<>();

        for (ErrorLogEntry entry : history) {
            if (!entry.timestamp().isBefore(last24Hours)) {
                recent24h++;
            }
            if (!entry.timestamp().isBefore(last7Days)) {
                recent7d++;
            }
            if (entry.wasRetried()) {
                retried++;
            }
            if (entry.retryOutcome() == RetryOutcome.SUCCEEDED) {
                succeeded++;
            }
            byCategory.merge(entry.category(), 1, Integer::sum);
            bySeverity.merge(entry.severity(), 1, Integer::sum);
            byCode.merge(entry.errorCode(), 1, Integer::sum);
        }

        // Ties go to the lexically smallest code
        String mostCommon = byCode.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);

        double successRate = retried == 0 ? 0.0 : (double) succeeded / retried;

        return new ErrorStatistics(
                history.size(),
                recent24h,
                recent7d,
                byCategory,
                bySeverity,
                mostCommon,
                retried,
                succeeded,
                successRate
        );
    }
}
