package fr.lapetina.chat.recovery.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable history record of one handled error.
 * Retry bookkeeping produces updated copies rather than mutating the entry.
 */
public record ErrorLogEntry(
        String errorCode,
        ErrorSeverity severity,
        ErrorCategory category,
        String message,
        Instant timestamp,
        String contextOperation,
        boolean wasRetried,
        RetryOutcome retryOutcome
) {
    public ErrorLogEntry {
        Objects.requireNonNull(errorCode, "Error code is required");
        Objects.requireNonNull(severity, "Severity is required");
        Objects.requireNonNull(category, "Category is required");
        Objects.requireNonNull(timestamp, "Timestamp is required");
        retryOutcome = retryOutcome != null ? retryOutcome : RetryOutcome.NONE;
    }

    public static ErrorLogEntry of(ClassifiedError error, ErrorContext context, Instant timestamp) {
        return new ErrorLogEntry(
                error.code(),
                error.severity(),
                error.category(),
                error.message(),
                timestamp,
                context != null ? context.operation() : null,
                false,
                RetryOutcome.NONE
        );
    }

    public ErrorLogEntry markRetried() {
        return new ErrorLogEntry(errorCode, severity, category, message, timestamp,
                contextOperation, true, RetryOutcome.PENDING);
    }

    public ErrorLogEntry withRetryOutcome(RetryOutcome outcome) {
        return new ErrorLogEntry(errorCode, severity, category, message, timestamp,
                contextOperation, wasRetried, outcome);
    }
}
