package fr.lapetina.chat.recovery.domain.model;

/**
 * Outcome of the retry launched for a history entry.
 */
public enum RetryOutcome {
    /** Never retried */
    NONE,

    /** Retry operation running */
    PENDING,

    /** Retry operation completed without error */
    SUCCEEDED,

    /** Retry operation threw; the new failure has its own entry */
    FAILED
}
