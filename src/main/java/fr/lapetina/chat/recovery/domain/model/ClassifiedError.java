package fr.lapetina.chat.recovery.domain.model;

import java.util.List;

/**
 * Contract for errors the coordinator knows how to route.
 *
 * <p>Implementations outside {@link ChatError} only have to provide a code and a message;
 * the defaults fail closed: shown to the user at HIGH severity, never retried, dismiss only.
 */
public interface ClassifiedError {

    /** Stable machine code, e.g. {@code NET_001}. */
    String code();

    /** Human-readable message shown to the user. */
    String message();

    default ErrorSeverity severity() {
        return ErrorSeverity.HIGH;
    }

    default ErrorCategory category() {
        return ErrorCategory.SYSTEM;
    }

    default boolean isRetryable() {
        return false;
    }

    default List<RecoveryAction> recoveryActions() {
        return List.of(RecoveryAction.DISMISS);
    }

    /** Wrapped cause, may be null. */
    default Throwable cause() {
        return null;
    }
}
