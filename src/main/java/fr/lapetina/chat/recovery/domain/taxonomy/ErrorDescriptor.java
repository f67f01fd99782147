package fr.lapetina.chat.recovery.domain.taxonomy;

import fr.lapetina.chat.recovery.domain.model.ErrorCategory;
import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;

import java.util.List;
import java.util.Objects;

/**
 * Fully resolved policy of one error: what to show, how bad it is, and what can be done.
 */
public record ErrorDescriptor(
        String code,
        String message,
        ErrorSeverity severity,
        ErrorCategory category,
        boolean retryable,
        List<RecoveryAction> recoveryActions
) {
    public ErrorDescriptor {
        Objects.requireNonNull(code, "Code is required");
        Objects.requireNonNull(severity, "Severity is required");
        Objects.requireNonNull(category, "Category is required");
        message = message != null ? message : "";
        recoveryActions = List.copyOf(recoveryActions);
    }
}
