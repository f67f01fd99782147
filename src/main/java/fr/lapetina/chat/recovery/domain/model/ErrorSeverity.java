package fr.lapetina.chat.recovery.domain.model;

/**
 * Severity of a classified error. Drives the presentation policy of the coordinator.
 */
public enum ErrorSeverity {
    /** Logged only, never shown to the user */
    LOW("Low"),

    /** Auto-retried when retryable, otherwise shown */
    MEDIUM("Medium"),

    /** Always shown */
    HIGH("High"),

    /** Always shown and escalated to crash reporting */
    CRITICAL("Critical");

    private final String displayName;

    ErrorSeverity(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
