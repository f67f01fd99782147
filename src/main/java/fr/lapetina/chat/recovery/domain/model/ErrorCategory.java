package fr.lapetina.chat.recovery.domain.model;

/**
 * Functional area an error belongs to. Used for statistics and log lines.
 */
public enum ErrorCategory {
    NETWORK("Network"),
    MODEL("Model"),
    STORAGE("Storage"),
    MEMORY("Memory"),
    GPU("GPU"),
    CHAT("Chat"),
    EXPORT("Export"),
    SYSTEM("System"),
    USER("User");

    private final String displayName;

    ErrorCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
