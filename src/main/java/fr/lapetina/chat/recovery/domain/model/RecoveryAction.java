package fr.lapetina.chat.recovery.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A recovery action offered to the user or taken by policy.
 * Immutable; only {@link Type#RETRY_WITH_DELAY} and {@link Type#REDOWNLOAD_MODEL} carry a payload.
 */
public record RecoveryAction(Type type, Duration delay, String modelName) {

    public static final RecoveryAction RETRY = new RecoveryAction(Type.RETRY, null, null);
    public static final RecoveryAction CLEAR_CACHE = new RecoveryAction(Type.CLEAR_CACHE, null, null);
    public static final RecoveryAction FREE_MEMORY = new RecoveryAction(Type.FREE_MEMORY, null, null);
    public static final RecoveryAction RESTART_APP = new RecoveryAction(Type.RESTART_APP, null, null);
    public static final RecoveryAction CHECK_NETWORK = new RecoveryAction(Type.CHECK_NETWORK, null, null);
    public static final RecoveryAction CHECK_STORAGE = new RecoveryAction(Type.CHECK_STORAGE, null, null);
    public static final RecoveryAction CONTACT_SUPPORT = new RecoveryAction(Type.CONTACT_SUPPORT, null, null);
    public static final RecoveryAction DISMISS = new RecoveryAction(Type.DISMISS, null, null);
    public static final RecoveryAction OPEN_SETTINGS = new RecoveryAction(Type.OPEN_SETTINGS, null, null);
    public static final RecoveryAction SWITCH_FALLBACK_MODEL =
            new RecoveryAction(Type.SWITCH_FALLBACK_MODEL, null, null);

    public RecoveryAction {
        Objects.requireNonNull(type, "Action type is required");
        if (type == Type.RETRY_WITH_DELAY) {
            Objects.requireNonNull(delay, "Delay is required for RETRY_WITH_DELAY");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Delay must not be negative: " + delay);
            }
        } else {
            delay = null;
        }
        if (type == Type.REDOWNLOAD_MODEL) {
            Objects.requireNonNull(modelName, "Model name is required for REDOWNLOAD_MODEL");
        } else {
            modelName = null;
        }
    }

    public static RecoveryAction retryWithDelay(Duration delay) {
        return new RecoveryAction(Type.RETRY_WITH_DELAY, delay, null);
    }

    public static RecoveryAction retryWithDelaySeconds(long seconds) {
        return retryWithDelay(Duration.ofSeconds(seconds));
    }

    public static RecoveryAction redownloadModel(String modelName) {
        return new RecoveryAction(Type.REDOWNLOAD_MODEL, null, modelName);
    }

    public String title() {
        return type.getTitle();
    }

    public String description() {
        return switch (type) {
            case RETRY -> "Try the operation again";
            case RETRY_WITH_DELAY -> "Wait " + delay.toSeconds() + " seconds and try again";
            case REDOWNLOAD_MODEL -> "Redownload the " + modelName + " model";
            case CLEAR_CACHE -> "Clear temporary files and cache";
            case FREE_MEMORY -> "Free up device memory";
            case RESTART_APP -> "Restart the application";
            case CHECK_NETWORK -> "Check your internet connection";
            case CHECK_STORAGE -> "Free up device storage space";
            case CONTACT_SUPPORT -> "Contact technical support";
            case DISMISS -> "Dismiss this error";
            case OPEN_SETTINGS -> "Open app settings";
            case SWITCH_FALLBACK_MODEL -> "Switch to a different model";
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case RETRY_WITH_DELAY -> type.name() + "(" + delay.toSeconds() + "s)";
            case REDOWNLOAD_MODEL -> type.name() + "(" + modelName + ")";
            default -> type.name();
        };
    }

    public enum Type {
        RETRY("Try Again"),
        RETRY_WITH_DELAY("Retry"),
        REDOWNLOAD_MODEL("Redownload Model"),
        CLEAR_CACHE("Clear Cache"),
        FREE_MEMORY("Free Memory"),
        RESTART_APP("Restart App"),
        CHECK_NETWORK("Check Network"),
        CHECK_STORAGE("Check Storage"),
        CONTACT_SUPPORT("Contact Support"),
        DISMISS("Dismiss"),
        OPEN_SETTINGS("Open Settings"),
        SWITCH_FALLBACK_MODEL("Use Different Model");

        private final String title;

        Type(String title) {
            this.title = title;
        }

        public String getTitle() {
            return title;
        }
    }
}
