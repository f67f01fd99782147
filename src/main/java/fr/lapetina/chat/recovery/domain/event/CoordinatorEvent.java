package fr.lapetina.chat.recovery.domain.event;

import java.time.Duration;

/**
 * Notification emitted by the error coordinator for observers (UI bindings, tests).
 *
 * @param type      what happened
 * @param errorCode code of the error concerned, null for {@link Type#DISMISSED} without a current error
 * @param attempt   retry attempt number, 0 when not applicable
 * @param delay     scheduled delay for {@link Type#RETRY_SCHEDULED}, null otherwise
 */
public record CoordinatorEvent(Type type, String errorCode, int attempt, Duration delay) {

    public static CoordinatorEvent of(Type type, String errorCode) {
        return new CoordinatorEvent(type, errorCode, 0, null);
    }

    public enum Type {
        /** An error became the currently presented error */
        PRESENTED,

        /** The presented error was dismissed */
        DISMISSED,

        /** A retry timer was armed */
        RETRY_SCHEDULED,

        /** The retry ceiling was reached, the error is presented instead */
        RETRY_GAVE_UP,

        /** A retry operation completed without error */
        RETRY_SUCCEEDED,

        /** A retry operation threw */
        RETRY_FAILED
    }
}
