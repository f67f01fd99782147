package fr.lapetina.chat.recovery.domain.event;

import java.util.Objects;

/**
 * One-way request to a collaborator outside this library (model manager, storage,
 * memory manager, navigation, support mail composer).
 *
 * @param type    the requested recovery
 * @param payload model name for {@link Type#REDOWNLOAD_MODEL}, diagnostic text for
 *                {@link Type#CONTACT_SUPPORT}, null otherwise
 */
public record RecoveryRequest(Type type, String payload) {

    public RecoveryRequest {
        Objects.requireNonNull(type, "Request type is required");
    }

    public static RecoveryRequest of(Type type) {
        return new RecoveryRequest(type, null);
    }

    public enum Type {
        REDOWNLOAD_MODEL,
        CLEAR_CACHE,
        FREE_MEMORY,
        RESTART_APP,
        NAVIGATE_TO_STORAGE,
        CONTACT_SUPPORT,
        SWITCH_FALLBACK_MODEL,
        OPEN_SETTINGS
    }
}
