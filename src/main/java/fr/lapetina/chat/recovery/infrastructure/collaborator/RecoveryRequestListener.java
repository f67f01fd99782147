package fr.lapetina.chat.recovery.infrastructure.collaborator;

import fr.lapetina.chat.recovery.domain.event.RecoveryRequest;

/**
 * Receives recovery requests broadcast by {@link RecoveryRequestBus}.
 * Called on the dispatcher thread; implementations should hand long work off.
 */
@FunctionalInterface
public interface RecoveryRequestListener {

    void onRecoveryRequest(RecoveryRequest request);
}
