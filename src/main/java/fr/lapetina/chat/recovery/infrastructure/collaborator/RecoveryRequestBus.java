package fr.lapetina.chat.recovery.infrastructure.collaborator;

import fr.lapetina.chat.recovery.domain.event.RecoveryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget broadcast of recovery requests to external collaborators.
 *
 * Requests are delivered in submission order on a single daemon dispatcher thread.
 * A failing listener is logged and does not prevent delivery to the others.
 */
public final class RecoveryRequestBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecoveryRequestBus.class);

    private final List<RecoveryRequestListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;

    public RecoveryRequestBus() {
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "recovery-dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    public void requestRedownload(String modelName) {
        publish(new RecoveryRequest(RecoveryRequest.Type.REDOWNLOAD_MODEL,
                Objects.requireNonNull(modelName, "Model name is required")));
    }

    public void requestClearCache() {
        publish(RecoveryRequest.of(RecoveryRequest.Type.CLEAR_CACHE));
    }

    public void requestFreeMemory() {
        publish(RecoveryRequest.of(RecoveryRequest.Type.FREE_MEMORY));
    }

    public void requestRestart() {
        publish(RecoveryRequest.of(RecoveryRequest.Type.RESTART_APP));
    }

    public void requestNavigateToStorage() {
        publish(RecoveryRequest.of(RecoveryRequest.Type.NAVIGATE_TO_STORAGE));
    }

    public void requestContactSupport(String diagnosticText) {
        publish(new RecoveryRequest(RecoveryRequest.Type.CONTACT_SUPPORT, diagnosticText));
    }

    public void requestSwitchFallbackModel() {
        publish(RecoveryRequest.of(RecoveryRequest.Type.SWITCH_FALLBACK_MODEL));
    }

    public void requestOpenSettings() {
        publish(RecoveryRequest.of(RecoveryRequest.Type.OPEN_SETTINGS));
    }

    /**
     * Broadcasts a request to every registered listener.
     */
    public void publish(RecoveryRequest request) {
        log.info("Recovery requested: type={}", request.type());
        dispatch("recovery request " + request.type(), () -> {
            for (RecoveryRequestListener listener : listeners) {
                try {
                    listener.onRecoveryRequest(request);
                } catch (Exception e) {
                    log.error("Error notifying recovery listener: type={}", request.type(), e);
                }
            }
        });
    }

    /**
     * Runs a task on the dispatcher thread; failures are logged, never propagated.
     */
    public void dispatch(String description, Runnable task) {
        try {
            dispatcher.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("Dispatched task failed: {}", description, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Recovery dispatcher shut down, dropping {}", description);
        }
    }

    public void addListener(RecoveryRequestListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RecoveryRequestListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
