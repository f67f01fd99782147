package fr.lapetina.chat.recovery.domain.model;

/**
 * Operation re-run by the coordinator when an error is retried.
 * Any exception it throws re-enters the coordinator as a new error.
 */
@FunctionalInterface
public interface RetryOperation {

    void run() throws Exception;
}
