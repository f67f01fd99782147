/**
 * Error routing, retry scheduling and statistics.
 *
 * <p>{@link fr.lapetina.chat.recovery.coordinator.ErrorCoordinator} owns all mutable recovery
 * state on a single thread. {@link fr.lapetina.chat.recovery.coordinator.RetryScheduler} and
 * {@link fr.lapetina.chat.recovery.coordinator.ErrorHistory} are confined to that thread and
 * are not thread-safe on their own.
 */
package fr.lapetina.chat.recovery.coordinator;
