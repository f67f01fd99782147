/**
 * Chat Error Recovery - error classification, automatic retry and diagnostic logging for
 * a chat application backed by a local language model.
 *
 * <p>The library classifies failures into a closed taxonomy, decides per severity whether to
 * retry with exponential backoff, present the error, or stay silent, and keeps a sanitized,
 * rotating log on disk backed by the LMAX Disruptor.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.chat.recovery.RecoveryFactory} - Main entry point, wires everything
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.chat.recovery.coordinator.ErrorCoordinator} - Routes errors, drives retries,
 *       executes recovery actions</li>
 *   <li>{@link fr.lapetina.chat.recovery.infrastructure.logstore.LogStore} - Persistent log</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RecoveryFactory recovery = RecoveryFactory.create().start()) {
 *     ErrorCoordinator coordinator = recovery.getCoordinator();
 *     coordinator.addListener(event -> ui.render(event));
 *
 *     try {
 *         chat.send(message);
 *     } catch (ChatError e) {
 *         coordinator.handle(e, ErrorContext.builder("sendMessage")
 *                 .parameter("conversation", conversationId)
 *                 .retryOperation(() -> chat.send(message))
 *                 .build());
 *     }
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>40 error kinds across 9 categories with fixed severity and recovery actions</li>
 *   <li>Exponential backoff retries with a per-code attempt ceiling</li>
 *   <li>PII redaction before anything reaches disk</li>
 *   <li>Hot-reload configuration without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.chat.recovery.RecoveryFactory
 * @see fr.lapetina.chat.recovery.coordinator.ErrorCoordinator
 */
package fr.lapetina.chat.recovery;
