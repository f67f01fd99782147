/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package parses the YAML configuration of the recovery subsystem and applies
 * runtime updates (for example a new retry policy) without restarting the host application.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code retry} - Maximum automatic attempts and base backoff delay</li>
 *   <li>{@code history} - Capacity of the in-memory error history</li>
 *   <li>{@code logStore} - Log directory, rotation ceiling, retention and writer queue settings</li>
 *   <li>{@code metrics} - Micrometer settings</li>
 * </ul>
 *
 * @see fr.lapetina.chat.recovery.infrastructure.config.RecoveryConfig
 * @see fr.lapetina.chat.recovery.infrastructure.config.ConfigLoader
 */
package fr.lapetina.chat.recovery.infrastructure.config;
