/**
 * Persistent error log backed by an LMAX Disruptor writer queue.
 *
 * <h2>Files</h2>
 * <pre>
 * logs/
 *   error-2025-08-06.log      one file per UTC day
 *   error-2025-08-07.log
 *   exports/
 *     exported-logs-1754500000000.txt
 * </pre>
 *
 * <h2>Line Format</h2>
 * <pre>
 * [2025-08-07T14:03:12.481Z] [HIGH] [MDL_002] | [Model] | [High] | Failed to load model ...
 * </pre>
 *
 * <p>Rotation runs after each write: once the current file exceeds the size ceiling the oldest
 * files (by creation time) are deleted until the retention count is met.
 *
 * @see fr.lapetina.chat.recovery.infrastructure.logstore.LogStore
 */
package fr.lapetina.chat.recovery.infrastructure.logstore;
