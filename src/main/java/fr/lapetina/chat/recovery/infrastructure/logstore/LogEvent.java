package fr.lapetina.chat.recovery.infrastructure.logstore;

import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable slot of the log store ring buffer.
 *
 * Reused across the ring buffer; only the writer thread reads it after publication.
 */
public final class LogEvent {

    public enum Type {
        /** Append one line to the day file. */
        APPEND,
        /** Complete the attached future once everything published before it is on disk. */
        FLUSH,
        /** Delete every log file. */
        CLEAR
    }

    private Type type;
    private Instant timestamp;
    private ErrorSeverity severity;
    private String message;
    private CompletableFuture<Void> completion;

    public void initAppend(Instant timestamp, ErrorSeverity severity, String message) {
        this.type = Type.APPEND;
        this.timestamp = timestamp;
        this.severity = severity;
        this.message = message;
        this.completion = null;
    }

    public void initControl(Type type, CompletableFuture<Void> completion) {
        this.type = type;
        this.timestamp = null;
        this.severity = null;
        this.message = null;
        this.completion = completion;
    }

    public void clear() {
        this.type = null;
        this.timestamp = null;
        this.severity = null;
        this.message = null;
        this.completion = null;
    }

    public Type getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public CompletableFuture<Void> getCompletion() {
        return completion;
    }

    @Override
    public String toString() {
        return "LogEvent{type=" + type + ", severity=" + severity + ", timestamp=" + timestamp + '}';
    }
}
