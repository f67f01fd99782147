package fr.lapetina.chat.recovery.infrastructure.logging;

import fr.lapetina.chat.recovery.domain.model.ClassifiedError;
import fr.lapetina.chat.recovery.domain.model.ErrorContext;
import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;
import fr.lapetina.chat.recovery.infrastructure.logstore.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Writes error lifecycle lines to two sinks: the application log (SLF4J, unsanitized,
 * level mapped from severity) and the persistent {@link LogStore} (sanitized).
 *
 * Line layout:
 * <pre>
 * [CODE] | [Category] | [Severity] | message | Operation: op | Parameters: {k=v} | Underlying: cause
 * </pre>
 * Critical entries additionally carry {@code Device:} and {@code OS:} fields.
 */
public final class DiagnosticLogger {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticLogger.class);
    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    static final String SEPARATOR = " | ";

    private final LogStore logStore;
    private final Supplier<SystemInfo> systemInfo;

    public DiagnosticLogger(LogStore logStore, Supplier<SystemInfo> systemInfo) {
        this.logStore = logStore;
        this.systemInfo = systemInfo;
    }

    /**
     * Logs one handled error with its call-site context.
     */
    public void logError(ClassifiedError error, ErrorContext context) {
        String message = formatError(error, context);

        MDC.put("errorCode", error.code());
        MDC.put("errorCategory", error.category().name());
        if (context != null) {
            MDC.put("operation", context.operation());
        }
        try {
            switch (error.severity()) {
                case LOW, MEDIUM -> log.info(message);
                case HIGH -> log.error(message);
                case CRITICAL -> log.error(CRITICAL, "CRITICAL {}", message);
            }
        } finally {
            MDC.remove("errorCode");
            MDC.remove("errorCategory");
            MDC.remove("operation");
        }

        String persisted = message;
        if (error.severity() == ErrorSeverity.CRITICAL) {
            SystemInfo info = systemInfo.get();
            persisted = persisted + SEPARATOR + "Device: " + info.device() + SEPARATOR + "OS: " + info.os();
        }
        logStore.append(Sanitizer.sanitize(persisted), error.severity());
    }

    public void logRetryAttempt(String errorCode, int attempt, Duration delay) {
        String message = String.format(Locale.ROOT, "RETRY_ATTEMPT: [%s] Attempt %d after %.1fs delay",
                errorCode, attempt, delay.toMillis() / 1000.0);
        log.info(message);
        logStore.append(Sanitizer.sanitize(message), ErrorSeverity.MEDIUM);
    }

    public void logRetrySuccess(String errorCode) {
        String message = "RETRY_SUCCESS: [" + errorCode + "] Operation succeeded after retry";
        log.info(message);
        logStore.append(Sanitizer.sanitize(message), ErrorSeverity.LOW);
    }

    public void logRecoveryAction(RecoveryAction action, ClassifiedError error) {
        String message = "RECOVERY_ACTION: [" + error.code() + "] Executing '" + action.title() + "'";
        log.info(message);
        logStore.append(Sanitizer.sanitize(message), ErrorSeverity.MEDIUM);
    }

    public void logCriticalError(ClassifiedError error) {
        String message = "CRITICAL_ERROR: [" + error.code() + "] " + error.message();
        log.error(CRITICAL, message);
        logStore.append(Sanitizer.sanitize(message), ErrorSeverity.CRITICAL);
    }

    public void logSystemInfo() {
        String message = "SYSTEM_INFO: " + systemInfo.get().description();
        log.info(message);
        logStore.append(Sanitizer.sanitize(message), ErrorSeverity.LOW);
    }

    /**
     * Builds the pipe-delimited line for an error, before sanitization.
     */
    static String formatError(ClassifiedError error, ErrorContext context) {
        List<String> components = new ArrayList<>();
        components.add("[" + error.code() + "]");
        components.add("[" + error.category().getDisplayName() + "]");
        components.add("[" + error.severity().getDisplayName() + "]");
        components.add(error.message());

        if (context != null) {
            components.add("Operation: " + context.operation());
            Map<String, String> parameters = context.sortedParameters();
            if (!parameters.isEmpty()) {
                String joined = parameters.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "));
                components.add("Parameters: {" + joined + "}");
            }
        }

        Throwable cause = error.cause();
        if (cause != null) {
            components.add("Underlying: " + describe(cause));
        }
        return String.join(SEPARATOR, components);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
