package fr.lapetina.chat.recovery.infrastructure.collaborator;

import fr.lapetina.chat.recovery.domain.model.ClassifiedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default crash reporter: writes a {@code CRASH_REPORT} line to the application log.
 */
public final class LoggingCrashReporter implements CrashReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingCrashReporter.class);

    @Override
    public void report(ClassifiedError error) {
        log.error("CRASH_REPORT: {} - {}", error.code(), error.message());
    }
}
