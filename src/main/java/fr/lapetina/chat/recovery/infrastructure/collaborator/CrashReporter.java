package fr.lapetina.chat.recovery.infrastructure.collaborator;

import fr.lapetina.chat.recovery.domain.model.ClassifiedError;

/**
 * Escalation hook for critical errors (Crashlytics, Sentry and the like).
 */
@FunctionalInterface
public interface CrashReporter {

    /**
     * Reports one critical error. Called at most once per handled critical error,
     * on the dispatcher thread.
     */
    void report(ClassifiedError error);
}
