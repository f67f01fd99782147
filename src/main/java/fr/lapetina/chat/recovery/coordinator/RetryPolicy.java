package fr.lapetina.chat.recovery.coordinator;

import fr.lapetina.chat.recovery.infrastructure.config.RecoveryConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff with a hard attempt ceiling.
 *
 * <p>The delay before retry {@code n} (1-based) is {@code baseDelay * 2^(n-1)}:
 * 2 s, 4 s, 8 s with the defaults.
 *
 * @param maxAttempts automatic and manual attempts allowed per error code before giving up
 * @param baseDelay   delay before the first retry
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);

    /** Shift cap, keeps the multiplication far from overflow. */
    private static final int MAX_SHIFT = 20;

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "Base delay is required");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative: " + baseDelay);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY);
    }

    public static RetryPolicy fromConfig(RecoveryConfig.RetryConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), Duration.ofMillis(config.getBaseDelayMs()));
    }

    /**
     * Delay to wait when {@code previousAttempts} retries have already been made.
     */
    public Duration delayFor(int previousAttempts) {
        int shift = Math.min(Math.max(previousAttempts, 0), MAX_SHIFT);
        return baseDelay.multipliedBy(1L << shift);
    }

    public boolean allowsAnotherAttempt(int previousAttempts) {
        return previousAttempts < maxAttempts;
    }
}
