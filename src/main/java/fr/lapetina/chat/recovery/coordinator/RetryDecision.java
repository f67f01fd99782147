package fr.lapetina.chat.recovery.coordinator;

import java.time.Duration;

/**
 * Outcome of asking the {@link RetryScheduler} for another attempt.
 *
 * @param scheduled true if an attempt was granted
 * @param attempt   the attempt number granted, or the attempts already spent when giving up
 * @param delay     wait before the attempt runs; zero for manual attempts and when giving up
 */
public record RetryDecision(boolean scheduled, int attempt, Duration delay) {

    public static RetryDecision scheduled(int attempt, Duration delay) {
        return new RetryDecision(true, attempt, delay);
    }

    public static RetryDecision giveUp(int attemptsSpent) {
        return new RetryDecision(false, attemptsSpent, Duration.ZERO);
    }

    public boolean gaveUp() {
        return !scheduled;
    }
}
