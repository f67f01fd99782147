package fr.lapetina.chat.recovery.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-error-code retry bookkeeping: an attempt counter and at most one pending timer.
 *
 * <p>State machine per code:
 * <pre>
 *   Idle --scheduleAutoRetry--> Scheduled(attempt, delay) --fire--> Idle (counter kept)
 *   Scheduled --cancel / recordSuccess / replace--> Idle
 * </pre>
 *
 * <p>Not thread-safe. Every method must run on the thread of the executor passed in,
 * which is also where timers fire. A timer that fires after its state was cancelled or
 * replaced finds a different token in the map and does nothing.
 */
public final class RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<String, RetryState> states = new HashMap<>();
    private volatile RetryPolicy policy;
    private long nextToken;

    public RetryScheduler(ScheduledExecutorService executor, RetryPolicy policy) {
        this.executor = Objects.requireNonNull(executor, "Executor is required");
        this.policy = Objects.requireNonNull(policy, "Policy is required");
    }

    /**
     * Arms an exponential-backoff timer for the code, replacing any pending one,
     * unless the attempt ceiling is reached.
     */
    public RetryDecision scheduleAutoRetry(String code, Runnable onFire) {
        RetryPolicy current = policy;
        RetryState state = states.computeIfAbsent(code, k -> new RetryState());
        if (!current.allowsAnotherAttempt(state.attempts)) {
            log.info("Retry ceiling reached: code={}, attempts={}", code, state.attempts);
            return RetryDecision.giveUp(state.attempts);
        }

        Duration delay = current.delayFor(state.attempts);
        state.attempts++;
        arm(code, state, delay, onFire);

        log.debug("Auto retry scheduled: code={}, attempt={}, delay={}", code, state.attempts, delay);
        return RetryDecision.scheduled(state.attempts, delay);
    }

    /**
     * Counts a user-initiated attempt against the same ceiling. Cancels any pending timer.
     */
    public RetryDecision claimManualAttempt(String code) {
        RetryState state = states.computeIfAbsent(code, k -> new RetryState());
        if (!policy.allowsAnotherAttempt(state.attempts)) {
            log.info("Retry ceiling reached for manual attempt: code={}, attempts={}", code, state.attempts);
            return RetryDecision.giveUp(state.attempts);
        }
        disarm(state);
        state.attempts++;
        return RetryDecision.scheduled(state.attempts, Duration.ZERO);
    }

    /**
     * Arms a timer with a caller-chosen delay. The attempt counter is left untouched.
     */
    public void scheduleFixedDelay(String code, Duration delay, Runnable onFire) {
        RetryState state = states.computeIfAbsent(code, k -> new RetryState());
        arm(code, state, delay, onFire);
        log.debug("Fixed-delay retry scheduled: code={}, delay={}", code, delay);
    }

    /**
     * Drops the state of a code after its operation succeeded; the next failure starts at attempt 1.
     */
    public void recordSuccess(String code) {
        RetryState removed = states.remove(code);
        if (removed != null) {
            disarm(removed);
        }
    }

    public void cancel(String code) {
        RetryState removed = states.remove(code);
        if (removed != null) {
            disarm(removed);
            log.debug("Retry state cancelled: code={}", code);
        }
    }

    public void cancelAll() {
        states.values().forEach(this::disarm);
        states.clear();
    }

    public int attempts(String code) {
        RetryState state = states.get(code);
        return state != null ? state.attempts : 0;
    }

    public boolean hasPending(String code) {
        RetryState state = states.get(code);
        return state != null && state.pending != null;
    }

    public int pendingCount() {
        return (int) states.values().stream().filter(s -> s.pending != null).count();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Replaces the policy; counters already spent are kept.
     */
    public void setPolicy(RetryPolicy policy) {
        RetryPolicy old = this.policy;
        this.policy = Objects.requireNonNull(policy, "Policy is required");
        log.info("Retry policy changed: {} -> {}", old, policy);
    }

    private void arm(String code, RetryState state, Duration delay, Runnable onFire) {
        disarm(state);
        long token = ++nextToken;
        state.token = token;
        state.pending = executor.schedule(() -> fire(code, token, onFire), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void disarm(RetryState state) {
        if (state.pending != null) {
            state.pending.cancel(false);
            state.pending = null;
        }
        state.token = 0;
    }

    private void fire(String code, long token, Runnable onFire) {
        RetryState state = states.get(code);
        if (state == null || state.token != token) {
            log.debug("Stale retry timer ignored: code={}", code);
            return;
        }
        state.pending = null;
        state.token = 0;
        onFire.run();
    }

    private static final class RetryState {
        private int attempts;
        private ScheduledFuture<?> pending;
        private long token;
    }
}
