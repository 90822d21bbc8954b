package de.entwicklertraining.api.resilient.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What the client does after an attempt, as decided by {@link ResponseClassifier}.
 */
public final class RetryDecision {

    /**
     * The possible outcomes of classifying an attempt.
     */
    public enum Action {
        /** 2xx: decode the body and return it. */
        ACCEPT,
        /** Sleep for the server-supplied {@code Retry-After} wait, then attempt again. */
        RETRY_WITH_SERVER_DELAY,
        /** Sleep for a computed backoff, then attempt again. */
        RETRY_WITH_BACKOFF,
        /** Stop. A response is returned as unsuccessful; a network failure ends in an error with diagnostics. */
        FAIL,
        /** Stop immediately with the attempt's own error, e.g. a timeout that must not be retried. */
        ABORT
    }

    private static final RetryDecision ACCEPT = new RetryDecision(Action.ACCEPT, Duration.ZERO, false);
    private static final RetryDecision FAIL = new RetryDecision(Action.FAIL, Duration.ZERO, false);
    private static final RetryDecision ABORT = new RetryDecision(Action.ABORT, Duration.ZERO, false);

    private final Action action;
    private final Duration delay;
    private final boolean finalExtension;

    private RetryDecision(Action action, Duration delay, boolean finalExtension) {
        this.action = action;
        this.delay = delay;
        this.finalExtension = finalExtension;
    }

    public static RetryDecision accept() {
        return ACCEPT;
    }

    public static RetryDecision fail() {
        return FAIL;
    }

    public static RetryDecision abort() {
        return ABORT;
    }

    /**
     * @param delay The capped server-supplied wait
     * @param finalExtension true if the retry budget is exhausted and this is the one extra attempt
     *                       granted because the server asked the client to wait
     * @return A decision to honor the server's wait
     */
    public static RetryDecision serverDelay(Duration delay, boolean finalExtension) {
        return new RetryDecision(Action.RETRY_WITH_SERVER_DELAY, Objects.requireNonNull(delay), finalExtension);
    }

    public static RetryDecision backoff(Duration delay) {
        return new RetryDecision(Action.RETRY_WITH_BACKOFF, Objects.requireNonNull(delay), false);
    }

    public Action getAction() {
        return action;
    }

    /**
     * @return The wait before the next attempt; zero for terminal decisions
     */
    public Duration getDelay() {
        return delay;
    }

    public boolean isFinalExtension() {
        return finalExtension;
    }

    public boolean isRetry() {
        return action == Action.RETRY_WITH_SERVER_DELAY || action == Action.RETRY_WITH_BACKOFF;
    }

    @Override
    public String toString() {
        return "RetryDecision{" + action + (isRetry() ? ", delay=" + delay.toMillis() + "ms" : "")
                + (finalExtension ? ", finalExtension" : "") + "}";
    }
}
