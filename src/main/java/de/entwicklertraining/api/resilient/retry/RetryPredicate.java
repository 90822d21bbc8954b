package de.entwicklertraining.api.resilient.retry;

import de.entwicklertraining.api.resilient.transport.AttemptResult;
import java.util.Optional;

/**
 * Decides whether a failed attempt should be retried.
 * <p>
 * Consulted on network-level failures only. Without a predicate the client always retries
 * such failures while attempts remain. Implementations may keep state, but must be safe to call
 * from several threads when the client is shared.
 */
@FunctionalInterface
public interface RetryPredicate {

    /**
     * @param attempt The 1-based number of the attempt that just failed
     * @param response The response of the failed attempt; empty for network-level failures
     * @param error The error that ended the attempt
     * @return true to retry (subject to the remaining retry budget)
     */
    boolean shouldRetry(int attempt, Optional<AttemptResult> response, Throwable error);

    /**
     * @return A predicate that retries every failure
     */
    static RetryPredicate always() {
        return (attempt, response, error) -> true;
    }

    /**
     * @return A predicate that never retries
     */
    static RetryPredicate never() {
        return (attempt, response, error) -> false;
    }
}
