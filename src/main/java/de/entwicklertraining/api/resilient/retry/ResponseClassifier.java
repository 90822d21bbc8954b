package de.entwicklertraining.api.resilient.retry;

import de.entwicklertraining.api.resilient.ApiClientSettings;
import de.entwicklertraining.api.resilient.HttpMethod;
import de.entwicklertraining.api.resilient.transport.AttemptResult;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Inspects the outcome of one attempt and decides how the logical call continues.
 * <p>
 * For completed attempts:
 * <ul>
 *   <li>2xx is accepted; decoding happens in the client and a decode failure is never retried.</li>
 *   <li>A status from {@code retryAfterStatuses} carrying a parseable {@code Retry-After} header
 *       is retried after the capped server wait. When that happens on the last configured
 *       attempt, exactly one additional attempt is granted so an explicit server instruction is
 *       never ignored.</li>
 *   <li>A status from {@code retryableStatuses} is retried after a computed backoff while attempts
 *       remain and the method is retry-eligible.</li>
 *   <li>Everything else ends the call with an unsuccessful response.</li>
 * </ul>
 * For network-level failures a timeout is aborted right away unless {@code retryOnTimeout} is set;
 * other failures consult the {@link RetryPredicate} (absent means retry) and are retried with
 * backoff while attempts remain.
 * <p>
 * One classifier serves one logical call; it shares the call's {@link BackoffPolicy}.
 */
public final class ResponseClassifier {

    private final ApiClientSettings settings;
    private final HttpMethod method;
    private final BackoffPolicy backoffPolicy;
    private final RetryAfterParser retryAfterParser;

    /**
     * @param settings The settings governing this call
     * @param method The method of the call, used for retry eligibility
     * @param backoffPolicy The call's backoff policy
     * @param retryAfterParser Parser for server wait directives
     */
    public ResponseClassifier(ApiClientSettings settings,
                              HttpMethod method,
                              BackoffPolicy backoffPolicy,
                              RetryAfterParser retryAfterParser) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.method = Objects.requireNonNull(method, "method");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.retryAfterParser = Objects.requireNonNull(retryAfterParser, "retryAfterParser");
    }

    /**
     * Classifies a completed attempt.
     *
     * @param result The attempt's response
     * @param attempt The 1-based attempt number
     * @param maxAttempts The configured number of attempts ({@code retryCount + 1})
     * @param extensionUsed Whether the one extra server-directed attempt was already granted
     * @return The decision
     */
    public RetryDecision classify(AttemptResult result, int attempt, int maxAttempts, boolean extensionUsed) {
        if (result.isSuccess()) {
            return RetryDecision.accept();
        }

        int status = result.status();
        if (settings.getRetryAfterStatuses().contains(status)) {
            Optional<Duration> retryAfter = retryAfterParser.parse(result.headers());
            if (retryAfter.isPresent()) {
                Duration capped = backoffPolicy.capServerDelay(retryAfter.get());
                if (attempt < maxAttempts) {
                    return RetryDecision.serverDelay(capped, false);
                }
                if (!extensionUsed) {
                    return RetryDecision.serverDelay(capped, true);
                }
                return RetryDecision.fail();
            }
        }

        if (settings.getRetryableStatuses().contains(status) && isRetryEligible() && attempt < maxAttempts) {
            return RetryDecision.backoff(backoffPolicy.compute(attempt));
        }
        return RetryDecision.fail();
    }

    /**
     * Classifies a network-level failure (no response was received).
     *
     * @param error The failure
     * @param attempt The 1-based attempt number
     * @param maxAttempts The configured number of attempts ({@code retryCount + 1})
     * @return {@link RetryDecision.Action#ABORT} for a timeout that must not be retried,
     *         a backoff retry, or {@link RetryDecision.Action#FAIL} when retrying is not indicated
     *         or no attempts remain
     */
    public RetryDecision classifyFailure(Throwable error, int attempt, int maxAttempts) {
        if (isTimeout(error) && !settings.isRetryOnTimeout()) {
            return RetryDecision.abort();
        }
        boolean shouldRetry = settings.getRetryPredicate()
                .map(predicate -> predicate.shouldRetry(attempt, Optional.empty(), error))
                .orElse(true);
        if (shouldRetry && attempt < maxAttempts) {
            return RetryDecision.backoff(backoffPolicy.compute(attempt));
        }
        return RetryDecision.fail();
    }

    /**
     * @param error A failure raised by the transport
     * @return true if the failure is a per-attempt timeout
     */
    public static boolean isTimeout(Throwable error) {
        return error instanceof HttpTimeoutException;
    }

    private boolean isRetryEligible() {
        return settings.getAllowedMethods().contains(method);
    }
}
