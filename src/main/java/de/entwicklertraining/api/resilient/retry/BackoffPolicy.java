package de.entwicklertraining.api.resilient.retry;

import de.entwicklertraining.api.resilient.ApiClientSettings;
import java.time.Duration;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Computes exponential backoff delays with optional jitter and caps.
 * <p>
 * For the 1-based attempt number {@code n} the base delay is {@code 300ms * 2^(n-1)},
 * capped by the backoff limit. Unless jitter is disabled, a random value from
 * {@code [0, max(1, base/10)]} milliseconds is added; in deterministic mode that range shrinks to
 * at most {@code [0, 5]} and the random source is seeded with a fixed value. The sum is capped by
 * {@code maxRetryAfter} and then by the backoff limit.
 * <p>
 * Instances hold a random source and are meant for a single logical call on a single thread.
 */
public final class BackoffPolicy {

    /** Base delay of the first retry. */
    public static final Duration INITIAL_DELAY = Duration.ofMillis(300);

    /** Seed used in deterministic mode so that test runs see the same jitter sequence. */
    static final long DETERMINISTIC_SEED = 0xC0FFEEL;

    private static final long DETERMINISTIC_JITTER_CAP_MS = 5;

    // 300ms * 2^40 is already far beyond any sensible wait
    private static final int MAX_EXPONENT = 40;

    private final Duration backoffLimit;
    private final Duration maxRetryAfter;
    private final boolean jitterDisabled;
    private final boolean deterministic;
    private final RandomGenerator random;

    BackoffPolicy(Duration backoffLimit,
                  Duration maxRetryAfter,
                  boolean jitterDisabled,
                  boolean deterministic,
                  RandomGenerator random) {
        this.backoffLimit = backoffLimit;
        this.maxRetryAfter = maxRetryAfter;
        this.jitterDisabled = jitterDisabled;
        this.deterministic = deterministic;
        this.random = random;
    }

    /**
     * Creates a policy for one logical call.
     *
     * @param settings The client settings providing caps and jitter flags
     * @return A new policy with its own random source
     */
    public static BackoffPolicy forSettings(ApiClientSettings settings) {
        RandomGenerator random = settings.isDeterministic() ? new Random(DETERMINISTIC_SEED) : new Random();
        return new BackoffPolicy(
                settings.getBackoffLimit().orElse(null),
                settings.getMaxRetryAfter().orElse(null),
                settings.isJitterDisabled(),
                settings.isDeterministic(),
                random);
    }

    /**
     * Computes the delay before the attempt following attempt {@code attempt}.
     *
     * @param attempt The 1-based number of the attempt that just failed
     * @return The delay to sleep
     * @throws IllegalArgumentException if attempt is lower than 1
     */
    public Duration compute(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1 but was " + attempt);
        }
        long baseMs = baseDelayMs(attempt);
        if (backoffLimit != null) {
            baseMs = Math.min(baseMs, backoffLimit.toMillis());
        }

        long jitterMs = 0;
        if (!jitterDisabled) {
            long jitterMax = Math.max(1L, baseMs / 10);
            if (deterministic) {
                jitterMax = Math.min(DETERMINISTIC_JITTER_CAP_MS, jitterMax);
            }
            jitterMs = random.nextLong(jitterMax + 1);
        }

        long candidate = saturatedAdd(baseMs, jitterMs);
        if (maxRetryAfter != null) {
            candidate = Math.min(candidate, maxRetryAfter.toMillis());
        }
        if (backoffLimit != null) {
            candidate = Math.min(candidate, backoffLimit.toMillis());
        }
        return Duration.ofMillis(candidate);
    }

    /**
     * Applies {@code maxRetryAfter} and the backoff limit to a wait requested by the server.
     *
     * @param requested The wait parsed from {@code Retry-After}
     * @return The wait actually slept
     */
    public Duration capServerDelay(Duration requested) {
        Duration capped = requested;
        if (maxRetryAfter != null && capped.compareTo(maxRetryAfter) > 0) {
            capped = maxRetryAfter;
        }
        if (backoffLimit != null && capped.compareTo(backoffLimit) > 0) {
            capped = backoffLimit;
        }
        return capped;
    }

    static long baseDelayMs(int attempt) {
        int exponent = Math.min(attempt - 1, MAX_EXPONENT);
        return INITIAL_DELAY.toMillis() << exponent;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < a ? Long.MAX_VALUE : sum;
    }
}
