package de.entwicklertraining.api.resilient;

import de.entwicklertraining.api.resilient.ApiClient.ConfigurationException;
import de.entwicklertraining.api.resilient.concurrency.ConcurrencyGate;
import de.entwicklertraining.api.resilient.retry.RetryPredicate;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configuration settings for API client behavior: retry budget, retryable statuses, caps on
 * waits, concurrency admission and test determinism.
 * <p>
 * Instances are immutable. A per-call variation is made by deriving a new instance with
 * {@link #toBuilder()} and running the call on {@link ApiClient#withSettings(ApiClientSettings)};
 * the original instance is never changed.
 * <p>
 * Example usage:
 * <pre>
 * ApiClientSettings settings = ApiClientSettings.builder()
 *     .retryCount(4)
 *     .timeout(Duration.ofSeconds(10))
 *     .backoffLimit(Duration.ofSeconds(5))
 *     .concurrencyLimit(8)
 *     .build();
 * </pre>
 */
public final class ApiClientSettings {

    /** Statuses retried with backoff unless configured otherwise. */
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(408, 413, 429, 500, 502, 503, 504);

    /** Statuses for which a {@code Retry-After} header takes priority unless configured otherwise. */
    public static final Set<Integer> DEFAULT_RETRY_AFTER_STATUSES = Set.of(413, 429, 503);

    private static final ApiClientSettings DEFAULTS = builder().build();

    /** Maximum duration of a single attempt; null for none */
    private final Duration timeout;

    /** Retries beyond the first attempt */
    private final int retryCount;

    /** Admission bound when no shared gate is supplied */
    private final int concurrencyLimit;

    private final Set<Integer> retryableStatuses;
    private final Set<Integer> retryAfterStatuses;

    /** Ceiling for server-supplied waits; null for none */
    private final Duration maxRetryAfter;

    /** Ceiling for every wait; null for none */
    private final Duration backoffLimit;

    private final boolean retryOnTimeout;
    private final RetryPredicate retryPredicate;
    private final Set<HttpMethod> allowedMethods;
    private final ConcurrencyGate sharedGate;
    private final boolean deterministic;
    private final boolean jitterDisabled;

    /** Waits at or above this duration give up the concurrency permit while sleeping */
    private final Duration permitReleaseThreshold;

    /** How long to try to get a permit back after a long wait */
    private final Duration permitReacquireTimeout;

    private ApiClientSettings(Builder builder) {
        this.timeout = builder.timeout;
        this.retryCount = builder.retryCount;
        this.concurrencyLimit = builder.concurrencyLimit;
        this.retryableStatuses = Set.copyOf(builder.retryableStatuses);
        this.retryAfterStatuses = Set.copyOf(builder.retryAfterStatuses);
        this.maxRetryAfter = builder.maxRetryAfter;
        this.backoffLimit = builder.backoffLimit;
        this.retryOnTimeout = builder.retryOnTimeout;
        this.retryPredicate = builder.retryPredicate;
        this.allowedMethods = Set.copyOf(builder.allowedMethods);
        this.sharedGate = builder.sharedGate;
        this.deterministic = builder.deterministic;
        this.jitterDisabled = builder.jitterDisabled;
        this.permitReleaseThreshold = builder.permitReleaseThreshold;
        this.permitReacquireTimeout = builder.permitReacquireTimeout;
    }

    /**
     * Returns the default settings: 15 s attempt timeout, 2 retries, concurrency limit 2,
     * all eight methods allowed, permits released for waits of 2 s or more.
     *
     * @return The shared default instance
     */
    public static ApiClientSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new Builder pre-populated with the current settings.
     *
     * @return A new Builder instance with current settings
     */
    public Builder toBuilder() {
        return new Builder()
                .timeout(this.timeout)
                .retryCount(this.retryCount)
                .concurrencyLimit(this.concurrencyLimit)
                .retryableStatuses(this.retryableStatuses)
                .retryAfterStatuses(this.retryAfterStatuses)
                .maxRetryAfter(this.maxRetryAfter)
                .backoffLimit(this.backoffLimit)
                .retryOnTimeout(this.retryOnTimeout)
                .retryPredicate(this.retryPredicate)
                .allowedMethods(this.allowedMethods)
                .sharedGate(this.sharedGate)
                .deterministic(this.deterministic)
                .jitterDisabled(this.jitterDisabled)
                .permitReleaseThreshold(this.permitReleaseThreshold)
                .permitReacquireTimeout(this.permitReacquireTimeout);
    }

    // --- GETTERS ---

    /**
     * Gets the maximum wall-clock duration of one attempt. It does not bound the whole retry sequence.
     *
     * @return The per-attempt timeout, or empty for none
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Gets the number of retries after the first attempt; total attempts are {@code retryCount + 1}.
     *
     * @return The retry count
     */
    public int getRetryCount() {
        return retryCount;
    }

    /**
     * @return The configured number of attempts, {@code retryCount + 1}
     */
    public int getMaxAttempts() {
        return retryCount + 1;
    }

    /**
     * Gets the number of logical requests a client admits at the same time when no shared gate is set.
     *
     * @return The concurrency limit
     */
    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public Set<Integer> getRetryableStatuses() {
        return retryableStatuses;
    }

    public Set<Integer> getRetryAfterStatuses() {
        return retryAfterStatuses;
    }

    public Optional<Duration> getMaxRetryAfter() {
        return Optional.ofNullable(maxRetryAfter);
    }

    public Optional<Duration> getBackoffLimit() {
        return Optional.ofNullable(backoffLimit);
    }

    public boolean isRetryOnTimeout() {
        return retryOnTimeout;
    }

    public Optional<RetryPredicate> getRetryPredicate() {
        return Optional.ofNullable(retryPredicate);
    }

    public Set<HttpMethod> getAllowedMethods() {
        return allowedMethods;
    }

    public Optional<ConcurrencyGate> getSharedGate() {
        return Optional.ofNullable(sharedGate);
    }

    public boolean isDeterministic() {
        return deterministic;
    }

    public boolean isJitterDisabled() {
        return jitterDisabled;
    }

    public Duration getPermitReleaseThreshold() {
        return permitReleaseThreshold;
    }

    public Duration getPermitReacquireTimeout() {
        return permitReacquireTimeout;
    }

    // --- BUILDER ---

    /**
     * Creates a new Builder instance for constructing ApiClientSettings.
     *
     * @return A new Builder instance with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for creating {@link ApiClientSettings} instances with a fluent API.
     * All values start at their defaults; {@link #build()} validates them.
     */
    public static final class Builder {
        private Duration timeout = Duration.ofSeconds(15);
        private int retryCount = 2;
        private int concurrencyLimit = 2;
        private Set<Integer> retryableStatuses = new TreeSet<>(DEFAULT_RETRYABLE_STATUSES);
        private Set<Integer> retryAfterStatuses = new TreeSet<>(DEFAULT_RETRY_AFTER_STATUSES);
        private Duration maxRetryAfter;
        private Duration backoffLimit;
        private boolean retryOnTimeout = false;
        private RetryPredicate retryPredicate;
        private Set<HttpMethod> allowedMethods = EnumSet.allOf(HttpMethod.class);
        private ConcurrencyGate sharedGate;
        private boolean deterministic = false;
        private boolean jitterDisabled = false;
        private Duration permitReleaseThreshold = Duration.ofMillis(2000);
        private Duration permitReacquireTimeout = Duration.ofMillis(200);

        /**
         * Creates a new Builder instance with default settings.
         */
        public Builder() {}

        /**
         * Sets the maximum duration of a single attempt.
         *
         * @param timeout The per-attempt timeout, or null for none
         * @return This builder for method chaining
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the number of retries after the first attempt.
         *
         * @param retryCount Retries, must be &gt;= 0
         * @return This builder for method chaining
         */
        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        /**
         * Sets the instance-local admission bound. Ignored when a shared gate is set.
         *
         * @param concurrencyLimit Maximum concurrent logical requests, must be &gt;= 1
         * @return This builder for method chaining
         */
        public Builder concurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        /**
         * Replaces the statuses that are retried with backoff.
         *
         * @param statuses HTTP status codes
         * @return This builder for method chaining
         */
        public Builder retryableStatuses(Collection<Integer> statuses) {
            this.retryableStatuses = new TreeSet<>(statuses);
            return this;
        }

        /**
         * Replaces the statuses for which a {@code Retry-After} header takes priority.
         *
         * @param statuses HTTP status codes, each 4xx or 5xx
         * @return This builder for method chaining
         */
        public Builder retryAfterStatuses(Collection<Integer> statuses) {
            this.retryAfterStatuses = new TreeSet<>(statuses);
            return this;
        }

        /**
         * Caps any wait requested by the server through {@code Retry-After}, and the jittered backoff.
         *
         * @param maxRetryAfter The ceiling, or null for none
         * @return This builder for method chaining
         */
        public Builder maxRetryAfter(Duration maxRetryAfter) {
            this.maxRetryAfter = maxRetryAfter;
            return this;
        }

        /**
         * Caps every wait, computed or server-supplied.
         *
         * @param backoffLimit The ceiling, or null for none
         * @return This builder for method chaining
         */
        public Builder backoffLimit(Duration backoffLimit) {
            this.backoffLimit = backoffLimit;
            return this;
        }

        /**
         * Treats per-attempt timeouts as retryable. When disabled a timeout ends the call at once.
         *
         * @param retryOnTimeout true to retry timeouts
         * @return This builder for method chaining
         */
        public Builder retryOnTimeout(boolean retryOnTimeout) {
            this.retryOnTimeout = retryOnTimeout;
            return this;
        }

        /**
         * Sets the predicate consulted on network-level failures.
         *
         * @param retryPredicate The predicate, or null to always retry
         * @return This builder for method chaining
         */
        public Builder retryPredicate(RetryPredicate retryPredicate) {
            this.retryPredicate = retryPredicate;
            return this;
        }

        /**
         * Replaces the set of methods the client executes. Other methods fail without a network call.
         *
         * @param methods The allowed methods
         * @return This builder for method chaining
         */
        public Builder allowedMethods(Collection<HttpMethod> methods) {
            this.allowedMethods = methods.isEmpty() ? EnumSet.noneOf(HttpMethod.class) : EnumSet.copyOf(methods);
            return this;
        }

        /**
         * Removes a method from the allowed set.
         *
         * @param method The method to reject
         * @return This builder for method chaining
         */
        public Builder disallowMethod(HttpMethod method) {
            this.allowedMethods.remove(method);
            return this;
        }

        /**
         * Shares an externally owned gate, so several clients draw from one admission limit.
         *
         * @param sharedGate The gate, or null for an instance-local one
         * @return This builder for method chaining
         */
        public Builder sharedGate(ConcurrencyGate sharedGate) {
            this.sharedGate = sharedGate;
            return this;
        }

        /**
         * Seeds the jitter and narrows it to at most 5 ms so retry timing is reproducible in tests.
         *
         * @param deterministic true to enable deterministic mode
         * @return This builder for method chaining
         */
        public Builder deterministic(boolean deterministic) {
            this.deterministic = deterministic;
            return this;
        }

        /**
         * Disables jitter entirely.
         *
         * @param jitterDisabled true to compute plain exponential delays
         * @return This builder for method chaining
         */
        public Builder jitterDisabled(boolean jitterDisabled) {
            this.jitterDisabled = jitterDisabled;
            return this;
        }

        /**
         * Sets the wait above which the concurrency permit is handed back during the sleep.
         *
         * @param threshold The threshold, must not be negative
         * @return This builder for method chaining
         */
        public Builder permitReleaseThreshold(Duration threshold) {
            this.permitReleaseThreshold = threshold;
            return this;
        }

        /**
         * Sets how long a request waits to get a permit back after a long sleep before it
         * continues without one.
         *
         * @param timeout The timeout, must not be negative
         * @return This builder for method chaining
         */
        public Builder permitReacquireTimeout(Duration timeout) {
            this.permitReacquireTimeout = timeout;
            return this;
        }

        /**
         * Builds a new {@link ApiClientSettings} instance with the configured settings.
         *
         * @return A new {@link ApiClientSettings} instance
         * @throws ConfigurationException if the configuration is invalid
         */
        public ApiClientSettings build() {
            if (retryCount < 0) {
                throw new ConfigurationException("retryCount must be >= 0 but was " + retryCount);
            }
            if (retryCount == Integer.MAX_VALUE) {
                throw new ConfigurationException("retryCount is too large");
            }
            if (concurrencyLimit < 1) {
                throw new ConfigurationException("concurrencyLimit must be >= 1 but was " + concurrencyLimit);
            }
            requireNonNegative("timeout", timeout, true);
            requireNonNegative("maxRetryAfter", maxRetryAfter, true);
            requireNonNegative("backoffLimit", backoffLimit, true);
            requireNonNegative("permitReleaseThreshold", permitReleaseThreshold, false);
            requireNonNegative("permitReacquireTimeout", permitReacquireTimeout, false);
            if (timeout != null && timeout.isZero()) {
                throw new ConfigurationException("timeout must be positive; use null for no timeout");
            }
            requireErrorStatuses("retryableStatuses", retryableStatuses);
            requireErrorStatuses("retryAfterStatuses", retryAfterStatuses);
            return new ApiClientSettings(this);
        }

        private static void requireNonNegative(String name, Duration value, boolean optional) {
            if (value == null) {
                if (!optional) {
                    throw new ConfigurationException(name + " cannot be null");
                }
                return;
            }
            if (value.isNegative()) {
                throw new ConfigurationException(name + " must not be negative but was " + value);
            }
        }

        private static void requireErrorStatuses(String name, Set<Integer> statuses) {
            for (Integer status : statuses) {
                if (status == null || status < 400 || status > 599) {
                    throw new ConfigurationException(name + " may only contain 4xx or 5xx statuses but contained " + status);
                }
            }
        }
    }
}
