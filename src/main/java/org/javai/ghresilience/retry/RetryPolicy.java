package org.javai.ghresilience.retry;

import org.javai.ghresilience.ErrorAnalysis;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry configuration, typically created once per call site and shared by
 * every invocation made through it.
 *
 * @param maxAttempts Total number of attempts, including the first (at least 1)
 * @param baseDelay Delay before the second attempt (positive)
 * @param maxDelay Upper bound of the exponential backoff (at least {@code baseDelay})
 * @param exponentialBase Growth factor between successive delays (greater than 1)
 * @param jitter Whether each delay is randomized by up to 10% either way
 * @param respectRateLimits Whether a server-provided rate-limit delay overrides a shorter backoff
 * @param timeout Overall time budget for the episode (null means unlimited)
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double exponentialBase,
        boolean jitter,
        boolean respectRateLimits,
        Duration timeout
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_EXPONENTIAL_BASE = 2.0;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final RetryPolicy DEFAULTS = builder().build();

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be positive, was: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, was: " + maxDelay);
        }
        if (!(exponentialBase > 1.0) || Double.isInfinite(exponentialBase)) {
            throw new IllegalArgumentException("exponentialBase must be > 1, was: " + exponentialBase);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive, was: " + timeout);
        }
    }

    /**
     * 3 attempts, 1s base delay doubling up to 60s, jitter on, rate limits respected, 30s timeout.
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .exponentialBase(exponentialBase)
                .jitter(jitter)
                .respectRateLimits(respectRateLimits)
                .timeout(timeout);
    }

    public boolean hasTimeout() {
        return timeout != null;
    }

    /**
     * The deterministic backoff after the given failed attempt:
     * {@code min(maxDelay, baseDelay * exponentialBase^(attempt - 1))}.
     *
     * @param attempt The attempt that just failed (1-based)
     */
    public Duration backoffDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was: " + attempt);
        }
        double nanos = baseDelay.toNanos() * Math.pow(exponentialBase, attempt - 1);
        if (nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * The backoff after the given attempt, raised to the analysis' retry delay when
     * rate limits are respected and the server asked for a longer wait. No jitter applied.
     */
    public Duration delayFor(int attempt, ErrorAnalysis analysis) {
        Objects.requireNonNull(analysis, "analysis must not be null");
        Duration computed = backoffDelay(attempt);
        if (respectRateLimits && analysis.hasRetryDelay() && analysis.retryDelay().compareTo(computed) > 0) {
            return analysis.retryDelay();
        }
        return computed;
    }

    /**
     * Builder for RetryPolicy, starting from the defaults.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double exponentialBase = DEFAULT_EXPONENTIAL_BASE;
        private boolean jitter = true;
        private boolean respectRateLimits = true;
        private Duration timeout = DEFAULT_TIMEOUT;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder exponentialBase(double exponentialBase) {
            this.exponentialBase = exponentialBase;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder respectRateLimits(boolean respectRateLimits) {
            this.respectRateLimits = respectRateLimits;
            return this;
        }

        /**
         * Sets the overall time budget; null disables it.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder noTimeout() {
            return timeout(null);
        }

        /**
         * @throws IllegalArgumentException if the configuration is invalid
         */
        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, exponentialBase,
                    jitter, respectRateLimits, timeout);
        }
    }
}
