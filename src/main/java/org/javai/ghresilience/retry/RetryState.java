package org.javai.ghresilience.retry;

import org.javai.ghresilience.ContextKeys;
import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GiveUpReason;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bookkeeping for a single retry episode. Created when a wrapped call starts and
 * discarded when it ends; never shared between calls or threads.
 */
final class RetryState {

    private final Clock clock;
    private final Instant startTime;
    private int attempt;
    private Duration totalDelay = Duration.ZERO;
    private GitHubApiException lastError;
    private ErrorAnalysis lastAnalysis;

    private RetryState(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    static RetryState start(Clock clock) {
        return new RetryState(Objects.requireNonNull(clock, "clock must not be null"));
    }

    /**
     * Advances to the next attempt and returns its 1-based number.
     */
    int beginAttempt() {
        return ++attempt;
    }

    void recordFailure(GitHubApiException error, ErrorAnalysis analysis) {
        this.lastError = Objects.requireNonNull(error, "error must not be null");
        this.lastAnalysis = Objects.requireNonNull(analysis, "analysis must not be null");
    }

    void recordDelay(Duration delay) {
        totalDelay = totalDelay.plus(delay);
    }

    int attempt() {
        return attempt;
    }

    Duration totalDelay() {
        return totalDelay;
    }

    Instant startTime() {
        return startTime;
    }

    GitHubApiException lastError() {
        return lastError;
    }

    ErrorAnalysis lastAnalysis() {
        return lastAnalysis;
    }

    Duration elapsed() {
        Duration elapsed = Duration.between(startTime, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    /**
     * Whether sleeping for {@code delay} would take the episode past {@code timeout}.
     */
    boolean wouldExceed(Duration timeout, Duration delay) {
        if (timeout == null) {
            return false;
        }
        return delay.compareTo(timeout) > 0 || elapsed().plus(delay).compareTo(timeout) > 0;
    }

    /**
     * Context describing how the episode ended, merged into the final error.
     */
    Map<String, String> outcomeContext(String operation, int maxAttempts, GiveUpReason reason) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(ContextKeys.OPERATION, operation);
        context.put(ContextKeys.ATTEMPT, String.valueOf(attempt));
        context.put(ContextKeys.MAX_ATTEMPTS, String.valueOf(maxAttempts));
        context.put(ContextKeys.TOTAL_DELAY, totalDelay.toString());
        context.put(ContextKeys.ELAPSED, elapsed().toString());
        context.put(ContextKeys.FAILURE_REASON, reason.code());
        return context;
    }
}
