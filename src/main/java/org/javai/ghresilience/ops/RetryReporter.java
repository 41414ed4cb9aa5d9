package org.javai.ghresilience.ops;

import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GiveUpReason;

import java.time.Duration;

/**
 * Receives retry episode events for logging and metrics.
 * Implementations must tolerate concurrent calls from independent episodes.
 */
public interface RetryReporter {

    /**
     * Reports that an attempt is about to start.
     *
     * @param operation The operation name
     * @param attempt The attempt number (1-based)
     * @param maxAttempts The policy's attempt limit
     */
    default void reportAttempt(String operation, int attempt, int maxAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a failed attempt will be retried after a delay.
     *
     * @param operation The operation name
     * @param analysis The classification of the failure
     * @param attempt The attempt that failed (1-based)
     * @param delay How long the engine will sleep before the next attempt
     */
    default void reportRetryScheduled(String operation, ErrorAnalysis analysis, int attempt, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports success after at least one failed attempt.
     *
     * @param operation The operation name
     * @param attempts The total number of attempts made
     * @param totalDelay The total time spent sleeping between attempts
     */
    default void reportRecovered(String operation, int attempts, Duration totalDelay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the episode ended in failure.
     *
     * @param operation The operation name
     * @param error The taxonomy error about to be thrown
     * @param attempts The total number of attempts made
     * @param reason Why no further attempt was made
     */
    default void reportGaveUp(String operation, GitHubApiException error, int attempts, GiveUpReason reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static RetryReporter noOp() {
        return new RetryReporter() {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }
}
