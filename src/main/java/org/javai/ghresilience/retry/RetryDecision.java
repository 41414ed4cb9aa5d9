package org.javai.ghresilience.retry;

import org.javai.ghresilience.GiveUpReason;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by the retry engine after a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Do not retry; surface the failure.
     */
    record GiveUp(GiveUpReason reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp because(GiveUpReason reason) {
            return new GiveUp(reason);
        }
    }
}
