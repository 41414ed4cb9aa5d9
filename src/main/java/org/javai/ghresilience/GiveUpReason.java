package org.javai.ghresilience;

import java.util.Locale;

/**
 * Why a retry episode ended in failure.
 */
public enum GiveUpReason {
    /**
     * The failure was classified as not retryable (authentication, missing resource...).
     */
    NON_RETRYABLE,

    /**
     * Every allowed attempt failed.
     */
    ATTEMPTS_EXHAUSTED,

    /**
     * Waiting for the next attempt would have overrun the policy's timeout.
     */
    TIMEOUT_EXCEEDED,

    /**
     * The calling thread was interrupted.
     */
    INTERRUPTED;

    /**
     * Stable lower-case token used in error context and metrics.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
