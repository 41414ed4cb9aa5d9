package org.javai.ghresilience;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A primary or secondary rate limit was hit (HTTP 429, or 403 with rate-limit headers).
 * Carries the server's hint about how long to wait, when one was given.
 */
public final class GitHubRateLimitException extends GitHubApiException {

    private final Duration retryAfter;

    public GitHubRateLimitException(String message) {
        this(message, null, Map.of(), List.of(), null);
    }

    public GitHubRateLimitException(String message, Duration retryAfter) {
        this(message, null, Map.of(), List.of(), retryAfter);
    }

    public GitHubRateLimitException(String message, Throwable cause, Map<String, String> context,
                                    List<String> recoverySuggestions, Duration retryAfter) {
        super(message, cause, context, recoverySuggestions);
        this.retryAfter = requireNonNegative(retryAfter, "retryAfter");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RATE_LIMIT;
    }

    /**
     * Time until the rate limit resets, if the server said so.
     */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    protected GitHubApiException copyWith(Map<String, String> newContext) {
        return new GitHubRateLimitException(getMessage(), getCause(), newContext, recoverySuggestions(), retryAfter);
    }
}
