package org.javai.ghresilience;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The result of classifying a failed GitHub API call.
 * This is what the analyzer produces; the retry engine switches on {@link #kind()}.
 *
 * @param kind The taxonomy variant the failure belongs to
 * @param errorType Simple name of the analyzed exception, or {@code HTTP <status>} for bare metadata
 * @param retryable Whether re-attempting the call has a reasonable chance of succeeding
 * @param rateLimitError Whether the failure was caused by a rate limit
 * @param authenticationError Whether the failure was caused by bad or insufficient credentials
 * @param suggestedAction Short description of what to do next
 * @param retryDelay Server-provided minimum delay before retrying (may be null)
 * @param statusCode HTTP status of the failed response (may be null)
 * @param recoverySuggestions Ordered, human-readable recovery suggestions
 */
public record ErrorAnalysis(
        ErrorKind kind,
        String errorType,
        boolean retryable,
        boolean rateLimitError,
        boolean authenticationError,
        String suggestedAction,
        Duration retryDelay,
        Integer statusCode,
        List<String> recoverySuggestions
) {

    public ErrorAnalysis {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(errorType, "errorType must not be null");
        Objects.requireNonNull(suggestedAction, "suggestedAction must not be null");
        if (authenticationError && retryable) {
            throw new IllegalArgumentException("authentication errors are never retryable");
        }
        if (authenticationError != (kind == ErrorKind.AUTHENTICATION)) {
            throw new IllegalArgumentException("authenticationError must match kind " + kind);
        }
        if (rateLimitError != (kind == ErrorKind.RATE_LIMIT)) {
            throw new IllegalArgumentException("rateLimitError must match kind " + kind);
        }
        if (retryDelay != null && retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        recoverySuggestions = recoverySuggestions == null || recoverySuggestions.isEmpty()
                ? kind.defaultSuggestions()
                : List.copyOf(recoverySuggestions);
    }

    /**
     * Creates an analysis using the kind's default retryability and guidance.
     */
    public static ErrorAnalysis of(ErrorKind kind, String errorType, Integer statusCode) {
        return of(kind, errorType, statusCode, null, kind.retryableByDefault());
    }

    /**
     * Creates an analysis using the kind's default guidance.
     *
     * @param retryable ignored for {@link ErrorKind#AUTHENTICATION}, which is never retryable
     */
    public static ErrorAnalysis of(ErrorKind kind, String errorType, Integer statusCode,
                                   Duration retryDelay, boolean retryable) {
        boolean authentication = kind == ErrorKind.AUTHENTICATION;
        return new ErrorAnalysis(
                kind,
                errorType,
                retryable && !authentication,
                kind == ErrorKind.RATE_LIMIT,
                authentication,
                kind.suggestedAction(),
                retryDelay,
                statusCode,
                kind.defaultSuggestions()
        );
    }

    /**
     * Creates a rate-limit analysis with an optional server-provided delay.
     */
    public static ErrorAnalysis rateLimited(String errorType, Integer statusCode, Duration retryDelay) {
        return of(ErrorKind.RATE_LIMIT, errorType, statusCode, retryDelay, true);
    }

    /**
     * Returns a copy with different recovery suggestions.
     */
    public ErrorAnalysis withRecoverySuggestions(List<String> suggestions) {
        return new ErrorAnalysis(kind, errorType, retryable, rateLimitError, authenticationError,
                suggestedAction, retryDelay, statusCode, suggestions);
    }

    public boolean hasRetryDelay() {
        return retryDelay != null;
    }
}
