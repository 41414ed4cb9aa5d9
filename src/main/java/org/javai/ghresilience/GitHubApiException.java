package org.javai.ghresilience;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base of the GitHub error taxonomy. Instances of this class itself are the
 * {@link ErrorKind#GENERIC generic} variant; every other kind has its own final subclass.
 *
 * <p>Every variant carries a human-readable message, an immutable context map
 * (repository, organization, assignment prefix, attempt count...), the underlying
 * cause and at least one recovery suggestion. The original exception is never
 * discarded: it is always available through {@link #getCause()}.</p>
 *
 * <p>This is an unchecked exception so that failures surface through the
 * functional interfaces used by callers without forcing wrapper code at every site.</p>
 */
public sealed class GitHubApiException extends RuntimeException
        permits GitHubAuthenticationException,
                GitHubRateLimitException,
                GitHubResourceNotFoundException,
                GitHubNetworkException,
                GitHubServerException,
                GitHubDiscoveryException {

    private final Map<String, String> context;
    private final List<String> recoverySuggestions;

    public GitHubApiException(String message) {
        this(message, null, Map.of(), List.of());
    }

    public GitHubApiException(String message, Throwable cause) {
        this(message, cause, Map.of(), List.of());
    }

    public GitHubApiException(String message, Throwable cause, Map<String, String> context) {
        this(message, cause, context, List.of());
    }

    public GitHubApiException(String message, Throwable cause, Map<String, String> context,
                              List<String> recoverySuggestions) {
        super(Objects.requireNonNull(message, "message must not be null"), cause);
        this.context = context == null ? Map.of() : Map.copyOf(context);
        this.recoverySuggestions = recoverySuggestions == null || recoverySuggestions.isEmpty()
                ? kind().defaultSuggestions()
                : List.copyOf(recoverySuggestions);
    }

    /**
     * Builds the taxonomy variant selected by the analysis, wrapping the underlying cause.
     *
     * @param analysis The classification of the cause
     * @param cause The exception that occurred (may be null when only response metadata was available)
     * @param context Free-form context such as repository or organization names
     * @return The matching variant
     */
    public static GitHubApiException from(ErrorAnalysis analysis, Throwable cause, Map<String, String> context) {
        Objects.requireNonNull(analysis, "analysis must not be null");
        String message = messageFor(analysis, cause);
        List<String> suggestions = analysis.recoverySuggestions();
        return switch (analysis.kind()) {
            case AUTHENTICATION -> new GitHubAuthenticationException(message, cause, context, suggestions);
            case RATE_LIMIT -> new GitHubRateLimitException(message, cause, context, suggestions,
                    analysis.retryDelay());
            case RESOURCE_NOT_FOUND -> new GitHubResourceNotFoundException(message, cause, context, suggestions);
            case NETWORK -> new GitHubNetworkException(message, cause, context, suggestions);
            case SERVER -> new GitHubServerException(message, cause, context, suggestions, analysis.statusCode());
            case DISCOVERY -> new GitHubDiscoveryException(message, cause, context, suggestions);
            case GENERIC -> new GitHubApiException(message, cause, context, suggestions);
        };
    }

    public ErrorKind kind() {
        return ErrorKind.GENERIC;
    }

    public Map<String, String> context() {
        return context;
    }

    public Optional<String> contextValue(String key) {
        return Optional.ofNullable(context.get(key));
    }

    public List<String> recoverySuggestions() {
        return recoverySuggestions;
    }

    public boolean isRetryable() {
        return kind().retryableByDefault();
    }

    /**
     * Returns a copy of this error, of the same variant, with the given entries merged
     * into its context. Entries in {@code extra} win over existing ones.
     */
    public GitHubApiException withContext(Map<String, String> extra) {
        Objects.requireNonNull(extra, "extra must not be null");
        if (extra.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(context);
        merged.putAll(extra);
        GitHubApiException copy = copyWith(merged);
        copy.setStackTrace(getStackTrace());
        for (Throwable suppressed : getSuppressed()) {
            copy.addSuppressed(suppressed);
        }
        return copy;
    }

    /**
     * Creates a new instance of the same variant with the given context.
     */
    protected GitHubApiException copyWith(Map<String, String> newContext) {
        return new GitHubApiException(getMessage(), getCause(), newContext, recoverySuggestions);
    }

    private static String messageFor(ErrorAnalysis analysis, Throwable cause) {
        String prefix = switch (analysis.kind()) {
            case AUTHENTICATION -> "GitHub authentication failed";
            case RATE_LIMIT -> "GitHub rate limit exceeded";
            case RESOURCE_NOT_FOUND -> "GitHub resource not found";
            case NETWORK -> "Network error while calling GitHub";
            case SERVER -> "GitHub server error";
            case DISCOVERY -> "Repository discovery failed";
            case GENERIC -> "GitHub API call failed";
        };
        if (analysis.statusCode() != null) {
            prefix = prefix + " (HTTP " + analysis.statusCode() + ")";
        }
        if (cause == null) {
            return prefix;
        }
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return prefix + ": " + detail;
    }

    @Override
    public String toString() {
        String base = getClass().getName() + "[" + kind() + "]: " + getMessage();
        return context.isEmpty() ? base : base + " " + context;
    }

    static Duration requireNonNegative(Duration duration, String name) {
        if (duration != null && duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return duration;
    }
}
