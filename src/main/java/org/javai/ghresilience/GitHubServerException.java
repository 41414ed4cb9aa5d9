package org.javai.ghresilience;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * GitHub answered with a 5xx status, or the client reported a server-side failure.
 */
public final class GitHubServerException extends GitHubApiException {

    private final Integer statusCode;

    public GitHubServerException(String message, int statusCode) {
        this(message, null, Map.of(), List.of(), statusCode);
    }

    public GitHubServerException(String message, Throwable cause, Map<String, String> context,
                                 List<String> recoverySuggestions, Integer statusCode) {
        super(message, cause, context, recoverySuggestions);
        this.statusCode = statusCode;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SERVER;
    }

    public OptionalInt statusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    @Override
    protected GitHubApiException copyWith(Map<String, String> newContext) {
        return new GitHubServerException(getMessage(), getCause(), newContext, recoverySuggestions(), statusCode);
    }
}
