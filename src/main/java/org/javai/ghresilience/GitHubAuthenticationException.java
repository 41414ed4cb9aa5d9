package org.javai.ghresilience;

import java.util.List;
import java.util.Map;

/**
 * The token is invalid, expired, or lacks the scopes the call requires (HTTP 401, or 403
 * without rate-limit headers). Never retried.
 */
public final class GitHubAuthenticationException extends GitHubApiException {

    public GitHubAuthenticationException(String message) {
        super(message);
    }

    public GitHubAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    public GitHubAuthenticationException(String message, Throwable cause, Map<String, String> context,
                                         List<String> recoverySuggestions) {
        super(message, cause, context, recoverySuggestions);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTHENTICATION;
    }

    @Override
    protected GitHubApiException copyWith(Map<String, String> newContext) {
        return new GitHubAuthenticationException(getMessage(), getCause(), newContext, recoverySuggestions());
    }
}
