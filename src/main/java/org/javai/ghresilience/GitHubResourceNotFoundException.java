package org.javai.ghresilience;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The repository, organization, team or other target does not exist, or is invisible
 * to the token (HTTP 404). Never retried.
 */
public final class GitHubResourceNotFoundException extends GitHubApiException {

    public GitHubResourceNotFoundException(String message) {
        super(message);
    }

    public GitHubResourceNotFoundException(String message, Throwable cause, Map<String, String> context) {
        super(message, cause, context);
    }

    public GitHubResourceNotFoundException(String message, Throwable cause, Map<String, String> context,
                                           List<String> recoverySuggestions) {
        super(message, cause, context, recoverySuggestions);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RESOURCE_NOT_FOUND;
    }

    /**
     * The missing resource, taken from the {@code repository} or {@code resource} context entry.
     */
    public Optional<String> resource() {
        return contextValue(ContextKeys.REPOSITORY).or(() -> contextValue(ContextKeys.RESOURCE));
    }

    @Override
    protected GitHubApiException copyWith(Map<String, String> newContext) {
        return new GitHubResourceNotFoundException(getMessage(), getCause(), newContext, recoverySuggestions());
    }
}
