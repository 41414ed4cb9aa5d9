package org.javai.ghresilience;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Student repository discovery failed: the classroom URL could not be parsed, or no
 * repository in the organization matched the assignment prefix.
 */
public final class GitHubDiscoveryException extends GitHubApiException {

    public GitHubDiscoveryException(String message, Map<String, String> context) {
        super(message, null, context);
    }

    public GitHubDiscoveryException(String message, Throwable cause, Map<String, String> context) {
        super(message, cause, context);
    }

    public GitHubDiscoveryException(String message, Throwable cause, Map<String, String> context,
                                    List<String> recoverySuggestions) {
        super(message, cause, context, recoverySuggestions);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DISCOVERY;
    }

    public Optional<String> assignmentPrefix() {
        return contextValue(ContextKeys.ASSIGNMENT_PREFIX);
    }

    public Optional<String> organization() {
        return contextValue(ContextKeys.ORGANIZATION);
    }

    @Override
    protected GitHubApiException copyWith(Map<String, String> newContext) {
        return new GitHubDiscoveryException(getMessage(), getCause(), newContext, recoverySuggestions());
    }
}
