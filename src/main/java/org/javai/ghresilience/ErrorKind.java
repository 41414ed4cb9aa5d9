package org.javai.ghresilience;

import java.util.List;

/**
 * Classifies GitHub API failures by their cause and expected behavior on retry.
 *
 * <p>Each kind carries the recovery guidance attached to errors of that kind
 * when no more specific guidance is available.</p>
 */
public enum ErrorKind {
    /**
     * Unclassified failure. Retried by default, since most unknown errors are transient.
     */
    GENERIC(true,
            "Retry the operation",
            List.of("Check the error details and retry the operation")),

    /**
     * Invalid, expired or under-scoped credentials. Never retried.
     */
    AUTHENTICATION(false,
            "Check the GitHub token",
            List.of("Verify token validity", "Check token scopes", "Regenerate token")),

    /**
     * The primary or secondary rate limit was hit.
     * Retried, with the delay driven by the server's reset hint when present.
     */
    RATE_LIMIT(true,
            "Wait for the rate limit to reset",
            List.of("Wait for rate limit reset", "Use a different token", "Batch requests")),

    /**
     * The repository, organization or other target does not exist. Never retried.
     */
    RESOURCE_NOT_FOUND(false,
            "Verify the resource exists",
            List.of("Verify the repository or organization name",
                    "Check that the token has access to the resource")),

    /**
     * Connectivity problem or timeout before a response was received.
     */
    NETWORK(true,
            "Retry after backoff",
            List.of("Check network connectivity", "Retry the operation",
                    "Check GitHub status at https://www.githubstatus.com")),

    /**
     * The server answered with a 5xx status.
     */
    SERVER(true,
            "Retry after backoff",
            List.of("Retry the operation later", "Check GitHub status at https://www.githubstatus.com")),

    /**
     * Repository discovery failed (no matching repositories, unparseable classroom URL).
     * Raised by discovery code, never inferred from a raw exception.
     */
    DISCOVERY(false,
            "Check the assignment configuration",
            List.of("Verify the assignment prefix", "Check the classroom URL and organization name"));

    private final boolean retryableByDefault;
    private final String suggestedAction;
    private final List<String> defaultSuggestions;

    ErrorKind(boolean retryableByDefault, String suggestedAction, List<String> defaultSuggestions) {
        this.retryableByDefault = retryableByDefault;
        this.suggestedAction = suggestedAction;
        this.defaultSuggestions = defaultSuggestions;
    }

    public boolean retryableByDefault() {
        return retryableByDefault;
    }

    public String suggestedAction() {
        return suggestedAction;
    }

    public List<String> defaultSuggestions() {
        return defaultSuggestions;
    }
}
