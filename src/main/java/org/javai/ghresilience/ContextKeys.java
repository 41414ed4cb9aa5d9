package org.javai.ghresilience;

/**
 * Well-known keys of the context map carried by {@link GitHubApiException}.
 */
public final class ContextKeys {

    public static final String OPERATION = "operation";
    public static final String ATTEMPT = "attempt";
    public static final String MAX_ATTEMPTS = "max_attempts";
    public static final String TOTAL_DELAY = "total_delay";
    public static final String ELAPSED = "elapsed";
    public static final String FAILURE_REASON = "failure_reason";

    public static final String REPOSITORY = "repository";
    public static final String ORGANIZATION = "organization";
    public static final String ASSIGNMENT_PREFIX = "assignment_prefix";
    public static final String RESOURCE = "resource";

    private ContextKeys() {
        // Constants only
    }
}
