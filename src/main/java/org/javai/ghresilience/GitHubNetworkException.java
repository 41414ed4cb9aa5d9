package org.javai.ghresilience;

import java.util.List;
import java.util.Map;

/**
 * No usable response was received: connection refused or reset, DNS failure, TLS failure,
 * or a timeout.
 */
public final class GitHubNetworkException extends GitHubApiException {

    public GitHubNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    public GitHubNetworkException(String message, Throwable cause, Map<String, String> context,
                                  List<String> recoverySuggestions) {
        super(message, cause, context, recoverySuggestions);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NETWORK;
    }

    @Override
    protected GitHubApiException copyWith(Map<String, String> newContext) {
        return new GitHubNetworkException(getMessage(), getCause(), newContext, recoverySuggestions());
    }
}
