package org.javai.ghresilience.analysis;

import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raised by the API client when GitHub answers with an unsuccessful status.
 * This is raw input to the {@link ErrorAnalyzer}, not part of the error taxonomy.
 */
public class GitHubHttpException extends RuntimeException implements ResponseMetadataCarrier {

    private final transient ResponseMetadata metadata;

    public GitHubHttpException(String message, ResponseMetadata metadata) {
        this(message, metadata, null);
    }

    public GitHubHttpException(String message, ResponseMetadata metadata, Throwable cause) {
        super(message, cause);
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
    }

    public GitHubHttpException(String message, int statusCode, Map<String, String> headers) {
        this(message, ResponseMetadata.of(statusCode, headers));
    }

    /**
     * Creates an exception describing an unsuccessful JDK HTTP client response.
     */
    public static GitHubHttpException of(String method, String path, HttpResponse<?> response) {
        ResponseMetadata metadata = ResponseMetadata.of(response);
        return new GitHubHttpException(
                method + " " + path + " failed with HTTP " + metadata.statusCode(), metadata);
    }

    public int statusCode() {
        return metadata.statusCode();
    }

    @Override
    public Optional<ResponseMetadata> responseMetadata() {
        return Optional.of(metadata);
    }
}
