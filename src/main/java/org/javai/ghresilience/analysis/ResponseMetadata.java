package org.javai.ghresilience.analysis;

import java.net.http.HttpResponse;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * The parts of a failed GitHub API response that drive classification: the HTTP status
 * and the rate-limit headers. Header lookup is case-insensitive.
 *
 * @param statusCode The HTTP status code
 * @param headers Response headers, first value per name
 */
public record ResponseMetadata(int statusCode, Map<String, String> headers) {

    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    public ResponseMetadata {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be a valid HTTP status, was: " + statusCode);
        }
        TreeMap<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    normalized.put(name, value.trim());
                }
            });
        }
        headers = Collections.unmodifiableMap(normalized);
    }

    public static ResponseMetadata of(int statusCode) {
        return new ResponseMetadata(statusCode, Map.of());
    }

    public static ResponseMetadata of(int statusCode, Map<String, String> headers) {
        return new ResponseMetadata(statusCode, headers);
    }

    /**
     * Adapts a JDK HTTP client response, keeping the first value of each header.
     */
    public static ResponseMetadata of(HttpResponse<?> response) {
        Objects.requireNonNull(response, "response must not be null");
        Map<String, String> first = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                first.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return new ResponseMetadata(response.statusCode(), first);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public OptionalLong rateLimitRemaining() {
        return parseLong(RATE_LIMIT_REMAINING);
    }

    /**
     * The instant the current rate-limit window resets ({@code X-RateLimit-Reset}, epoch seconds).
     */
    public Optional<Instant> rateLimitReset() {
        OptionalLong epochSeconds = parseLong(RATE_LIMIT_RESET);
        if (epochSeconds.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochSecond(epochSeconds.getAsLong()));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * The server-requested wait from a numeric {@code Retry-After} header.
     */
    public Optional<Duration> retryAfter() {
        OptionalLong seconds = parseLong(RETRY_AFTER);
        return seconds.isPresent() && seconds.getAsLong() >= 0
                ? Optional.of(Duration.ofSeconds(seconds.getAsLong()))
                : Optional.empty();
    }

    /**
     * Whether the response says the rate limit is exhausted: no requests remaining,
     * or an explicit {@code Retry-After}.
     */
    public boolean hasRateLimitSignals() {
        OptionalLong remaining = rateLimitRemaining();
        return (remaining.isPresent() && remaining.getAsLong() == 0) || retryAfter().isPresent();
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    private OptionalLong parseLong(String name) {
        String value = headers.get(name);
        if (value == null || value.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
