package org.javai.ghresilience.analysis;

import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.ErrorKind;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GitHubRateLimitException;
import org.javai.ghresilience.GitHubServerException;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import javax.net.ssl.SSLException;

/**
 * Classifies failed GitHub API calls into the error taxonomy.
 *
 * <p>Classification looks, in order, for:</p>
 * <ol>
 *   <li>authentication failures (HTTP 401, or 403 without rate-limit signals)</li>
 *   <li>rate limiting (HTTP 429, or 403 with rate-limit signals)</li>
 *   <li>network and timeout exceptions anywhere in the cause chain</li>
 *   <li>server errors (HTTP 5xx)</li>
 *   <li>missing resources (HTTP 404 and 410)</li>
 * </ol>
 * <p>Response metadata is read from the first {@link ResponseMetadataCarrier} on the cause chain.
 * When there is none, the exception messages are matched against well-known GitHub and
 * transport error texts. Anything still unrecognized is {@link ErrorKind#GENERIC} and,
 * unless configured otherwise, retryable.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class ErrorAnalyzer implements ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    /** Upper bound for a server-requested wait. */
    static final Duration MAX_SERVER_DELAY = Duration.ofDays(1);

    private static final Pattern AUTHENTICATION_TEXT = Pattern.compile(
            "bad credentials|unauthori[sz]ed|requires authentication|\\b401\\b|token (?:is )?(?:invalid|expired)");
    private static final Pattern RATE_LIMIT_TEXT = Pattern.compile(
            "rate limit|abuse detection|too many requests|\\b429\\b");
    private static final Pattern NETWORK_TEXT = Pattern.compile(
            "timed out|timeout|connection (?:reset|refused|aborted|closed)|broken pipe|network is unreachable");
    private static final Pattern SERVER_TEXT = Pattern.compile(
            "server error|bad gateway|service unavailable|\\b50[0234]\\b");
    private static final Pattern NOT_FOUND_TEXT = Pattern.compile(
            "not found|\\b404\\b");

    private final Clock clock;
    private final boolean unclassifiedRetryable;
    private final Duration defaultRateLimitDelay;

    private ErrorAnalyzer(Clock clock, boolean unclassifiedRetryable, Duration defaultRateLimitDelay) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.unclassifiedRetryable = unclassifiedRetryable;
        this.defaultRateLimitDelay = defaultRateLimitDelay;  // null means use policy backoff
    }

    /**
     * Creates an analyzer with the system clock that retries unclassified errors.
     */
    public ErrorAnalyzer() {
        this(Clock.systemUTC(), true, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring an ErrorAnalyzer.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private boolean unclassifiedRetryable = true;
        private Duration defaultRateLimitDelay;

        private Builder() {}

        /**
         * Sets the clock used to turn rate-limit reset timestamps into delays.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Whether errors that match no known category are retried (default {@code true}).
         */
        public Builder unclassifiedRetryable(boolean unclassifiedRetryable) {
            this.unclassifiedRetryable = unclassifiedRetryable;
            return this;
        }

        /**
         * Delay reported for rate-limit errors that carry no reset or Retry-After hint.
         * By default none is reported, and the retry policy's backoff applies.
         */
        public Builder defaultRateLimitDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            this.defaultRateLimitDelay = delay;
            return this;
        }

        public ErrorAnalyzer build() {
            return new ErrorAnalyzer(clock, unclassifiedRetryable, defaultRateLimitDelay);
        }
    }

    @Override
    public ErrorAnalysis analyze(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");

        if (error instanceof GitHubApiException taxonomyError) {
            return analyzeTaxonomyError(taxonomyError);
        }

        String errorType = typeName(error);

        Optional<ResponseMetadata> metadata = findMetadata(error);
        if (metadata.isPresent()) {
            ErrorAnalysis fromStatus = analyzeStatus(metadata.get(), errorType, error);
            if (fromStatus != null) {
                return fromStatus;
            }
        }

        if (hasNetworkCause(error)) {
            return ErrorAnalysis.of(ErrorKind.NETWORK, errorType, null);
        }

        return analyzeMessages(error, errorType);
    }

    /**
     * Classifies a failed response when no exception is available.
     */
    public ErrorAnalysis analyze(ResponseMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        String errorType = "HTTP " + metadata.statusCode();
        ErrorAnalysis fromStatus = analyzeStatus(metadata, errorType, null);
        return fromStatus != null ? fromStatus : unclassified(errorType, metadata.statusCode());
    }

    /**
     * Converts any exception into the taxonomy. Errors that already belong to it keep their
     * variant and gain the given context, unless a generic wrapper classifies more precisely
     * by its cause. Others are wrapped as the variant they classify to.
     *
     * @param error The exception to convert
     * @param context Context entries to attach, such as repository or organization
     * @return The taxonomy error, with {@code error} as its cause when it was wrapped
     */
    public GitHubApiException toException(Throwable error, Map<String, String> context) {
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(context, "context must not be null");
        ErrorAnalysis analysis = analyze(error);
        if (error instanceof GitHubApiException taxonomyError && taxonomyError.kind() == analysis.kind()) {
            return taxonomyError.withContext(context);
        }
        return GitHubApiException.from(analysis, error, context);
    }

    private ErrorAnalysis analyzeTaxonomyError(GitHubApiException error) {
        if (error.kind() == ErrorKind.GENERIC && error.getCause() != null) {
            // A generic wrapper may hide a cause we can classify more precisely
            ErrorAnalysis fromCause = analyze(error.getCause());
            if (fromCause.kind() != ErrorKind.GENERIC) {
                return fromCause;
            }
        }
        Integer statusCode = null;
        if (error instanceof GitHubServerException serverError && serverError.statusCode().isPresent()) {
            statusCode = serverError.statusCode().getAsInt();
        }
        Duration retryDelay = null;
        if (error instanceof GitHubRateLimitException rateLimitError) {
            retryDelay = rateLimitError.retryAfter().orElse(defaultRateLimitDelay);
        }
        boolean retryable = error.kind() == ErrorKind.GENERIC ? unclassifiedRetryable : error.isRetryable();
        return ErrorAnalysis.of(error.kind(), typeName(error), statusCode, retryDelay, retryable)
                .withRecoverySuggestions(error.recoverySuggestions());
    }

    private ErrorAnalysis analyzeStatus(ResponseMetadata metadata, String errorType, Throwable error) {
        int status = metadata.statusCode();

        if (status == 401) {
            return ErrorAnalysis.of(ErrorKind.AUTHENTICATION, errorType, status);
        }
        if (status == 403) {
            // GitHub reports secondary rate limits as 403 with an explanatory message
            boolean rateLimited = metadata.hasRateLimitSignals()
                    || (error != null && chainMatches(error, RATE_LIMIT_TEXT));
            return rateLimited
                    ? ErrorAnalysis.rateLimited(errorType, status, rateLimitDelay(metadata))
                    : ErrorAnalysis.of(ErrorKind.AUTHENTICATION, errorType, status);
        }
        if (status == 429) {
            return ErrorAnalysis.rateLimited(errorType, status, rateLimitDelay(metadata));
        }
        if (metadata.isServerError()) {
            return ErrorAnalysis.of(ErrorKind.SERVER, errorType, status);
        }
        if (status == 404 || status == 410) {
            return ErrorAnalysis.of(ErrorKind.RESOURCE_NOT_FOUND, errorType, status);
        }
        return null;
    }

    private Duration rateLimitDelay(ResponseMetadata metadata) {
        Optional<Instant> reset = metadata.rateLimitReset();
        if (reset.isPresent()) {
            // Reset is whole epoch seconds; truncating now keeps the delay stable within a second
            Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            Duration untilReset = Duration.between(now, reset.get());
            return untilReset.isNegative() ? Duration.ZERO : capped(untilReset);
        }
        return metadata.retryAfter().map(ErrorAnalyzer::capped).orElse(defaultRateLimitDelay);
    }

    private static Duration capped(Duration delay) {
        return delay.compareTo(MAX_SERVER_DELAY) > 0 ? MAX_SERVER_DELAY : delay;
    }

    private ErrorAnalysis analyzeMessages(Throwable error, String errorType) {
        if (chainMatches(error, AUTHENTICATION_TEXT)) {
            return ErrorAnalysis.of(ErrorKind.AUTHENTICATION, errorType, null);
        }
        if (chainMatches(error, RATE_LIMIT_TEXT)) {
            return ErrorAnalysis.rateLimited(errorType, null, defaultRateLimitDelay);
        }
        if (chainMatches(error, NETWORK_TEXT)) {
            return ErrorAnalysis.of(ErrorKind.NETWORK, errorType, null);
        }
        if (chainMatches(error, SERVER_TEXT)) {
            return ErrorAnalysis.of(ErrorKind.SERVER, errorType, null);
        }
        if (chainMatches(error, NOT_FOUND_TEXT)) {
            return ErrorAnalysis.of(ErrorKind.RESOURCE_NOT_FOUND, errorType, null);
        }
        return unclassified(errorType, null);
    }

    private ErrorAnalysis unclassified(String errorType, Integer statusCode) {
        return ErrorAnalysis.of(ErrorKind.GENERIC, errorType, statusCode, null, unclassifiedRetryable);
    }

    private static Optional<ResponseMetadata> findMetadata(Throwable error) {
        for (Throwable t : causeChain(error)) {
            if (t instanceof ResponseMetadataCarrier carrier) {
                Optional<ResponseMetadata> metadata = carrier.responseMetadata();
                if (metadata.isPresent()) {
                    return metadata;
                }
            }
        }
        return Optional.empty();
    }

    private static boolean hasNetworkCause(Throwable error) {
        for (Throwable t : causeChain(error)) {
            if (isNetworkException(t)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNetworkException(Throwable t) {
        return t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException
                || t instanceof SocketException
                || t instanceof SSLException
                || t instanceof InterruptedIOException
                || t instanceof TimeoutException;
    }

    private static boolean chainMatches(Throwable error, Pattern pattern) {
        for (Throwable t : causeChain(error)) {
            String message = t.getMessage();
            if (message != null && pattern.matcher(message.toLowerCase(Locale.ROOT)).find()) {
                return true;
            }
        }
        return false;
    }

    private static Iterable<Throwable> causeChain(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static String typeName(Throwable error) {
        String simpleName = error.getClass().getSimpleName();
        return simpleName.isEmpty() ? error.getClass().getName() : simpleName;
    }
}
