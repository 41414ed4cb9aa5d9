package org.javai.ghresilience.retry;

import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.ErrorKind;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GiveUpReason;
import org.javai.ghresilience.analysis.ErrorAnalyzer;
import org.javai.ghresilience.analysis.ErrorClassifier;
import org.javai.ghresilience.ops.Log4jRetryReporter;
import org.javai.ghresilience.ops.RetryReporter;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * Executes GitHub API operations with bounded retries, exponential backoff with jitter,
 * and rate-limit awareness.
 *
 * <p>Each call starts a fresh retry episode. A failed attempt is classified by the
 * {@link ErrorClassifier}; retryable failures are retried after the policy's delay until
 * an attempt succeeds, the attempts run out, or the next wait would overrun the policy's
 * timeout. Authentication and not-found failures are never retried. When the episode
 * fails, a {@link GitHubApiException} of the matching variant is thrown, wrapping the
 * last underlying exception and carrying the attempt count and total delay in its context.</p>
 *
 * <p>Instances are immutable and may be shared across threads.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.builder().maxAttempts(5).build())
 *     .build();
 *
 * List<Repo> repos = retrier.execute(
 *     "repos.list",
 *     Map.of(ContextKeys.ORGANIZATION, org),
 *     () -> client.listRepositories(org)
 * );
 * }</pre>
 */
public final class Retrier {

    private static final double JITTER_LOW = 0.9;
    private static final double JITTER_HIGH = 1.1;
    private static final Duration MAX_EXACT_JITTER = Duration.ofDays(365);

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final RetryReporter reporter;
    private final RandomGenerator random;
    private final Clock clock;
    private final Sleeper sleeper;

    private Retrier(RetryPolicy policy, ErrorClassifier classifier, RetryReporter reporter,
                    RandomGenerator random, Clock clock, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.random = random;  // null means ThreadLocalRandom of the calling thread
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a Retrier with the given policy, the default analyzer and Log4j reporting.
     */
    public static Retrier of(RetryPolicy policy) {
        return builder().policy(policy).build();
    }

    /**
     * Creates a Retrier with {@link RetryPolicy#defaults()}.
     */
    public static Retrier withDefaults() {
        return builder().build();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy = RetryPolicy.defaults();
        private ErrorClassifier classifier;
        private RetryReporter reporter;
        private RandomGenerator random;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD_SLEEP;

        private Builder() {}

        /**
         * Sets the retry policy (defaults to {@link RetryPolicy#defaults()}).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the classifier for failed attempts (defaults to an {@link ErrorAnalyzer}
         * sharing this builder's clock).
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (defaults to {@link Log4jRetryReporter}).
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the random source used for jitter (defaults to the calling thread's
         * {@link ThreadLocalRandom}).
         */
        public Builder random(RandomGenerator random) {
            this.random = Objects.requireNonNull(random, "random must not be null");
            return this;
        }

        /**
         * Sets the clock used to measure elapsed time against the policy's timeout.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Retrier build() {
            ErrorClassifier effectiveClassifier = classifier != null
                    ? classifier
                    : ErrorAnalyzer.builder().clock(clock).build();
            RetryReporter effectiveReporter = reporter != null ? reporter : new Log4jRetryReporter();
            return new Retrier(policy, effectiveClassifier, effectiveReporter, random, clock, sleeper);
        }
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Executes an operation with retry according to the configured policy.
     *
     * @param operation The operation name for reporting and error context
     * @param work The call to the GitHub API
     * @return The value returned by the first successful attempt
     * @throws GitHubApiException if the episode fails
     */
    public <T> T execute(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return execute(operation, Map.of(), work);
    }

    /**
     * Executes an operation with retry, attaching the given context to the error
     * thrown if the episode fails.
     *
     * @param operation The operation name for reporting and error context
     * @param context Context such as repository, organization or assignment prefix
     * @param work The call to the GitHub API
     * @return The value returned by the first successful attempt
     * @throws GitHubApiException if the episode fails
     */
    public <T> T execute(String operation, Map<String, String> context,
                         ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(work, "work must not be null");

        RetryState state = RetryState.start(clock);

        while (true) {
            int attempt = state.beginAttempt();
            reporter.reportAttempt(operation, attempt, policy.maxAttempts());
            try {
                T result = work.get();
                if (attempt > 1) {
                    reporter.reportRecovered(operation, attempt, state.totalDelay());
                }
                return result;
            } catch (Exception e) {
                ErrorAnalysis analysis = recordFailure(state, e);
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw giveUp(operation, context, state, GiveUpReason.INTERRUPTED);
                }

                RetryDecision decision = decide(state, analysis);

                if (decision instanceof RetryDecision.GiveUp stop) {
                    throw giveUp(operation, context, state, stop.reason());
                }

                Duration delay = ((RetryDecision.Retry) decision).delay();
                reporter.reportRetryScheduled(operation, analysis, attempt, delay);
                if (!sleep(delay)) {
                    throw giveUp(operation, context, state, GiveUpReason.INTERRUPTED);
                }
                state.recordDelay(delay);
            }
        }
    }

    /**
     * Executes an action without a result with retry.
     *
     * @throws GitHubApiException if the episode fails
     */
    public void run(String operation, ThrowingRunnable<? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        execute(operation, Map.of(), () -> {
            work.run();
            return null;
        });
    }

    /**
     * Decorates a supplier so that every call runs as its own retry episode.
     *
     * @return A supplier that throws {@link GitHubApiException} when an episode fails
     */
    public <T> Supplier<T> wrap(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> execute(operation, work);
    }

    /**
     * Decorates a function so that every call runs as its own retry episode.
     * The argument's string form is added to the error context under {@code argument}.
     *
     * @return A function that throws {@link GitHubApiException} when an episode fails
     */
    public <A, R> Function<A, R> wrapFunction(String operation, ThrowingFunction<A, R, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return argument -> execute(operation, Map.of("argument", String.valueOf(argument)),
                () -> work.apply(argument));
    }

    /**
     * Decides whether the failed attempt recorded in {@code state} is retried, and after which delay.
     */
    RetryDecision decide(RetryState state, ErrorAnalysis analysis) {
        if (!analysis.retryable() || isNeverRetried(analysis.kind())) {
            return RetryDecision.GiveUp.because(GiveUpReason.NON_RETRYABLE);
        }
        if (state.attempt() >= policy.maxAttempts()) {
            return RetryDecision.GiveUp.because(GiveUpReason.ATTEMPTS_EXHAUSTED);
        }
        Duration delay = nextDelay(state.attempt(), analysis);
        if (state.wouldExceed(policy.timeout(), delay)) {
            return RetryDecision.GiveUp.because(GiveUpReason.TIMEOUT_EXCEEDED);
        }
        return RetryDecision.Retry.after(delay);
    }

    /**
     * The delay before the attempt after {@code attempt}, with jitter applied.
     * A server-provided rate-limit delay is a floor that jitter never undercuts.
     */
    Duration nextDelay(int attempt, ErrorAnalysis analysis) {
        Duration delay = policy.delayFor(attempt, analysis);
        if (!policy.jitter()) {
            return delay;
        }
        double factor = jitterSource().nextDouble(JITTER_LOW, JITTER_HIGH);
        Duration jittered = jittered(delay, factor);
        if (policy.respectRateLimits() && analysis.hasRetryDelay()
                && jittered.compareTo(analysis.retryDelay()) < 0) {
            return analysis.retryDelay();
        }
        return jittered;
    }

    private static Duration jittered(Duration delay, double factor) {
        if (delay.compareTo(MAX_EXACT_JITTER) > 0) {
            // Nanosecond precision would overflow; whole seconds are plenty at this size
            double seconds = delay.getSeconds() * factor;
            return seconds >= Long.MAX_VALUE ? delay : Duration.ofSeconds((long) seconds);
        }
        return Duration.ofNanos((long) (delay.toNanos() * factor));
    }

    private ErrorAnalysis recordFailure(RetryState state, Exception e) {
        ErrorAnalysis analysis = classifier.analyze(e);
        GitHubApiException error = e instanceof GitHubApiException taxonomyError
                && taxonomyError.kind() == analysis.kind()
                ? taxonomyError
                : GitHubApiException.from(analysis, e, Map.of());
        state.recordFailure(error, analysis);
        return analysis;
    }

    private GitHubApiException giveUp(String operation, Map<String, String> context,
                                      RetryState state, GiveUpReason reason) {
        Map<String, String> merged = new LinkedHashMap<>(context);
        merged.putAll(state.outcomeContext(operation, policy.maxAttempts(), reason));
        GitHubApiException error = state.lastError().withContext(merged);
        reporter.reportGaveUp(operation, error, state.attempt(), reason);
        return error;
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private RandomGenerator jitterSource() {
        return random != null ? random : ThreadLocalRandom.current();
    }

    private static boolean isNeverRetried(ErrorKind kind) {
        return kind == ErrorKind.AUTHENTICATION || kind == ErrorKind.RESOURCE_NOT_FOUND;
    }

    @FunctionalInterface
    interface Sleeper {
        Sleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);

        void sleep(Duration delay) throws InterruptedException;
    }
}
