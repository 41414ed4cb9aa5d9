package org.javai.ghresilience.ops;

import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.retry.ThrowingFunction;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects per-item outcomes of a batch fan-out so that failed items are recorded
 * and the batch continues. Safe to share between worker threads.
 *
 * <pre>{@code
 * BatchErrorCollector batch = new BatchErrorCollector();
 * for (String repo : repos) {
 *     batch.track("secrets.deploy", Map.of(ContextKeys.REPOSITORY, repo),
 *             op -> client.putSecret(repo, name, value));
 * }
 * log.info(batch.summarize().render());
 * }</pre>
 */
public final class BatchErrorCollector {

	private final AtomicInteger successes = new AtomicInteger();
	private final Queue<GitHubApiException> failures = new ConcurrentLinkedQueue<>();

	public void recordSuccess() {
		successes.incrementAndGet();
	}

	public void recordFailure(GitHubApiException error) {
		failures.add(Objects.requireNonNull(error, "error must not be null"));
	}

	/**
	 * Runs one item inside an {@link OperationContext} and records its outcome.
	 *
	 * @return the item's result, or empty if it failed
	 */
	public <T> Optional<T> track(String operation, Map<String, String> context,
								 ThrowingFunction<OperationContext, T, ? extends Exception> body) {
		try {
			T result = OperationContext.call(operation, context, body);
			recordSuccess();
			return Optional.ofNullable(result);
		} catch (GitHubApiException e) {
			recordFailure(e);
			return Optional.empty();
		}
	}

	public List<GitHubApiException> failures() {
		return List.copyOf(failures);
	}

	public int total() {
		return successes.get() + failures.size();
	}

	/**
	 * Summarizes the outcomes recorded so far. Call after the workers have finished
	 * for a consistent snapshot.
	 */
	public ErrorSummary summarize() {
		List<GitHubApiException> snapshot = List.copyOf(failures);
		return ErrorSummary.of(snapshot, successes.get() + snapshot.size());
	}
}
