package org.javai.ghresilience.ops;

import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GiveUpReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is logged and the remaining reporters still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.of(
 *     new Log4jRetryReporter(),
 *     new MetricsRetryReporter("classroom")
 * );
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOGGER = LoggerFactory.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	@Override
	public void reportAttempt(String operation, int attempt, int maxAttempts) {
		forEach("reportAttempt", r -> r.reportAttempt(operation, attempt, maxAttempts));
	}

	@Override
	public void reportRetryScheduled(String operation, ErrorAnalysis analysis, int attempt, Duration delay) {
		forEach("reportRetryScheduled", r -> r.reportRetryScheduled(operation, analysis, attempt, delay));
	}

	@Override
	public void reportRecovered(String operation, int attempts, Duration totalDelay) {
		forEach("reportRecovered", r -> r.reportRecovered(operation, attempts, totalDelay));
	}

	@Override
	public void reportGaveUp(String operation, GitHubApiException error, int attempts, GiveUpReason reason) {
		forEach("reportGaveUp", r -> r.reportGaveUp(operation, error, attempts, reason));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void forEach(String method, Consumer<RetryReporter> call) {
		for (RetryReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				LOGGER.warn("RetryReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage());
			}
		}
	}
}
