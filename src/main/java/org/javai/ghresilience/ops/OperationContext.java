package org.javai.ghresilience.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.ghresilience.ContextKeys;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.analysis.ErrorAnalyzer;
import org.javai.ghresilience.retry.ThrowingFunction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named, scoped logging context around a GitHub operation that performs no retries.
 *
 * <p>Used where retrying is the caller's responsibility, such as fan-out over many
 * repositories where each item's failure is recorded and the batch continues.
 * Failures are converted into the error taxonomy, so that errors look the same whether
 * they come from here or from the {@link org.javai.ghresilience.retry.Retrier}.</p>
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>{@code
 * try (OperationContext op = OperationContext.open("secrets.deploy", Map.of("repository", repo))) {
 *     try {
 *         client.putSecret(repo, name, value);
 *         op.success("Deployed secret " + name);
 *     } catch (IOException e) {
 *         op.error("Could not deploy secret " + name, e);
 *     }
 * }
 * }</pre>
 *
 * <p>A scope closed without {@code success} or {@code error}, for example because an
 * unchecked exception escaped the block, is logged at WARN. {@code call} covers every
 * exit path automatically:</p>
 * <pre>{@code
 * OperationContext.call("secrets.deploy", Map.of("repository", repo), op -> {
 *     client.putSecret(repo, name, value);
 *     op.success("Deployed secret " + name);
 *     return null;
 * });
 * }</pre>
 *
 * <p>An instance belongs to the thread that opened it.</p>
 */
public final class OperationContext implements AutoCloseable {

	static final String DEFAULT_LOGGER_NAME = "org.javai.ghresilience.Operation";

	private static final Marker OPERATION_MARKER = MarkerManager.getMarker("OPERATION");
	private static final ErrorAnalyzer DEFAULT_ANALYZER = new ErrorAnalyzer();

	private final String name;
	private final Map<String, String> context;
	private final ErrorAnalyzer analyzer;
	private final Logger logger;
	private boolean outcomeRecorded;
	private GitHubApiException raised;

	private OperationContext(String name, Map<String, String> context, ErrorAnalyzer analyzer, Logger logger) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.context = Map.copyOf(Objects.requireNonNull(context, "context must not be null"));
		this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		logger.debug(OPERATION_MARKER, "Starting operation [{}]{}", name, formatContext(this.context));
	}

	public static OperationContext open(String name) {
		return open(name, Map.of());
	}

	public static OperationContext open(String name, Map<String, String> context) {
		return open(name, context, DEFAULT_ANALYZER, LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Opens a context with a specific analyzer and logger.
	 */
	public static OperationContext open(String name, Map<String, String> context,
										ErrorAnalyzer analyzer, Logger logger) {
		return new OperationContext(name, context, analyzer, logger);
	}

	/**
	 * Runs {@code body} inside a new context. A body that returns without recording an
	 * outcome is logged as a success. An exception escaping the body is logged at ERROR,
	 * converted into the taxonomy and rethrown; it is never retried.
	 *
	 * @throws GitHubApiException if the body fails
	 */
	public static <T> T call(String name, Map<String, String> context,
							 ThrowingFunction<OperationContext, T, ? extends Exception> body) {
		return call(open(name, context), body);
	}

	/**
	 * Runs {@code body} inside the given, freshly opened context and closes it.
	 *
	 * @throws GitHubApiException if the body fails
	 */
	public static <T> T call(OperationContext scope,
							 ThrowingFunction<OperationContext, T, ? extends Exception> body) {
		Objects.requireNonNull(body, "body must not be null");
		try (scope) {
			try {
				T result = body.apply(scope);
				if (!scope.outcomeRecorded) {
					scope.success("completed");
				}
				return result;
			} catch (Exception e) {
				if (e == scope.raised) {
					// Already logged by error()
					throw scope.raised;
				}
				if (e instanceof InterruptedException) {
					Thread.currentThread().interrupt();
				}
				throw scope.recordError("Unhandled failure", e);
			}
		}
	}

	public String name() {
		return name;
	}

	public Map<String, String> context() {
		return context;
	}

	/**
	 * Logs successful completion at INFO.
	 */
	public void success(String message) {
		outcomeRecorded = true;
		logger.info(OPERATION_MARKER, "Operation [{}] succeeded: {}{}", name, message, formatContext(context));
	}

	/**
	 * Logs the failure at ERROR, converts {@code cause} into the taxonomy and throws it.
	 *
	 * @throws GitHubApiException always
	 */
	public void error(String message, Throwable cause) {
		throw recordError(message, cause);
	}

	/**
	 * Logs the failure at ERROR and returns it converted into the taxonomy, without throwing.
	 * For batch loops that record a failed item and continue.
	 */
	public GitHubApiException recordError(String message, Throwable cause) {
		Objects.requireNonNull(cause, "cause must not be null");
		Map<String, String> errorContext = new LinkedHashMap<>(context);
		errorContext.put(ContextKeys.OPERATION, name);
		GitHubApiException converted = analyzer.toException(cause, errorContext);

		outcomeRecorded = true;
		raised = converted;
		logger.error(OPERATION_MARKER, "Operation [{}] failed: {} [{}] {}{}. Suggestions: {}",
				name,
				message,
				converted.kind(),
				converted.getMessage(),
				formatContext(context),
				String.join("; ", converted.recoverySuggestions()));
		return converted;
	}

	/**
	 * Closes the scope. Logs a WARN when neither {@link #success} nor an error was recorded,
	 * which is also what an exception escaping a try-with-resources block leaves behind.
	 */
	@Override
	public void close() {
		if (!outcomeRecorded) {
			logger.warn(OPERATION_MARKER, "Operation [{}] ended without a recorded outcome{}",
					name, formatContext(context));
		}
	}

	private static String formatContext(Map<String, String> context) {
		return context.isEmpty() ? "" : " " + context;
	}
}
