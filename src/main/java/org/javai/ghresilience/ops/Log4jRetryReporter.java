package org.javai.ghresilience.ops;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.ErrorKind;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GiveUpReason;

import java.time.Duration;
import java.util.Map;

/**
 * Reports retry episodes using Log4j2.
 *
 * <p>Levels:
 * <ul>
 *   <li>attempts and scheduled retries → DEBUG (rate-limit waits → WARN)</li>
 *   <li>success after retrying → INFO</li>
 *   <li>final failure → ERROR</li>
 * </ul>
 */
public class Log4jRetryReporter implements RetryReporter {

	static final String DEFAULT_LOGGER_NAME = "org.javai.ghresilience.Retry";

	private static final Marker RETRY_ATTEMPT_MARKER = MarkerManager.getMarker("RETRY_ATTEMPT");
	private static final Marker RETRY_SCHEDULED_MARKER = MarkerManager.getMarker("RETRY_SCHEDULED");
	private static final Marker RETRY_RECOVERED_MARKER = MarkerManager.getMarker("RETRY_RECOVERED");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportAttempt(String operation, int attempt, int maxAttempts) {
		logger.debug(RETRY_ATTEMPT_MARKER, "Attempt {}/{} for operation [{}]", attempt, maxAttempts, operation);
	}

	@Override
	public void reportRetryScheduled(String operation, ErrorAnalysis analysis, int attempt, Duration delay) {
		Level level = analysis.kind() == ErrorKind.RATE_LIMIT ? Level.WARN : Level.DEBUG;
		logger.log(level, RETRY_SCHEDULED_MARKER,
				"Attempt {} for operation [{}] failed with {} ({}). Retrying in {} ms",
				attempt,
				operation,
				analysis.kind(),
				analysis.errorType(),
				delay.toMillis());
	}

	@Override
	public void reportRecovered(String operation, int attempts, Duration totalDelay) {
		logger.info(RETRY_RECOVERED_MARKER,
				"Operation [{}] succeeded after {} attempts ({} ms spent waiting)",
				operation,
				attempts,
				totalDelay.toMillis());
	}

	@Override
	public void reportGaveUp(String operation, GitHubApiException error, int attempts, GiveUpReason reason) {
		logger.error(RETRY_EXHAUSTED_MARKER,
				"Operation [{}] failed after {} attempt(s), reason={}, kind={}: {}{}. Suggestions: {}",
				operation,
				attempts,
				reason.code(),
				error.kind(),
				error.getMessage(),
				formatContext(error.context()),
				String.join("; ", error.recoverySuggestions()));
	}

	private static String formatContext(Map<String, String> context) {
		if (context == null || context.isEmpty()) {
			return "";
		}
		return " " + context;
	}
}
