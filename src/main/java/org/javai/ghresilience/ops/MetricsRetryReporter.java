package org.javai.ghresilience.ops;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GiveUpReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Reports retry episodes as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_scheduled","timestamp":"2024-01-20T10:30:00Z","trackingKey":"classroom.repos.list","attempt":1,"delayMs":1000,"kind":"NETWORK",...}
 * }</pre>
 *
 * <p>Individual attempts are not reported; only scheduled retries, recoveries and
 * final failures. Reporting never breaks the application.</p>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.ghresilience.Metrics";
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryScheduled(String operation, ErrorAnalysis analysis, int attempt, Duration delay) {
		ObjectNode event = event("retry_scheduled", operation);
		event.put("attempt", attempt);
		event.put("delayMs", delay.toMillis());
		event.put("kind", analysis.kind().name());
		event.put("errorType", analysis.errorType());
		if (analysis.statusCode() != null) {
			event.put("statusCode", analysis.statusCode());
		}
		event.put("rateLimited", analysis.rateLimitError());
		emit(event);
	}

	@Override
	public void reportRecovered(String operation, int attempts, Duration totalDelay) {
		ObjectNode event = event("retry_recovered", operation);
		event.put("attempts", attempts);
		event.put("totalDelayMs", totalDelay.toMillis());
		emit(event);
	}

	@Override
	public void reportGaveUp(String operation, GitHubApiException error, int attempts, GiveUpReason reason) {
		ObjectNode event = event("retry_gave_up", operation);
		event.put("attempts", attempts);
		event.put("reason", reason.code());
		event.put("kind", error.kind().name());
		event.put("message", error.getMessage());
		appendContext(event, error.context());
		emit(event);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode event(String eventType, String operation) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", clock.instant().toString());
		event.put("trackingKey", buildTrackingKey(operation));
		event.put("operation", operation);
		return event;
	}

	private void appendContext(ObjectNode event, Map<String, String> context) {
		if (context == null || context.isEmpty()) {
			return;
		}
		ObjectNode node = event.putObject("context");
		context.forEach(node::put);
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.debug("Dropping unserializable metrics event {}: {}", event.get("eventType"), e.getMessage());
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
