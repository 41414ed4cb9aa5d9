package org.javai.ghresilience.ops;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Records the events of one freshly named logger below {@code org.javai.ghresilience},
 * which the test configuration enables at DEBUG.
 */
final class CapturingAppender extends AbstractAppender {

	private final List<LogEvent> events = new CopyOnWriteArrayList<>();
	private final Logger logger;

	private CapturingAppender(Logger logger) {
		super("capture-" + logger.getName(), null, null, true, Property.EMPTY_ARRAY);
		this.logger = logger;
	}

	static CapturingAppender forNewLogger() {
		String name = "org.javai.ghresilience.test." + UUID.randomUUID().toString().replace("-", "");
		Logger logger = (Logger) LogManager.getLogger(name);
		CapturingAppender appender = new CapturingAppender(logger);
		appender.start();
		logger.addAppender(appender);
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	Logger logger() {
		return logger;
	}

	String loggerName() {
		return logger.getName();
	}

	List<LogEvent> events() {
		return events;
	}

	List<LogEvent> eventsAt(Level level) {
		return events.stream().filter(e -> e.getLevel() == level).collect(Collectors.toList());
	}

	List<String> messages() {
		return events.stream().map(e -> e.getMessage().getFormattedMessage()).collect(Collectors.toList());
	}

	void detach() {
		logger.removeAppender(this);
		stop();
	}
}
