package org.javai.ghresilience.ops;

import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * An SLF4J logger that keeps every formatted message at INFO and above.
 */
final class CapturingSlf4jLogger extends LegacyAbstractLogger {

	record Entry(Level level, String message) {}

	private final List<Entry> entries = new ArrayList<>();

	CapturingSlf4jLogger() {
		this.name = "capturing";
	}

	List<Entry> entries() {
		return entries;
	}

	List<String> messages() {
		return entries.stream().map(Entry::message).toList();
	}

	@Override
	public boolean isTraceEnabled() {
		return false;
	}

	@Override
	public boolean isDebugEnabled() {
		return false;
	}

	@Override
	public boolean isInfoEnabled() {
		return true;
	}

	@Override
	public boolean isWarnEnabled() {
		return true;
	}

	@Override
	public boolean isErrorEnabled() {
		return true;
	}

	@Override
	protected String getFullyQualifiedCallerName() {
		return null;
	}

	@Override
	protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
											   Object[] arguments, Throwable throwable) {
		entries.add(new Entry(level, MessageFormatter.arrayFormat(messagePattern, arguments).getMessage()));
	}
}
