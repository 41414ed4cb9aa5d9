package org.javai.ghresilience.ops;

import org.javai.ghresilience.ErrorKind;
import org.javai.ghresilience.GitHubApiException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * End-of-run summary of a batch of GitHub operations: failures counted per
 * {@link ErrorKind}, the success rate, and the distinct recovery suggestions.
 *
 * @param totalOperations number of operations attempted, successful or not
 * @param failures number of failed operations
 * @param countsByKind failures per kind; kinds without failures are absent
 * @param recoverySuggestions distinct suggestions, in the order first seen
 */
public record ErrorSummary(
		int totalOperations,
		int failures,
		Map<ErrorKind, Integer> countsByKind,
		List<String> recoverySuggestions
) {

	public ErrorSummary {
		if (totalOperations < 0) {
			throw new IllegalArgumentException("totalOperations must not be negative");
		}
		if (failures < 0 || failures > totalOperations) {
			throw new IllegalArgumentException(
					"failures must be between 0 and totalOperations, got " + failures + " of " + totalOperations);
		}
		Objects.requireNonNull(countsByKind, "countsByKind must not be null");
		EnumMap<ErrorKind, Integer> counts = new EnumMap<>(ErrorKind.class);
		counts.putAll(countsByKind);
		countsByKind = Collections.unmodifiableMap(counts);
		recoverySuggestions = List.copyOf(recoverySuggestions);
	}

	/**
	 * Summarizes the failures of a batch of {@code totalOperations} operations.
	 *
	 * @throws IllegalArgumentException if there are more errors than operations
	 */
	public static ErrorSummary of(Collection<? extends GitHubApiException> errors, int totalOperations) {
		Objects.requireNonNull(errors, "errors must not be null");
		EnumMap<ErrorKind, Integer> counts = new EnumMap<>(ErrorKind.class);
		Set<String> suggestions = new LinkedHashSet<>();
		for (GitHubApiException error : errors) {
			counts.merge(error.kind(), 1, Integer::sum);
			suggestions.addAll(error.recoverySuggestions());
		}
		return new ErrorSummary(totalOperations, errors.size(), counts, List.copyOf(suggestions));
	}

	/**
	 * Summarizes errors where every operation failed.
	 */
	public static ErrorSummary of(Collection<? extends GitHubApiException> errors) {
		return of(errors, errors.size());
	}

	public int successes() {
		return totalOperations - failures;
	}

	/**
	 * Fraction of operations that succeeded, between 0.0 and 1.0. An empty batch counts as fully successful.
	 */
	public double successRate() {
		if (totalOperations == 0) {
			return 1.0;
		}
		return (double) successes() / totalOperations;
	}

	public int count(ErrorKind kind) {
		return countsByKind.getOrDefault(kind, 0);
	}

	public boolean hasFailures() {
		return failures > 0;
	}

	/**
	 * The kind with the most failures. Ties go to the kind declared first in {@link ErrorKind}.
	 */
	public Optional<ErrorKind> mostCommonKind() {
		ErrorKind best = null;
		int bestCount = 0;
		for (Map.Entry<ErrorKind, Integer> entry : countsByKind.entrySet()) {
			if (entry.getValue() > bestCount) {
				best = entry.getKey();
				bestCount = entry.getValue();
			}
		}
		return Optional.ofNullable(best);
	}

	/**
	 * Renders the summary as multi-line text for end-of-run output.
	 */
	public String render() {
		StringBuilder sb = new StringBuilder();
		sb.append(String.format(Locale.ROOT, "%d operations: %d succeeded, %d failed (%.1f%% success rate)",
				totalOperations, successes(), failures, successRate() * 100));
		countsByKind.forEach((kind, count) ->
				sb.append(System.lineSeparator()).append("  ").append(kind).append(": ").append(count));
		if (!recoverySuggestions.isEmpty()) {
			sb.append(System.lineSeparator()).append("Suggestions:");
			for (String suggestion : recoverySuggestions) {
				sb.append(System.lineSeparator()).append("  - ").append(suggestion);
			}
		}
		return sb.toString();
	}
}
