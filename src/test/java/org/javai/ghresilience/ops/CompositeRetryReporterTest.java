package org.javai.ghresilience.ops;

import org.javai.ghresilience.ErrorAnalysis;
import org.javai.ghresilience.ErrorKind;
import org.javai.ghresilience.GitHubApiException;
import org.javai.ghresilience.GitHubServerException;
import org.javai.ghresilience.GiveUpReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeRetryReporterTest {

	@Test
	void delegatesEveryEventToEveryReporter() {
		List<String> first = new ArrayList<>();
		List<String> second = new ArrayList<>();
		RetryReporter composite = RetryReporter.composite(recording(first), recording(second));

		composite.reportAttempt("op", 1, 3);
		composite.reportRetryScheduled("op", ErrorAnalysis.of(ErrorKind.SERVER, "X", 502), 1, Duration.ofSeconds(1));
		composite.reportRecovered("op", 2, Duration.ofSeconds(1));
		composite.reportGaveUp("op", new GitHubServerException("down", 502), 3, GiveUpReason.ATTEMPTS_EXHAUSTED);

		assertThat(first).containsExactly("attempt", "scheduled", "recovered", "gaveUp");
		assertThat(second).isEqualTo(first);
	}

	@Test
	void failingReporter_doesNotStopOthers() {
		List<String> events = new ArrayList<>();
		RetryReporter failing = new RetryReporter() {
			@Override
			public void reportRecovered(String operation, int attempts, Duration totalDelay) {
				throw new IllegalStateException("metrics sink unavailable");
			}
		};

		CompositeRetryReporter composite = CompositeRetryReporter.of(failing, recording(events));

		assertThatCode(() -> composite.reportRecovered("op", 2, Duration.ZERO)).doesNotThrowAnyException();
		assertThat(events).containsExactly("recovered");
	}

	@Test
	void of_collection() {
		CompositeRetryReporter composite = CompositeRetryReporter.of(
				List.of(RetryReporter.noOp(), new Log4jRetryReporter(), RetryReporter.noOp()));

		assertThat(composite.size()).isEqualTo(3);
	}

	private static RetryReporter recording(List<String> events) {
		return new RetryReporter() {
			@Override
			public void reportAttempt(String operation, int attempt, int maxAttempts) {
				events.add("attempt");
			}

			@Override
			public void reportRetryScheduled(String operation, ErrorAnalysis analysis, int attempt, Duration delay) {
				events.add("scheduled");
			}

			@Override
			public void reportRecovered(String operation, int attempts, Duration totalDelay) {
				events.add("recovered");
			}

			@Override
			public void reportGaveUp(String operation, GitHubApiException error, int attempts, GiveUpReason reason) {
				events.add("gaveUp");
			}
		};
	}
}
