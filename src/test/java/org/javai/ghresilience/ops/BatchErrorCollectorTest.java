package org.javai.ghresilience.ops;

import org.javai.ghresilience.ContextKeys;
import org.javai.ghresilience.ErrorKind;
import org.javai.ghresilience.GitHubNetworkException;
import org.javai.ghresilience.analysis.GitHubHttpException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class BatchErrorCollectorTest {

	@Test
	void track_recordsSuccessesAndFailuresAndContinues() {
		BatchErrorCollector batch = new BatchErrorCollector();
		List<String> repositories = List.of("acme/hw1-alice", "acme/hw1-bob", "acme/hw1-carol");
		List<String> deployed = new ArrayList<>();

		for (String repository : repositories) {
			Optional<String> result = batch.track("secrets.deploy", Map.of(ContextKeys.REPOSITORY, repository), op -> {
				if (repository.endsWith("bob")) {
					throw new GitHubHttpException("Not Found", 404, Map.of());
				}
				deployed.add(repository);
				return repository;
			});
			assertThat(result.isPresent()).isEqualTo(!repository.endsWith("bob"));
		}

		assertThat(deployed).containsExactly("acme/hw1-alice", "acme/hw1-carol");
		assertThat(batch.total()).isEqualTo(3);
		assertThat(batch.failures()).singleElement().satisfies(e -> {
			assertThat(e.kind()).isEqualTo(ErrorKind.RESOURCE_NOT_FOUND);
			assertThat(e.contextValue(ContextKeys.REPOSITORY)).contains("acme/hw1-bob");
		});

		ErrorSummary summary = batch.summarize();
		assertThat(summary.successes()).isEqualTo(2);
		assertThat(summary.count(ErrorKind.RESOURCE_NOT_FOUND)).isEqualTo(1);
	}

	@Test
	void concurrentRecording_losesNothing() throws Exception {
		BatchErrorCollector batch = new BatchErrorCollector();
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < 1000; i++) {
				int item = i;
				futures.add(executor.submit(() -> {
					if (item % 4 == 0) {
						batch.recordFailure(new GitHubNetworkException("reset", null));
					} else {
						batch.recordSuccess();
					}
				}));
			}
			for (Future<?> future : futures) {
				future.get();
			}
		} finally {
			executor.shutdownNow();
		}

		ErrorSummary summary = batch.summarize();
		assertThat(summary.totalOperations()).isEqualTo(1000);
		assertThat(summary.count(ErrorKind.NETWORK)).isEqualTo(250);
		assertThat(summary.successRate()).isEqualTo(0.75);
	}

	@Test
	void recordFailure_rejectsNull() {
		assertThatThrownBy(() -> new BatchErrorCollector().recordFailure(null))
				.isInstanceOf(NullPointerException.class);
	}
}
