package org.javai.ghresilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ErrorAnalysisTest {

    @Test
    void authenticationError_cannotBeRetryable() {
        assertThatThrownBy(() -> new ErrorAnalysis(ErrorKind.AUTHENTICATION, "X", true, false, true,
                "Check the GitHub token", null, 401, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("never retryable");
    }

    @Test
    void authenticationFlag_mustMatchKind() {
        assertThatThrownBy(() -> new ErrorAnalysis(ErrorKind.NETWORK, "X", false, false, true,
                "Retry", null, null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rateLimitFlag_mustMatchKind() {
        assertThatThrownBy(() -> new ErrorAnalysis(ErrorKind.SERVER, "X", true, true, false,
                "Retry", null, 503, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rateLimitError");
    }

    @Test
    void negativeRetryDelay_isRejected() {
        assertThatThrownBy(() -> ErrorAnalysis.rateLimited("X", 429, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_authentication_ignoresRetryableRequest() {
        ErrorAnalysis analysis = ErrorAnalysis.of(ErrorKind.AUTHENTICATION, "X", 401, null, true);

        assertThat(analysis.retryable()).isFalse();
        assertThat(analysis.authenticationError()).isTrue();
    }

    @Test
    void of_usesKindDefaults() {
        ErrorAnalysis analysis = ErrorAnalysis.of(ErrorKind.RATE_LIMIT, "GitHubHttpException", 429);

        assertThat(analysis.retryable()).isTrue();
        assertThat(analysis.rateLimitError()).isTrue();
        assertThat(analysis.hasRetryDelay()).isFalse();
        assertThat(analysis.suggestedAction()).isEqualTo(ErrorKind.RATE_LIMIT.suggestedAction());
        assertThat(analysis.recoverySuggestions())
                .containsExactly("Wait for rate limit reset", "Use a different token", "Batch requests");
    }

    @Test
    void emptySuggestions_fallBackToKindDefaults() {
        ErrorAnalysis analysis = ErrorAnalysis.of(ErrorKind.NETWORK, "X", null)
                .withRecoverySuggestions(List.of());

        assertThat(analysis.recoverySuggestions()).isEqualTo(ErrorKind.NETWORK.defaultSuggestions());
    }

    @Test
    void withRecoverySuggestions_replacesSuggestionsOnly() {
        ErrorAnalysis original = ErrorAnalysis.rateLimited("X", 403, Duration.ofSeconds(12));

        ErrorAnalysis copy = original.withRecoverySuggestions(List.of("Switch to the app token"));

        assertThat(copy.recoverySuggestions()).containsExactly("Switch to the app token");
        assertThat(copy.retryDelay()).isEqualTo(Duration.ofSeconds(12));
        assertThat(copy.statusCode()).isEqualTo(403);
        assertThat(copy.kind()).isEqualTo(ErrorKind.RATE_LIMIT);
    }

    @Test
    void everyKind_hasAtLeastOneDefaultSuggestion() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(kind.defaultSuggestions()).as(kind.name()).isNotEmpty();
        }
    }
}
