package org.javai.ghresilience;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GitHubApiExceptionTest {

    @ParameterizedTest
    @EnumSource(ErrorKind.class)
    void from_buildsVariantMatchingKind(ErrorKind kind) {
        IOException cause = new IOException("boom");

        GitHubApiException error = GitHubApiException.from(ErrorAnalysis.of(kind, "IOException", null),
                cause, Map.of(ContextKeys.REPOSITORY, "acme/hw1-alice"));

        assertThat(error.kind()).isEqualTo(kind);
        assertThat(error.getCause()).isSameAs(cause);
        assertThat(error.contextValue(ContextKeys.REPOSITORY)).contains("acme/hw1-alice");
        assertThat(error.recoverySuggestions()).isNotEmpty();
    }

    @Test
    void from_selectsConcreteSubclasses() {
        assertThat(GitHubApiException.from(ErrorAnalysis.of(ErrorKind.AUTHENTICATION, "X", 401), null, Map.of()))
                .isInstanceOf(GitHubAuthenticationException.class);
        assertThat(GitHubApiException.from(ErrorAnalysis.of(ErrorKind.RESOURCE_NOT_FOUND, "X", 404), null, Map.of()))
                .isInstanceOf(GitHubResourceNotFoundException.class);
        assertThat(GitHubApiException.from(ErrorAnalysis.of(ErrorKind.NETWORK, "X", null), null, Map.of()))
                .isInstanceOf(GitHubNetworkException.class);
        assertThat(GitHubApiException.from(ErrorAnalysis.of(ErrorKind.DISCOVERY, "X", null), null, Map.of()))
                .isInstanceOf(GitHubDiscoveryException.class);
        assertThat(GitHubApiException.from(ErrorAnalysis.of(ErrorKind.GENERIC, "X", null), null, Map.of()))
                .isExactlyInstanceOf(GitHubApiException.class);
    }

    @Test
    void from_message_includesStatusAndCauseMessage() {
        GitHubApiException error = GitHubApiException.from(
                ErrorAnalysis.of(ErrorKind.SERVER, "RuntimeException", 503),
                new RuntimeException("upstream unavailable"),
                Map.of());

        assertThat(error).isInstanceOf(GitHubServerException.class);
        assertThat(error.getMessage()).isEqualTo("GitHub server error (HTTP 503): upstream unavailable");
        assertThat(((GitHubServerException) error).statusCode()).hasValue(503);
    }

    @Test
    void from_rateLimit_carriesRetryDelay() {
        GitHubApiException error = GitHubApiException.from(
                ErrorAnalysis.rateLimited("X", 429, Duration.ofSeconds(42)), null, Map.of());

        assertThat(error).isInstanceOf(GitHubRateLimitException.class);
        assertThat(((GitHubRateLimitException) error).retryAfter()).contains(Duration.ofSeconds(42));
        assertThat(error.getMessage()).isEqualTo("GitHub rate limit exceeded (HTTP 429)");
    }

    @Test
    void from_keepsAnalysisSuggestions() {
        ErrorAnalysis analysis = ErrorAnalysis.of(ErrorKind.AUTHENTICATION, "X", 401)
                .withRecoverySuggestions(List.of("Run gh auth refresh"));

        GitHubApiException error = GitHubApiException.from(analysis, null, Map.of());

        assertThat(error.recoverySuggestions()).containsExactly("Run gh auth refresh");
        assertThat(error.isRetryable()).isFalse();
    }

    @Test
    void withContext_returnsSameVariantWithMergedContext() {
        GitHubRateLimitException original = new GitHubRateLimitException("slow down", null,
                Map.of(ContextKeys.ORGANIZATION, "acme"), List.of(), Duration.ofSeconds(5));

        GitHubApiException copy = original.withContext(Map.of(ContextKeys.ATTEMPT, "3"));

        assertThat(copy).isInstanceOf(GitHubRateLimitException.class).isNotSameAs(original);
        assertThat(copy.context()).containsEntry(ContextKeys.ORGANIZATION, "acme")
                .containsEntry(ContextKeys.ATTEMPT, "3");
        assertThat(((GitHubRateLimitException) copy).retryAfter()).contains(Duration.ofSeconds(5));
        assertThat(copy.getMessage()).isEqualTo("slow down");
        assertThat(original.context()).doesNotContainKey(ContextKeys.ATTEMPT);
    }

    @Test
    void withContext_newEntriesWin() {
        GitHubApiException original = new GitHubNetworkException("reset", new IOException("reset"),
                Map.of(ContextKeys.REPOSITORY, "old"), List.of());

        GitHubApiException copy = original.withContext(Map.of(ContextKeys.REPOSITORY, "new"));

        assertThat(copy.contextValue(ContextKeys.REPOSITORY)).contains("new");
        assertThat(copy.getCause()).isSameAs(original.getCause());
        assertThat(copy.getStackTrace()).isEqualTo(original.getStackTrace());
    }

    @Test
    void withContext_empty_returnsSameInstance() {
        GitHubApiException original = new GitHubAuthenticationException("bad token");

        assertThat(original.withContext(Map.of())).isSameAs(original);
    }

    @Test
    void context_isImmutable() {
        GitHubApiException error = new GitHubApiException("x", null, Map.of("k", "v"));

        assertThatThrownBy(() -> error.context().put("other", "value"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void resourceNotFound_resource_prefersRepository() {
        GitHubResourceNotFoundException error = new GitHubResourceNotFoundException("missing", null,
                Map.of(ContextKeys.REPOSITORY, "acme/hw1-bob", ContextKeys.RESOURCE, "secrets/TOKEN"));
        GitHubResourceNotFoundException withoutRepository = new GitHubResourceNotFoundException("missing", null,
                Map.of(ContextKeys.RESOURCE, "teams/graders"));

        assertThat(error.resource()).contains("acme/hw1-bob");
        assertThat(withoutRepository.resource()).contains("teams/graders");
        assertThat(new GitHubResourceNotFoundException("missing").resource()).isEmpty();
    }

    @Test
    void discovery_exposesAssignmentPrefixAndOrganization() {
        GitHubDiscoveryException error = new GitHubDiscoveryException("No repositories match",
                Map.of(ContextKeys.ASSIGNMENT_PREFIX, "hw1", ContextKeys.ORGANIZATION, "acme"));

        assertThat(error.assignmentPrefix()).contains("hw1");
        assertThat(error.organization()).contains("acme");
        assertThat(error.isRetryable()).isFalse();
    }

    @Test
    void retryability_followsKind() {
        assertThat(new GitHubAuthenticationException("x").isRetryable()).isFalse();
        assertThat(new GitHubResourceNotFoundException("x").isRetryable()).isFalse();
        assertThat(new GitHubRateLimitException("x").isRetryable()).isTrue();
        assertThat(new GitHubNetworkException("x", null).isRetryable()).isTrue();
        assertThat(new GitHubServerException("x", 500).isRetryable()).isTrue();
        assertThat(new GitHubApiException("x").isRetryable()).isTrue();
    }

    @Test
    void toString_includesKindAndContext() {
        GitHubApiException error = new GitHubServerException("GitHub server error", null,
                Map.of(ContextKeys.OPERATION, "repos.list"), List.of(), 502);

        assertThat(error.toString())
                .contains("[SERVER]")
                .contains("GitHub server error")
                .contains("operation=repos.list");
    }
}
