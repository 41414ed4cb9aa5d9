package org.javai.ghresilience.analysis;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ResponseMetadataTest {

    @Test
    void headers_areCaseInsensitive() {
        ResponseMetadata metadata = ResponseMetadata.of(403, Map.of("x-ratelimit-remaining", "0"));

        assertThat(metadata.header("X-RateLimit-Remaining")).contains("0");
        assertThat(metadata.rateLimitRemaining()).hasValue(0);
    }

    @Test
    void invalidStatus_isRejected() {
        assertThatThrownBy(() -> ResponseMetadata.of(42))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResponseMetadata.of(600))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rateLimitReset_isEpochSeconds() {
        ResponseMetadata metadata = ResponseMetadata.of(403, Map.of(ResponseMetadata.RATE_LIMIT_RESET, "1705746600"));

        assertThat(metadata.rateLimitReset()).contains(Instant.parse("2024-01-20T10:30:00Z"));
    }

    @Test
    void rateLimitReset_beyondRepresentableInstants_isIgnored() {
        ResponseMetadata metadata = ResponseMetadata.of(429, Map.of(ResponseMetadata.RATE_LIMIT_RESET, "99999999999999999"));

        assertThat(metadata.rateLimitReset()).isEmpty();
    }

    @Test
    void retryAfter_readsNumericSeconds() {
        assertThat(ResponseMetadata.of(429, Map.of("Retry-After", " 30 ")).retryAfter())
                .contains(Duration.ofSeconds(30));
    }

    @Test
    void retryAfter_ignoresHttpDatesAndGarbage() {
        assertThat(ResponseMetadata.of(429, Map.of("Retry-After", "Wed, 21 Oct 2015 07:28:00 GMT")).retryAfter())
                .isEmpty();
        assertThat(ResponseMetadata.of(429, Map.of("Retry-After", "-5")).retryAfter()).isEmpty();
    }

    @Test
    void hasRateLimitSignals() {
        assertThat(ResponseMetadata.of(403, Map.of("X-RateLimit-Remaining", "0")).hasRateLimitSignals()).isTrue();
        assertThat(ResponseMetadata.of(403, Map.of("Retry-After", "60")).hasRateLimitSignals()).isTrue();
        assertThat(ResponseMetadata.of(403, Map.of("X-RateLimit-Remaining", "4999")).hasRateLimitSignals()).isFalse();
        assertThat(ResponseMetadata.of(403).hasRateLimitSignals()).isFalse();
    }

    @Test
    void isServerError() {
        assertThat(ResponseMetadata.of(500).isServerError()).isTrue();
        assertThat(ResponseMetadata.of(503).isServerError()).isTrue();
        assertThat(ResponseMetadata.of(404).isServerError()).isFalse();
    }

    @Test
    void headers_areUnmodifiable() {
        ResponseMetadata metadata = ResponseMetadata.of(200, Map.of("ETag", "abc"));

        assertThatThrownBy(() -> metadata.headers().put("Other", "x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void gitHubHttpException_exposesMetadata() {
        GitHubHttpException error = new GitHubHttpException("GET /orgs/acme/repos failed", 502, Map.of());

        assertThat(error.statusCode()).isEqualTo(502);
        assertThat(error.responseMetadata()).isPresent();
    }
}
