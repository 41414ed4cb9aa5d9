package org.javai.ghresilience.retry;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Factory methods for common retry policies, including one resolved from
 * system properties and environment variables.
 *
 * <p>Recognized settings (system property / environment variable):</p>
 * <ul>
 *   <li>{@code ghresilience.retry.max-attempts} / {@code GH_RETRY_MAX_ATTEMPTS}</li>
 *   <li>{@code ghresilience.retry.base-delay} / {@code GH_RETRY_BASE_DELAY} (seconds)</li>
 *   <li>{@code ghresilience.retry.max-delay} / {@code GH_RETRY_MAX_DELAY} (seconds)</li>
 *   <li>{@code ghresilience.retry.exponential-base} / {@code GH_RETRY_EXPONENTIAL_BASE}</li>
 *   <li>{@code ghresilience.retry.jitter} / {@code GH_RETRY_JITTER}</li>
 *   <li>{@code ghresilience.retry.respect-rate-limits} / {@code GH_RETRY_RESPECT_RATE_LIMITS}</li>
 *   <li>{@code ghresilience.retry.timeout} / {@code GH_RETRY_TIMEOUT} (seconds, {@code 0} or {@code none} disables)</li>
 * </ul>
 * <p>System properties win over environment variables; unset settings keep their defaults.</p>
 */
public final class RetryPolicies {

    static final String PROPERTY_PREFIX = "ghresilience.retry.";
    static final String ENV_PREFIX = "GH_RETRY_";

    private RetryPolicies() {
        // Utility class
    }

    /**
     * A policy that makes exactly one attempt.
     */
    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * Resolves a policy from system properties and environment variables.
     *
     * @throws IllegalStateException if a setting is malformed or the resulting policy is invalid
     */
    public static RetryPolicy fromEnvironment() {
        return fromSources(System::getProperty, System::getenv);
    }

    static RetryPolicy fromSources(Function<String, String> properties, Function<String, String> environment) {
        Settings settings = new Settings(properties, environment);
        RetryPolicy.Builder builder = RetryPolicy.builder();

        settings.value("max-attempts").ifPresent(v -> builder.maxAttempts(settings.parseInt("max-attempts", v)));
        settings.value("base-delay").ifPresent(v -> builder.baseDelay(settings.parseSeconds("base-delay", v)));
        settings.value("max-delay").ifPresent(v -> builder.maxDelay(settings.parseSeconds("max-delay", v)));
        settings.value("exponential-base").ifPresent(
                v -> builder.exponentialBase(settings.parseDouble("exponential-base", v)));
        settings.value("jitter").ifPresent(v -> builder.jitter(settings.parseBoolean("jitter", v)));
        settings.value("respect-rate-limits").ifPresent(
                v -> builder.respectRateLimits(settings.parseBoolean("respect-rate-limits", v)));
        settings.value("timeout").ifPresent(v -> builder.timeout(settings.parseTimeout(v)));

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid retry configuration: " + e.getMessage(), e);
        }
    }

    private static final class Settings {
        private final Function<String, String> properties;
        private final Function<String, String> environment;

        private Settings(Function<String, String> properties, Function<String, String> environment) {
            this.properties = Objects.requireNonNull(properties, "properties must not be null");
            this.environment = Objects.requireNonNull(environment, "environment must not be null");
        }

        Optional<String> value(String name) {
            String value = properties.apply(PROPERTY_PREFIX + name);
            if (value == null || value.isBlank()) {
                value = environment.apply(envName(name));
            }
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(value.trim());
        }

        int parseInt(String name, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw malformed(name, value, e);
            }
        }

        double parseDouble(String name, String value) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw malformed(name, value, e);
            }
        }

        Duration parseSeconds(String name, String value) {
            try {
                BigDecimal seconds = new BigDecimal(value);
                return Duration.ofNanos(seconds.movePointRight(9).longValueExact());
            } catch (NumberFormatException | ArithmeticException e) {
                throw malformed(name, value, e);
            }
        }

        boolean parseBoolean(String name, String value) {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "true", "yes", "on", "1" -> true;
                case "false", "no", "off", "0" -> false;
                default -> throw malformed(name, value, null);
            };
        }

        Duration parseTimeout(String value) {
            if (value.equalsIgnoreCase("none")) {
                return null;
            }
            Duration timeout = parseSeconds("timeout", value);
            return timeout.isZero() ? null : timeout;
        }

        private static IllegalStateException malformed(String name, String value, Exception cause) {
            return new IllegalStateException(
                    "Malformed retry setting '" + PROPERTY_PREFIX + name + "' (or " + envName(name) + "): " + value,
                    cause);
        }

        private static String envName(String name) {
            return ENV_PREFIX + name.toUpperCase(Locale.ROOT).replace('-', '_');
        }
    }
}
