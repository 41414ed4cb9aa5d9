package org.javai.ghresilience.retry;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Retrier} to wrap calls to the GitHub API client.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
