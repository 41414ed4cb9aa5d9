package org.javai.ghresilience.analysis;

import org.javai.ghresilience.ErrorAnalysis;

/**
 * Classifies exceptions raised by GitHub API calls.
 * Implementations must be deterministic and free of side effects.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies an exception into an {@link ErrorAnalysis}.
     *
     * @param error The exception that occurred
     * @return The classification
     */
    ErrorAnalysis analyze(Throwable error);
}
