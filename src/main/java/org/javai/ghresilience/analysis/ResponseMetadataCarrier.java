package org.javai.ghresilience.analysis;

import java.util.Optional;

/**
 * Implemented by exceptions from the API client that know the response which caused them.
 * The {@link ErrorAnalyzer} looks for carriers along the whole cause chain.
 */
@FunctionalInterface
public interface ResponseMetadataCarrier {

    Optional<ResponseMetadata> responseMetadata();
}
