package com.catalogenricher.enrichment.preprocess;

import java.util.Optional;

/**
 * Looks up an identifier for a barcode through some external system (typically an automated browser session
 * against the library catalogue). Implementations need not be thread-safe; calls are sequential.
 */
public interface IdentifierResolver {

    /**
     * Starts the underlying session. Called once before the first {@link #resolve(String)}.
     */
    default void open() {
    }

    Optional<String> resolve(String barcode);

    default void close() {
    }
}
