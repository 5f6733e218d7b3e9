package com.catalogenricher.enrichment.fetch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * External metadata source. Must be safe to call from several fetch workers at once.
 */
public interface MetadataSource {

    /**
     * Looks up one normalized identifier. The future completes with FOUND or NOT_FOUND, or exceptionally with a
     * {@link MetadataSourceException}. Implementations should give up after {@code timeout}.
     */
    CompletableFuture<MetadataLookup> fetchByIdentifier(String identifier, Duration timeout);
}
