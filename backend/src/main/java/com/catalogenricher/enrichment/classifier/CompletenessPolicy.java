package com.catalogenricher.enrichment.classifier;

import com.catalogenricher.enrichment.cache.CacheEntry;

/**
 * Decides whether a cache hit holds everything the run needs, so the row can skip fetching.
 */
@FunctionalInterface
public interface CompletenessPolicy {

    boolean isComplete(CacheEntry entry);
}
