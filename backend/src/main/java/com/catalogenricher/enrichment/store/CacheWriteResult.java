package com.catalogenricher.enrichment.store;

/**
 * Outcome of a cache write-back. {@code written} is what the cache acknowledged.
 */
public record CacheWriteResult(int eligible, int written, int failedBatches, boolean skipped) {

    public static CacheWriteResult skipped(int eligible) {
        return new CacheWriteResult(eligible, 0, 0, true);
    }
}
