package com.catalogenricher.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Per-run classification of a row relative to the metadata cache.
 */
public enum CacheCategory {

    EXISTING_VALID("existing_valid", false),
    EXISTING_VALID_INCOMPLETE("existing_valid_incomplete", true),
    EXISTING_STALE("existing_stale", true),
    NEW("new", true);

    private final String key;
    private final boolean fetchEligible;

    CacheCategory(String key, boolean fetchEligible) {
        this.key = key;
        this.fetchEligible = fetchEligible;
    }

    public String getKey() {
        return key;
    }

    /**
     * Whether rows in this category go to the fetcher and, once DONE, to the cache writer.
     */
    public boolean isFetchEligible() {
        return fetchEligible;
    }

    public static Optional<CacheCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(c -> c.key.equals(key)).findFirst();
    }
}
