package com.catalogenricher.enrichment.classifier;

import com.catalogenricher.enrichment.cache.CacheEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Decides whether a cache hit must be refreshed from the metadata source.
 */
@FunctionalInterface
public interface RefreshPolicy {

    boolean isStale(CacheEntry entry);

    default RefreshPolicy or(RefreshPolicy other) {
        return entry -> isStale(entry) || other.isStale(entry);
    }

    static RefreshPolicy never() {
        return entry -> false;
    }

    static RefreshPolicy forced() {
        return entry -> true;
    }

    /**
     * Stale when last refreshed more than {@code maxAge} ago, or when the refresh time is unknown.
     */
    static RefreshPolicy olderThan(Duration maxAge, Clock clock) {
        return entry -> {
            Instant updatedAt = entry.updatedAt();
            return updatedAt == null || updatedAt.isBefore(clock.instant().minus(maxAge));
        };
    }

    /**
     * Stale when any of the given logical fields is missing or blank.
     */
    static RefreshPolicy missingAnyOf(Collection<String> fields) {
        List<String> required = List.copyOf(fields);
        return entry -> required.stream().anyMatch(f -> !entry.hasField(f));
    }
}
