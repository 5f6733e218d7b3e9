package com.catalogenricher.enrichment.fetch;

/**
 * Counts from one fetch pass. {@code attempted} rows reached a lookup (network or lookup cache);
 * {@code cancelled} rows were left PENDING by a stop request.
 */
public record FetchStats(int eligible, int attempted, int succeeded, int notFound, int cancelled, int lookupCacheHits,
                         int requests, int cooldowns, boolean stopped) {

    public static FetchStats empty() {
        return new FetchStats(0, 0, 0, 0, 0, 0, 0, 0, false);
    }

    public double successRate() {
        return attempted == 0 ? 0.0 : (double) succeeded / attempted;
    }
}
