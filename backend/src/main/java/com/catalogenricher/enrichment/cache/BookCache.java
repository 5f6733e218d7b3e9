package com.catalogenricher.enrichment.cache;

import com.catalogenricher.domain.CacheUpdateMode;
import com.catalogenricher.domain.CachedBookUpsert;

import java.util.List;
import java.util.Optional;

/**
 * Read/write contract of the durable metadata cache, keyed by barcode.
 */
public interface BookCache {

    Optional<CacheEntry> getByKey(String barcode);

    /**
     * @return number of records written
     */
    int batchUpsert(List<CachedBookUpsert> records, CacheUpdateMode mode);
}
