package com.catalogenricher.domain;

import java.util.List;

/**
 * Bulk writes that Spring Data derived queries cannot express.
 */
public interface CachedBookRepositoryCustom {

    /**
     * Upserts by barcode in one unordered bulk. Keeps createdAt of existing documents, refreshes updatedAt and
     * bumps dataVersion. Returns matched + inserted documents.
     */
    int bulkUpsert(List<CachedBookUpsert> upserts, CacheUpdateMode mode);
}
