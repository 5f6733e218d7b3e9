package com.catalogenricher.enrichment.store;

import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.CachedBookUpsert;
import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.cache.BookCache;
import com.catalogenricher.enrichment.cache.CacheFieldMapper;
import com.catalogenricher.enrichment.config.CacheProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes fetched rows back to the book cache: exactly the rows that are DONE and in a fetch-eligible category.
 * Rows served from cache (FROM_DB) are never written. Failures are logged and counted, never thrown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheWriter {

    private final BookCache bookCache;
    private final CacheFieldMapper fieldMapper;
    private final CacheProperties cacheProperties;

    public CacheWriteResult write(WorkingTable table, ClassificationManifest manifest) {
        List<CachedBookUpsert> upserts = collect(table, manifest);
        if (!cacheProperties.isEnabled()) {
            log.info("Cache write skipped: cache disabled ({} rows eligible)", upserts.size());
            return CacheWriteResult.skipped(upserts.size());
        }
        if (upserts.isEmpty()) {
            return new CacheWriteResult(0, 0, 0, false);
        }
        int batchSize = Math.max(1, cacheProperties.getWriteBatchSize());
        int written = 0;
        int failedBatches = 0;
        for (int from = 0; from < upserts.size(); from += batchSize) {
            List<CachedBookUpsert> batch = upserts.subList(from, Math.min(from + batchSize, upserts.size()));
            try {
                written += bookCache.batchUpsert(batch, cacheProperties.getUpdateMode());
            } catch (RuntimeException e) {
                failedBatches++;
                log.warn("Cache write of {} records failed: {}", batch.size(), e.getMessage());
            }
        }
        log.info("Cache write: {} eligible, {} written, {} failed batches", upserts.size(), written, failedBatches);
        return new CacheWriteResult(upserts.size(), written, failedBatches, false);
    }

    List<CachedBookUpsert> collect(WorkingTable table, ClassificationManifest manifest) {
        List<CachedBookUpsert> upserts = new ArrayList<>();
        for (CatalogRecord record : table.records()) {
            if (record.getStatus() != RecordStatus.DONE || !manifest.isFetchEligible(record.getRowId())
                    || !record.hasBarcode()) {
                continue;
            }
            Map<String, String> fields = fieldMapper.toCacheFields(record);
            upserts.add(new CachedBookUpsert(record.getBarcode(), record.getNormalizedIdentifier(), fields));
        }
        return upserts;
    }
}
